package com.sitewalker.core.crawler;

import com.sitewalker.core.model.WalkConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http 기반 페이지 다운로더.
 * - GET 1회, 재시도 없음
 * - 2xx 만 성공. 그 외 상태는 FetchException(HTTP_STATUS)
 * - 본문 charset 은 Content-Type 을 따르고 없으면 UTF-8
 * - 리다이렉트를 따라갔다면 FetchedPage.url 은 최종 주소
 */
public final class HttpPageFetcher implements PageFetcher {

    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    public HttpPageFetcher(HttpClient client, String userAgent, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? WalkConfig.DEFAULT_USER_AGENT : userAgent;
        this.timeout = (timeout == null) ? Duration.ofSeconds(10) : timeout;
    }

    public static HttpPageFetcher from(WalkConfig cfg) {
        return new HttpPageFetcher(newClient(cfg), cfg.getUserAgent(), cfg.getTimeout());
    }

    /** 설정에 맞춘 HttpClient (리다이렉트/연결 타임아웃) */
    public static HttpClient newClient(WalkConfig cfg) {
        return HttpClient.newBuilder()
                .followRedirects(cfg.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(cfg.getTimeout())
                .build();
    }

    @Override
    public FetchedPage fetch(URI url) throws FetchException {
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(url)
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, FetchException.Kind.IO, "invalid request url: " + url, e);
        }

        HttpResponse<String> res;
        try {
            res = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FetchException(url, FetchException.Kind.IO, "fetch failed: " + url + " (" + e + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, FetchException.Kind.INTERRUPTED, "fetch interrupted: " + url, e);
        }

        int code = res.statusCode();
        if (code < 200 || code >= 300) {
            throw FetchException.httpStatus(url, code);
        }
        URI finalUrl = (res.uri() == null) ? url : res.uri();
        return new FetchedPage(finalUrl, res.body());
    }
}
