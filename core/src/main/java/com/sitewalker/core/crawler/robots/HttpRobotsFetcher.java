package com.sitewalker.core.crawler.robots;

import com.sitewalker.core.model.WalkConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 robots.txt 요청기 (text/plain, UTF-8) */
public final class HttpRobotsFetcher implements RobotsFetcher {
    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    /** 리다이렉트는 RobotsLoader 가 판단하므로 Redirect.NEVER 클라이언트를 만든다 */
    public HttpRobotsFetcher(String userAgent, Duration timeout) {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build(), userAgent, timeout);
    }

    public HttpRobotsFetcher(HttpClient client, String userAgent, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? WalkConfig.DEFAULT_USER_AGENT : userAgent;
        this.timeout = (timeout == null) ? Duration.ofSeconds(5) : timeout;
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                .GET()
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/plain,*/*;q=0.8")
                .build();
        try {
            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();
            if (code >= 300 && code < 400) {
                // Location 만 넘기고 본문은 버림
                return res.headers().firstValue("Location")
                        .map(loc -> Response.redirect(code, robotsTxtUri.resolve(loc.trim())))
                        .orElseGet(() -> Response.ok(code, ""));
            }
            return Response.ok(code, res.body());
        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted");
        }
    }
}
