package com.sitewalker.core.crawler.robots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * robots.txt 를 한 번 받아 RobotsPolicy 로 만든다.
 * - 2xx: 파싱
 * - 같은 호스트로의 리다이렉트는 최대 3회 추적(스킴 전환 OK)
 * - 네트워크 오류 / 4xx / 5xx / 크로스-호스트 리다이렉트: allow-all
 */
public final class RobotsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RobotsLoader.class);
    private static final int MAX_REDIRECTS = 3;

    private final RobotsFetcher fetcher;

    public RobotsLoader(RobotsFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /** page 가 속한 호스트의 robots.txt 위치: scheme://host[:port]/robots.txt */
    public static URI robotsUrlFor(URI page) {
        Objects.requireNonNull(page, "page");
        String host = page.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("url has no host: " + page);
        }
        String scheme = Optional.ofNullable(page.getScheme()).orElse("https").toLowerCase(Locale.ROOT);
        int port = page.getPort();
        String authority = (port < 0) ? host : host + ":" + port;
        return URI.create(scheme + "://" + authority + "/robots.txt");
    }

    public RobotsPolicy prepareFor(URI page) {
        return prepare(robotsUrlFor(page));
    }

    public RobotsPolicy prepare(URI robotsUrl) {
        Objects.requireNonNull(robotsUrl, "robotsUrl");
        String scheme = Optional.ofNullable(robotsUrl.getScheme()).orElse("").toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return RobotsPolicy.allowAll();
        }

        URI cur = robotsUrl;
        for (int i = 0; i <= MAX_REDIRECTS; i++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);

            if (r.isFailure()) {
                LOG.warn("robots.txt fetch failed for {}: {} (allowing all)", cur, r.errorMessage().orElse("unknown"));
                return RobotsPolicy.allowAll();
            }
            if (r.isSuccess()) {
                LOG.info("robots.txt loaded from {}", cur);
                return RobotsPolicy.parse(r.body());
            }
            if (r.isRedirect()) {
                if (!sameHost(cur, r.location())) {
                    LOG.warn("robots.txt at {} redirects off-host to {} (allowing all)", cur, r.location());
                    return RobotsPolicy.allowAll();
                }
                LOG.debug("robots.txt at {} redirects to {}", cur, r.location());
                cur = r.location();
                continue;
            }
            LOG.info("robots.txt at {} answered HTTP {} (allowing all)", cur, r.status());
            return RobotsPolicy.allowAll();
        }
        LOG.warn("robots.txt at {}: too many redirects (allowing all)", robotsUrl);
        return RobotsPolicy.allowAll();
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = Optional.ofNullable(a.getHost()).orElse("").toLowerCase(Locale.ROOT);
        String hb = Optional.ofNullable(b.getHost()).orElse("").toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }
}
