package com.sitewalker.core.crawler;

import com.sitewalker.core.api.ICrawler;
import com.sitewalker.core.crawler.robots.PermissionCheck;
import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.util.UrlUtils;

import java.net.URI;
import java.util.Objects;

/**
 * same-host 링크 그래프 순회 엔진.
 * 엔진 자체는 불변이며, traverse 호출마다 새 Frontier/VisitedSet 을 가진 {@link Traversal} 을 만든다.
 */
public final class TraversalEngine implements ICrawler {

    private final LinkSource linkSource;
    private final PermissionCheck permissionCheck;
    private final String userAgent;
    private final TraversalListener listener;
    private final int maxPages;
    private final int abortAfterConsecutiveFailures;

    private TraversalEngine(Builder b) {
        this.linkSource = b.linkSource;
        this.permissionCheck = b.permissionCheck;
        this.userAgent = b.userAgent;
        this.listener = b.listener;
        this.maxPages = b.maxPages;
        this.abortAfterConsecutiveFailures = b.abortAfterConsecutiveFailures;
    }

    public static Builder builder(LinkSource linkSource) {
        return new Builder(linkSource);
    }

    /** 설정값(UA/maxPages/실패 한도)만 반영. robots 게이트는 호출자가 준비해서 넘긴다 */
    public static Builder builder(LinkSource linkSource, WalkConfig cfg) {
        return new Builder(linkSource)
                .userAgent(cfg.getUserAgent())
                .maxPages(cfg.getMaxPages())
                .abortAfterConsecutiveFailures(cfg.getFailures().getAbortAfterConsecutive());
    }

    /**
     * 전략 이름을 먼저 해석하고(실패 시 즉시 예외, 부작용 없음) 순회를 만든다.
     *
     * @throws UnknownStrategyException 인식하지 못한 전략 이름
     * @throws IllegalArgumentException 시작 URL 이 절대 http(s) URL 이 아님
     */
    @Override
    public Traversal traverse(String startUrl, String strategyName) {
        Strategy strategy = Strategy.resolve(strategyName);
        return traverse(UrlUtils.parse(startUrl), strategy);
    }

    public Traversal traverse(URI startUrl, Strategy strategy) {
        Objects.requireNonNull(startUrl, "startUrl");
        Objects.requireNonNull(strategy, "strategy");
        return new Traversal(UrlUtils.normalize(startUrl), strategy, this);
    }

    LinkSource linkSource() { return linkSource; }
    PermissionCheck permissionCheck() { return permissionCheck; }
    String userAgent() { return userAgent; }
    TraversalListener listener() { return listener; }
    int maxPages() { return maxPages; }
    int abortAfterConsecutiveFailures() { return abortAfterConsecutiveFailures; }

    public static final class Builder {
        private final LinkSource linkSource;
        private PermissionCheck permissionCheck = PermissionCheck.ALLOW_ALL;
        private String userAgent = WalkConfig.DEFAULT_USER_AGENT;
        private TraversalListener listener = TraversalListener.NONE;
        private int maxPages = 0;
        private int abortAfterConsecutiveFailures = 0;

        private Builder(LinkSource linkSource) {
            this.linkSource = Objects.requireNonNull(linkSource, "linkSource");
        }

        public Builder permissionCheck(PermissionCheck check) {
            this.permissionCheck = (check != null ? check : PermissionCheck.ALLOW_ALL);
            return this;
        }

        public Builder userAgent(String ua) {
            this.userAgent = (ua == null || ua.isBlank()) ? WalkConfig.DEFAULT_USER_AGENT : ua;
            return this;
        }

        public Builder listener(TraversalListener listener) {
            this.listener = (listener != null ? listener : TraversalListener.NONE);
            return this;
        }

        /** 0 = 무제한 */
        public Builder maxPages(int maxPages) {
            this.maxPages = Math.max(0, maxPages);
            return this;
        }

        /** 0 = 비활성(모든 실패를 흡수) */
        public Builder abortAfterConsecutiveFailures(int n) {
            this.abortAfterConsecutiveFailures = Math.max(0, n);
            return this;
        }

        public TraversalEngine build() {
            return new TraversalEngine(this);
        }
    }
}
