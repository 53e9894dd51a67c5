package com.sitewalker.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 순회 설정 (walk.yml 매핑 대상). 순수 설정 보관용.
 * strategy 는 문자열 그대로 보관하고, 해석은 순회 시작 시 Strategy.resolve 가 담당한다.
 */
public final class WalkConfig {

    /** 링크 추출 방식: 정규식(기본) 또는 jsoup DOM */
    public enum ExtractorKind { PATTERN, JSOUP }

    /** YAML `robots:` 섹션 */
    public static final class RobotsCfg {
        /** robots.txt 존중 여부 (기본 true) */
        private boolean respect = true;

        public boolean isRespect() { return respect; }
        public void setRespect(boolean respect) { this.respect = respect; }
    }

    /** YAML `failures:` 섹션 */
    public static final class FailuresCfg {
        /** 연속 fetch 실패가 이 값에 도달하면 순회 중단. 0 이면 끝까지 흡수 */
        private int abortAfterConsecutive = 0;

        public int getAbortAfterConsecutive() { return abortAfterConsecutive; }
        public void setAbortAfterConsecutive(int v) { this.abortAfterConsecutive = Math.max(0, v); }
    }

    public static final String DEFAULT_USER_AGENT = "SiteWalker";

    // ---------- 기본 필드 ----------
    private String start;                 // 시작 URL (필수)
    private String strategy;              // null 이면 BREADTH_FIRST
    private String userAgent = DEFAULT_USER_AGENT;
    private Duration timeout = Duration.ofSeconds(10);
    private boolean followRedirects = true;
    private int maxPages = 0;             // 0 = 무제한
    private ExtractorKind extractor = ExtractorKind.PATTERN;
    private Path outputDir = Path.of("out");

    private RobotsCfg robots = new RobotsCfg();
    private FailuresCfg failures = new FailuresCfg();

    public static WalkConfig defaults() { return new WalkConfig(); }

    // ---------- getters ----------
    public String getStart() { return start; }
    public String getStrategy() { return strategy; }
    public String getUserAgent() { return userAgent; }
    public Duration getTimeout() { return timeout; }
    public long getTimeoutMs() { return timeout.toMillis(); }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getMaxPages() { return maxPages; }
    public ExtractorKind getExtractor() { return extractor; }
    public Path getOutputDir() { return outputDir; }
    public RobotsCfg getRobots() { return robots; }
    public FailuresCfg getFailures() { return failures; }

    // ---------- fluent setters ----------
    public WalkConfig setStart(String start) { this.start = start; return this; }
    public WalkConfig setStrategy(String strategy) { this.strategy = strategy; return this; }
    public WalkConfig setUserAgent(String ua) {
        this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua.trim();
        return this;
    }
    public WalkConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public WalkConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(ms); return this; }
    public WalkConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public WalkConfig setMaxPages(int maxPages) { this.maxPages = Math.max(0, maxPages); return this; }
    public WalkConfig setExtractor(ExtractorKind kind) {
        this.extractor = (kind != null ? kind : ExtractorKind.PATTERN);
        return this;
    }
    public WalkConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public WalkConfig setRobots(RobotsCfg robots) { this.robots = (robots != null ? robots : new RobotsCfg()); return this; }
    public WalkConfig setFailures(FailuresCfg failures) {
        this.failures = (failures != null ? failures : new FailuresCfg());
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(start, "start");
        if (start.isBlank()) throw new IllegalArgumentException("start must not be blank");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        Objects.requireNonNull(outputDir, "outputDir");
    }

    @Override
    public String toString() {
        return "WalkConfig{start=" + start +
                ", strategy=" + strategy +
                ", userAgent=" + userAgent +
                ", timeout=" + timeout +
                ", followRedirects=" + followRedirects +
                ", maxPages=" + maxPages +
                ", extractor=" + extractor +
                ", respectRobots=" + robots.isRespect() +
                ", abortAfterConsecutive=" + failures.getAbortAfterConsecutive() +
                '}';
    }
}
