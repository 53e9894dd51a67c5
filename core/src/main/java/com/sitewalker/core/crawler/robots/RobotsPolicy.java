package com.sitewalker.core.crawler.robots;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * 한 호스트의 robots.txt 를 파싱해 둔 불변 정책.
 * RobotsLoader.prepare(...) 로 한 번 만들고 필요한 곳에 참조로 넘긴다.
 */
public final class RobotsPolicy implements PermissionCheck {

    public static final String DEFAULT_UA = "*";

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(new RobotsParser.ParsedRobots(Map.of()), true);

    private final RobotsParser.ParsedRobots parsed;
    private final boolean allowAll;

    private RobotsPolicy(RobotsParser.ParsedRobots parsed, boolean allowAll) {
        this.parsed = Objects.requireNonNull(parsed, "parsed");
        this.allowAll = allowAll;
    }

    /** robots.txt 본문 → 정책 */
    public static RobotsPolicy parse(String robotsTxt) {
        return new RobotsPolicy(RobotsParser.parse(robotsTxt), false);
    }

    /** 실패/없음 시 전체 허용 정책 */
    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    @Override
    public boolean isAllowed(URI url, String userAgent) {
        if (allowAll) return true;
        Objects.requireNonNull(url, "url");
        return RobotsMatcher.isAllowed(url, parsed.selectFor(userAgent));
    }

    /** UA "*" 기준 판정 */
    public boolean isAllowed(URI url) {
        return isAllowed(url, DEFAULT_UA);
    }

    public boolean isAllowAll() {
        return allowAll;
    }
}
