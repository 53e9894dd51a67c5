package com.sitewalker.core.crawler.robots;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class RobotsPolicyTest {

    private static final String ROBOTS = """
            User-agent: *
            Disallow: /private

            User-agent: SiteWalker
            Disallow: /walker-only
            """;

    @Test
    void user_agent_selects_group() {
        RobotsPolicy p = RobotsPolicy.parse(ROBOTS);
        URI walkerOnly = URI.create("https://ex.com/walker-only");
        URI priv = URI.create("https://ex.com/private");

        assertFalse(p.isAllowed(walkerOnly, "SiteWalker"));
        assertTrue(p.isAllowed(priv, "SiteWalker")); // 전용 그룹이 있으면 '*' 는 보지 않음
        assertTrue(p.isAllowed(walkerOnly));
        assertFalse(p.isAllowed(priv));
    }

    @Test
    void allow_all_is_shared_and_permissive() {
        assertSame(RobotsPolicy.allowAll(), RobotsPolicy.allowAll());
        assertTrue(RobotsPolicy.allowAll().isAllowed(URI.create("https://ex.com/private"), "x"));
        assertFalse(RobotsPolicy.parse("").isAllowAll());
    }

    @Test
    void works_as_permission_check() {
        PermissionCheck check = RobotsPolicy.parse(ROBOTS);
        assertFalse(check.isAllowed(URI.create("https://ex.com/private/a"), "AnyBot"));
        assertTrue(PermissionCheck.ALLOW_ALL.isAllowed(URI.create("https://ex.com/private/a"), "AnyBot"));
    }
}
