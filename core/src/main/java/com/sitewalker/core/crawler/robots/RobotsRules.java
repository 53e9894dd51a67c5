package com.sitewalker.core.crawler.robots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** UA 그룹 하나의 Allow/Disallow 규칙(정규화된 값) */
public final class RobotsRules {
    private final List<String> allow = new ArrayList<>();
    private final List<String> disallow = new ArrayList<>();

    RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(path.trim());
        return this;
    }

    RobotsRules addDisallow(String path) {
        // Disallow: (빈값) 은 규칙으로 취급하지 않음
        if (path != null && !path.isBlank()) disallow.add(path.trim());
        return this;
    }

    public List<String> allow() { return Collections.unmodifiableList(allow); }
    public List<String> disallow() { return Collections.unmodifiableList(disallow); }

    public boolean isEmpty() { return allow.isEmpty() && disallow.isEmpty(); }
}
