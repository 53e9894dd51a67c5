package com.sitewalker.core.crawler.robots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서
 * - 지원 지시어: User-agent / Allow / Disallow (키 대소문자 무시). 그 외(Crawl-delay, Sitemap 등)는 무시
 * - 연속된 User-agent 라인은 "같은 그룹"으로 취급, 그 뒤 Allow/Disallow 누적
 * - UA 저장: 소문자
 * - 규칙 값: 빈 값은 무시, 퍼센트 HEX 대문자 정규화만 수행
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";

        // UA(소문자) → 규칙
        Map<String, RobotsRules> byUa = new LinkedHashMap<>();

        List<String> currentAgents = new ArrayList<>();
        boolean lastWasUA = false;

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            switch (key) {
                case "user-agent" -> {
                    String ua = (val.isEmpty() ? UA_ALL : val).toLowerCase(Locale.ROOT);
                    if (!lastWasUA) {
                        // 새 그룹 시작
                        currentAgents = new ArrayList<>();
                    }
                    currentAgents.add(ua);
                    byUa.putIfAbsent(ua, new RobotsRules());
                    lastWasUA = true;
                }
                case "allow", "disallow" -> {
                    // User-agent 앞에 나온 규칙은 어느 그룹에도 속하지 않음
                    if (!currentAgents.isEmpty() && !val.isEmpty()) {
                        String norm = RobotsMatcher.normalizeRule(val);
                        for (String ua : currentAgents) {
                            if (key.equals("allow")) byUa.get(ua).addAllow(norm);
                            else byUa.get(ua).addDisallow(norm);
                        }
                    }
                    lastWasUA = false;
                }
                default -> lastWasUA = false;
            }
        }

        return new ParsedRobots(Collections.unmodifiableMap(byUa));
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** UA 선택 포함 파싱 결과 */
    public record ParsedRobots(Map<String, RobotsRules> byUa) {

        /**
         * UA 선택 순서:
         * 1) 전체 문자열 정확 일치(대소문자 무시)
         * 2) 제품 토큰("SiteWalker/1.0" → "sitewalker") 일치
         * 3) "*" 그룹, 없으면 빈 규칙(전체 허용)
         */
        public RobotsRules selectFor(String userAgent) {
            String ua = (userAgent == null || userAgent.isBlank())
                    ? UA_ALL
                    : userAgent.trim().toLowerCase(Locale.ROOT);
            RobotsRules exact = byUa.get(ua);
            if (exact != null) return exact;

            int slash = ua.indexOf('/');
            if (slash > 0) {
                RobotsRules token = byUa.get(ua.substring(0, slash));
                if (token != null) return token;
            }
            RobotsRules star = byUa.get(UA_ALL);
            return (star != null ? star : new RobotsRules());
        }
    }
}
