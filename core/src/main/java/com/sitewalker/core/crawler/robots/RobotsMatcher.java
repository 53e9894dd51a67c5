package com.sitewalker.core.crawler.robots;

import java.net.URI;
import java.util.Objects;

/**
 * robots 규칙 판정.
 *
 * 매칭 대상: rawPath(+ "?" + rawQuery), 퍼센트 HEX 는 대문자로 통일(디코드 안 함).
 * 규칙 문법: 단순 접두, '*' 는 0자 이상, 끝의 '$' 는 경로 끝 고정.
 * 우선순위: 유효 길이('*', 끝 '$' 제외)가 긴 규칙, 같으면 Allow. 매칭 없으면 허용.
 */
public final class RobotsMatcher {
    private RobotsMatcher() {}

    public static boolean isAllowed(URI url, RobotsRules rules) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(rules, "rules");

        String path = normalizePath(url);
        int bestLen = -1;
        boolean bestAllow = true;

        for (String rule : rules.disallow()) {
            int len = effectiveLen(rule);
            if (len > bestLen && matches(path, rule)) {
                bestLen = len;
                bestAllow = false;
            }
        }
        for (String rule : rules.allow()) {
            int len = effectiveLen(rule);
            // 같은 길이면 Allow 가 이긴다
            if (len >= bestLen && matches(path, rule)) {
                bestLen = len;
                bestAllow = true;
            }
        }
        return bestAllow;
    }

    /** 규칙 값 정규화(퍼센트 HEX 대문자). '*' / '$' 는 그대로 */
    static String normalizeRule(String rule) {
        if (rule == null) return "";
        return uppercasePctHex(rule.trim());
    }

    static boolean matches(String path, String rule) {
        if (rule == null || rule.isBlank()) return false;
        String r = rule.trim();
        boolean anchored = r.endsWith("$");
        if (anchored) r = r.substring(0, r.length() - 1);

        if (r.indexOf('*') < 0) {
            return anchored ? path.equals(r) : path.startsWith(r);
        }

        // '*' 로 쪼갠 조각을 왼쪽부터 가장 이른 위치에 맞춘다
        String[] parts = r.split("\\*", -1);
        if (!path.startsWith(parts[0])) return false;
        int pos = parts[0].length();

        for (int i = 1; i < parts.length - 1; i++) {
            int at = path.indexOf(parts[i], pos);
            if (at < 0) return false;
            pos = at + parts[i].length();
        }

        String last = parts[parts.length - 1];
        if (anchored) {
            return path.length() - last.length() >= pos && path.endsWith(last);
        }
        return path.indexOf(last, pos) >= 0;
    }

    /** URL → 매칭 대상 문자열 */
    static String normalizePath(URI uri) {
        String rawPath = uri.getRawPath();
        if (rawPath == null || rawPath.isEmpty()) rawPath = "/";
        String q = uri.getRawQuery();
        return uppercasePctHex(q == null ? rawPath : rawPath + "?" + q);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char ch = s.charAt(i);
            if (ch == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%')
                   .append(Character.toUpperCase(s.charAt(i + 1)))
                   .append(Character.toUpperCase(s.charAt(i + 2)));
                i += 3;
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }

    /** 우선순위 길이: '*' 와 끝의 '$' 는 세지 않음 */
    static int effectiveLen(String raw) {
        if (raw == null) return 0;
        String r = raw.trim();
        int end = r.endsWith("$") ? r.length() - 1 : r.length();
        int score = 0;
        for (int i = 0; i < end; i++) {
            if (r.charAt(i) != '*') score++;
        }
        return score;
    }
}
