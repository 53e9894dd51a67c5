package com.sitewalker.core.crawler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정규식 기반 추출기.
 * 태그 안에서 속성(href/src) 뒤의 첫 따옴표 문자열을 non-greedy 로 캡처한다.
 * 닫는 따옴표가 없는 깨진 태그는 매치되지 않는다(예외 없음).
 */
public final class PatternHrefExtractor implements HrefExtractor {

    private static final PatternHrefExtractor ANCHORS =
            new PatternHrefExtractor(Pattern.compile("<a[^>]+href=[\"'](.*?)[\"']", Pattern.CASE_INSENSITIVE));
    private static final PatternHrefExtractor IMAGES =
            new PatternHrefExtractor(Pattern.compile("<img[^>]+src=[\"'](.*?)[\"']", Pattern.CASE_INSENSITIVE));

    private final Pattern pattern;

    private PatternHrefExtractor(Pattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    /** {@code <a ... href="...">} */
    public static PatternHrefExtractor anchors() { return ANCHORS; }

    /** {@code <img ... src="...">} */
    public static PatternHrefExtractor images() { return IMAGES; }

    @Override
    public List<String> extract(String content) {
        List<String> out = new ArrayList<>();
        if (content == null || content.isEmpty()) return out;
        Matcher m = pattern.matcher(content);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }
}
