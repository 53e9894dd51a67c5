package com.sitewalker.core.crawler;

import java.net.URI;
import java.util.Locale;

/**
 * 순회 전략. 각 상수가 Frontier 삽입 방식을 갖는다.
 *
 * DEPTH_FIRST 는 한 페이지의 링크를 발견 순서대로 앞에 넣으므로
 * 같이 발견된 형제는 역순으로 탐색된다(A→[B,C], B→[D] 이면 A, C, B, D).
 */
public enum Strategy {

    DEPTH_FIRST("depth-first") {
        @Override public void push(Frontier frontier, URI url) { frontier.pushDepthFirst(url); }
    },
    BREADTH_FIRST("breadth-first") {
        @Override public void push(Frontier frontier, URI url) { frontier.pushBreadthFirst(url); }
    };

    /** 이름이 주어지지 않았을 때 */
    public static final Strategy DEFAULT = BREADTH_FIRST;

    private final String label;

    Strategy(String label) {
        this.label = label;
    }

    public abstract void push(Frontier frontier, URI url);

    public String label() { return label; }

    /**
     * 이름 → 전략. 대소문자 무시, '_' / ' ' 는 '-' 와 같게 본다.
     * 인식: depth-first | dfs | breadth-first | bfs. null/빈 값은 {@link #DEFAULT}.
     *
     * @throws UnknownStrategyException 인식하지 못한 이름
     */
    public static Strategy resolve(String name) {
        if (name == null || name.isBlank()) return DEFAULT;
        String key = name.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        return switch (key) {
            case "depth-first", "dfs" -> DEPTH_FIRST;
            case "breadth-first", "bfs" -> BREADTH_FIRST;
            default -> throw new UnknownStrategyException(name);
        };
    }
}
