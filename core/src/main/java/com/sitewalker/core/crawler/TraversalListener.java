package com.sitewalker.core.crawler;

import java.net.URI;

/** 순회 진행 콜백. 모든 메서드는 기본 no-op. */
public interface TraversalListener {

    /** 방출 직후 (이미 VisitedSet 에 기록됨) */
    default void onVisit(URI url, int visitedCount) {}

    /** LinkSource 실패. 해당 URL 의 링크는 빈 것으로 간주된다 */
    default void onFetchFailure(URI url, FetchException failure) {}

    /** 방출하지 않고 건너뜀 (reason: "robots" 등) */
    default void onSkipped(URI url, String reason) {}

    /** DONE 진입 */
    default void onDone(int visitedCount) {}

    TraversalListener NONE = new TraversalListener() {};
}
