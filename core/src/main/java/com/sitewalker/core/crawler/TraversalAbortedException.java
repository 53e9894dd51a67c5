package com.sitewalker.core.crawler;

import java.net.URI;

/** 연속 fetch 실패가 설정 한도에 도달해 순회를 멈춤. 그때까지 방출된 URL 은 유효하다. */
public class TraversalAbortedException extends RuntimeException {

    private final int consecutiveFailures;
    private final int visitedCount;

    public TraversalAbortedException(URI lastFailed, int consecutiveFailures, int visitedCount, FetchException cause) {
        super("Traversal aborted after " + consecutiveFailures + " consecutive fetch failures (last: "
                + lastFailed + ", visited so far: " + visitedCount + ")", cause);
        this.consecutiveFailures = consecutiveFailures;
        this.visitedCount = visitedCount;
    }

    public int getConsecutiveFailures() { return consecutiveFailures; }
    public int getVisitedCount() { return visitedCount; }
}
