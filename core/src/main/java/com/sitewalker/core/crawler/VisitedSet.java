package com.sitewalker.core.crawler;

import java.net.URI;
import java.util.HashSet;
import java.util.Set;

/**
 * 이미 방문(방출)한 URL 집합. 순회 1회 동안만 살아 있고 줄어들지 않는다.
 * 스레드 안전하지 않음.
 */
public final class VisitedSet {

    private final Set<URI> visited = new HashSet<>();

    public boolean contains(URI url) {
        return visited.contains(url);
    }

    /** 멱등. 새로 기록했으면 true */
    public boolean mark(URI url) {
        return visited.add(url);
    }

    public int size() {
        return visited.size();
    }
}
