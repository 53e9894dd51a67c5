package com.sitewalker.core.crawler;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * 방문 대기 URL 을 담는 양방향 컨테이너. pop 은 항상 앞(front)에서 꺼낸다.
 * - pushDepthFirst: 앞에 넣음 → 바로 다음 pop 대상(스택)
 * - pushBreadthFirst: 뒤에 넣음 → 현재 대기열이 모두 빠진 뒤 pop(큐)
 * 중복 삽입을 허용한다. 중복 제거는 꺼낼 때 VisitedSet 으로 한다.
 */
public final class Frontier {

    private final Deque<URI> deque = new ArrayDeque<>();

    public void pushDepthFirst(URI url) {
        deque.addFirst(Objects.requireNonNull(url, "url"));
    }

    public void pushBreadthFirst(URI url) {
        deque.addLast(Objects.requireNonNull(url, "url"));
    }

    public Optional<URI> pop() {
        return Optional.ofNullable(deque.pollFirst());
    }

    public boolean isEmpty() {
        return deque.isEmpty();
    }

    public int size() {
        return deque.size();
    }
}
