package com.sitewalker.core.crawler;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LinkSource 한 번 호출의 결과.
 * "링크 0개"와 "가져오기 실패"를 구분한다.
 */
public final class LinkResult {

    private static final LinkResult EMPTY = new LinkResult(List.of(), null);

    private final List<URI> links;
    private final FetchException failure;

    private LinkResult(List<URI> links, FetchException failure) {
        this.links = links;
        this.failure = failure;
    }

    public static LinkResult ok(List<URI> links) {
        if (links == null || links.isEmpty()) return EMPTY;
        return new LinkResult(List.copyOf(links), null);
    }

    public static LinkResult failed(FetchException failure) {
        return new LinkResult(List.of(), Objects.requireNonNull(failure, "failure"));
    }

    /** 실패면 빈 목록 */
    public List<URI> links() { return links; }

    public boolean isFailure() { return failure != null; }

    public Optional<FetchException> failure() { return Optional.ofNullable(failure); }

    @Override
    public String toString() {
        return isFailure()
                ? "LinkResult{failed=" + failure.getMessage() + '}'
                : "LinkResult{links=" + links.size() + '}';
    }
}
