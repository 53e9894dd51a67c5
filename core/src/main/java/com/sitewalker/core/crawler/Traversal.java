package com.sitewalker.core.crawler;

import com.sitewalker.core.crawler.robots.PermissionCheck;
import com.sitewalker.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 순회 1회분. 방문 순서대로 URL 을 지연(lazy) 방출한다.
 *
 * 루프: pop → 이미 방문/거부됐으면 버림 → robots 거부면 건너뜀(1회만 보고) → 방문 기록 + 방출
 *      → (다음 요청 시) LinkSource 로 확장 → 미방문 링크를 전략대로 push.
 * URL X 의 확장은 X 를 방출한 뒤, 다음 원소를 요청받을 때 일어난다.
 *
 * Frontier/VisitedSet 은 이 인스턴스가 독점한다. 한 스레드에서 한 번만 소비할 것.
 */
public final class Traversal implements Iterator<URI>, Iterable<URI> {

    private static final Logger LOG = LoggerFactory.getLogger(Traversal.class);

    private final URI start;
    private final Strategy strategy;
    private final LinkSource linkSource;
    private final PermissionCheck permissionCheck;
    private final String userAgent;
    private final TraversalListener listener;
    private final int maxPages;
    private final int abortAfterConsecutiveFailures;

    private final Frontier frontier = new Frontier();
    private final VisitedSet visited = new VisitedSet();
    private final Set<URI> disallowed = new HashSet<>(); // robots 거부. 방문으로 치지 않는다

    private TraversalState state = TraversalState.INIT;
    private URI next;          // hasNext() 가 찾아둔 다음 방출 후보 (아직 미방문 기록)
    private URI toExpand;      // 방출은 됐지만 아직 확장하지 않은 URL
    private int consecutiveFailures;
    private int failures;

    Traversal(URI start, Strategy strategy, TraversalEngine engine) {
        this.start = start;
        this.strategy = strategy;
        this.linkSource = engine.linkSource();
        this.permissionCheck = engine.permissionCheck();
        this.userAgent = engine.userAgent();
        this.listener = engine.listener();
        this.maxPages = engine.maxPages();
        this.abortAfterConsecutiveFailures = engine.abortAfterConsecutiveFailures();
        strategy.push(frontier, start);
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (state == TraversalState.DONE) return false;
        if (state == TraversalState.INIT) {
            state = TraversalState.RUNNING;
            LOG.info("Traversal started: start={}, strategy={}", start, strategy.label());
        }

        if (maxPages > 0 && visited.size() >= maxPages) {
            LOG.info("Page limit reached ({}), stopping", maxPages);
            finish();
            return false;
        }
        if (toExpand != null) {
            URI page = toExpand;
            toExpand = null;
            expand(page);
        }

        while (true) {
            Optional<URI> popped = frontier.pop();
            if (popped.isEmpty()) {
                finish();
                return false;
            }
            URI url = popped.get();
            if (visited.contains(url) || disallowed.contains(url)) continue; // 중복 대기열 항목 정리

            if (!permissionCheck.isAllowed(url, userAgent)) {
                disallowed.add(url);
                LOG.debug("Skipping {} (disallowed by robots.txt for {})", url, userAgent);
                listener.onSkipped(url, "robots");
                continue;
            }
            next = url;
            return true;
        }
    }

    @Override
    public URI next() {
        if (!hasNext()) throw new NoSuchElementException("traversal is done");
        URI url = next;
        next = null;
        visited.mark(url);
        toExpand = url;
        LOG.debug("Visit #{}: {}", visited.size(), url);
        listener.onVisit(url, visited.size());
        return url;
    }

    private void expand(URI page) {
        LinkResult result;
        try {
            result = linkSource.links(page);
        } catch (RuntimeException e) {
            // 구현체 버그도 URL 단위 실패로 흡수
            result = LinkResult.failed(new FetchException(page, FetchException.Kind.IO,
                    "link source error on " + page + ": " + e, e));
        }

        if (result.isFailure()) {
            FetchException failure = result.failure().orElseThrow();
            failures++;
            consecutiveFailures++;
            LOG.warn("Fetch failed for {}: {} (treated as no links)", page, failure.getMessage());
            listener.onFetchFailure(page, failure);
            if (abortAfterConsecutiveFailures > 0 && consecutiveFailures >= abortAfterConsecutiveFailures) {
                finish();
                throw new TraversalAbortedException(page, consecutiveFailures, visited.size(), failure);
            }
            return;
        }
        consecutiveFailures = 0;

        for (URI link : result.links()) {
            if (!UrlUtils.sameHost(start, link)) {
                LOG.debug("Ignoring off-host link {} from {}", link, page);
                continue;
            }
            if (visited.contains(link) || disallowed.contains(link)) continue;
            strategy.push(frontier, link);
        }
    }

    private void finish() {
        if (state == TraversalState.DONE) return;
        state = TraversalState.DONE;
        LOG.info("Traversal done: visited={}, fetchFailures={}, strategy={}", visited.size(), failures, strategy.label());
        listener.onDone(visited.size());
    }

    @Override
    public Iterator<URI> iterator() {
        return this;
    }

    public Stream<URI> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
                false);
    }

    public URI getStart() { return start; }
    public Strategy getStrategy() { return strategy; }
    public TraversalState getState() { return state; }

    /** 지금까지 방출된 URL 인가 */
    public boolean isVisited(URI url) { return visited.contains(url); }
    public int getVisitedCount() { return visited.size(); }
    public int getFailureCount() { return failures; }
    public int getDisallowedCount() { return disallowed.size(); }
}
