package com.sitewalker.core.crawler;

import com.sitewalker.core.crawler.robots.HttpRobotsFetcher;
import com.sitewalker.core.crawler.robots.RobotsLoader;
import com.sitewalker.core.crawler.robots.RobotsPolicy;
import com.sitewalker.core.model.WalkConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HTTP 사이트 전체 순회 (robots 포함)")
class TraversalIntegrationTest {

    private LocalSite site;

    @BeforeEach
    void setUp() throws IOException {
        site = new LocalSite()
                .page("/robots.txt", "User-agent: *\nDisallow: /private\n")
                .page("/", """
                        <a href="/a.html">A</a>
                        <a href="b.html">B</a>
                        <a href="http://other.invalid/x">elsewhere</a>
                        """)
                .page("/a.html", "<a href='c.html'>C</a> <a href='/'>home</a>")
                .page("/b.html", "<a href='/private/p.html'>P</a> <a href='/missing.html'>gone</a>")
                .page("/c.html", "<p>leaf</p>")
                .page("/private/p.html", "<a href='/secret.html'>S</a>")
                .redirect("/docs", "/docs/")
                .page("/docs/", "<a href='intro.html'>intro</a>")
                .page("/docs/intro.html", "<a href='../c.html'>C</a>");
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private List<URI> walk(String strategy, boolean respectRobots) {
        WalkConfig cfg = WalkConfig.defaults().setStart(site.base() + "/").setTimeoutMs(5000);
        RobotsPolicy gate = respectRobots
                ? new RobotsLoader(new HttpRobotsFetcher(cfg.getUserAgent(), Duration.ofSeconds(5)))
                        .prepareFor(URI.create(cfg.getStart()))
                : RobotsPolicy.allowAll();
        return TraversalEngine.builder(HtmlLinkSource.from(cfg), cfg)
                .permissionCheck(gate)
                .build()
                .traverse(cfg.getStart(), strategy)
                .stream().toList();
    }

    @Test
    void breadthFirst_overHttp() {
        assertThat(walk("breadth-first", true)).containsExactly(
                site.url("/"), site.url("/a.html"), site.url("/b.html"),
                site.url("/c.html"), site.url("/missing.html"));
        assertThat(site.requestedPaths).doesNotContain("/private/p.html", "/secret.html");
    }

    @Test
    void depthFirst_overHttp() {
        assertThat(walk("depth-first", true)).containsExactly(
                site.url("/"), site.url("/b.html"), site.url("/missing.html"),
                site.url("/a.html"), site.url("/c.html"));
    }

    @Test
    @DisplayName("리다이렉트된 페이지의 상대 링크는 최종 주소 기준")
    void redirectedPage_linksResolveAgainstFinalUrl() {
        WalkConfig cfg = WalkConfig.defaults().setTimeoutMs(5000);
        List<URI> visited = TraversalEngine.builder(HtmlLinkSource.from(cfg), cfg).build()
                .traverse(site.base() + "/docs", "bfs")
                .stream().toList();

        assertThat(visited).containsExactly(site.url("/docs"), site.url("/docs/intro.html"), site.url("/c.html"));
        assertThat(site.requestedPaths).doesNotContain("/intro.html");
    }

    @Test
    void withoutRobots_privatePagesAreWalked() {
        List<URI> visited = walk("bfs", false);
        assertThat(visited).contains(site.url("/private/p.html"), site.url("/secret.html"));
        assertThat(site.requestedPaths).doesNotContain("/robots.txt");
    }

    @Test
    void eachPageFetchedOnce() {
        walk("breadth-first", true);
        long homeFetches = site.requestedPaths.stream().filter("/"::equals).count();
        assertEquals(1, homeFetches);
        assertThat(site.requestedPaths).doesNotHaveDuplicates();
    }
}
