package com.sitewalker.core.crawler;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HtmlLinkSourceTest {

    /** URL → HTML. 없는 URL 은 404 실패 */
    private static final class MapFetcher implements PageFetcher {
        final Map<URI, String> pages = new HashMap<>();

        MapFetcher page(String url, String html) {
            pages.put(URI.create(url), html);
            return this;
        }

        @Override
        public FetchedPage fetch(URI url) throws FetchException {
            String html = pages.get(url);
            if (html == null) throw FetchException.httpStatus(url, 404);
            return new FetchedPage(url, html);
        }
    }

    private static final URI PAGE = URI.create("https://ex.com/dir/page.html");

    @Test
    void resolves_relative_against_page_and_keeps_same_host() {
        MapFetcher f = new MapFetcher().page(PAGE.toString(), """
                <a href="x.html">rel</a>
                <a href="/abs">abs</a>
                <a href="../up.html">up</a>
                <a href="https://EX.com:443/y#frag">same host, noisy</a>
                <a href="https://other.com/z">other host</a>
                <a href="//cdn.ex.com/s.js">protocol relative other host</a>
                """);

        LinkResult r = new HtmlLinkSource(f).links(PAGE);

        assertFalse(r.isFailure());
        assertThat(r.links()).containsExactly(
                URI.create("https://ex.com/dir/x.html"),
                URI.create("https://ex.com/abs"),
                URI.create("https://ex.com/up.html"),
                URI.create("https://ex.com/y"));
    }

    @Test
    void malformed_and_non_http_references_are_dropped() {
        MapFetcher f = new MapFetcher().page(PAGE.toString(), """
                <a href="http://[broken">bad</a>
                <a href="mailto:someone@ex.com">mail</a>
                <a href="javascript:void(0)">js</a>
                <a href="ok.html">ok</a>
                """);

        assertThat(new HtmlLinkSource(f).links(PAGE).links())
                .containsExactly(URI.create("https://ex.com/dir/ok.html"));
    }

    @Test
    void duplicates_collapse_in_discovery_order() {
        MapFetcher f = new MapFetcher().page(PAGE.toString(),
                "<a href='b.html'>1</a><a href='a.html'>2</a><a href='b.html#x'>3</a><a href='#top'>self</a>");

        assertThat(new HtmlLinkSource(f).links(PAGE).links()).containsExactly(
                URI.create("https://ex.com/dir/b.html"),
                URI.create("https://ex.com/dir/a.html"),
                PAGE);
    }

    @Test
    void page_without_links_is_empty_not_failure() {
        MapFetcher f = new MapFetcher().page(PAGE.toString(), "<p>nothing here</p>");
        LinkResult r = new HtmlLinkSource(f).links(PAGE);
        assertFalse(r.isFailure());
        assertTrue(r.links().isEmpty());
    }

    @Test
    void fetch_failure_is_reported_as_failure() {
        LinkResult r = new HtmlLinkSource(new MapFetcher()).links(PAGE);
        assertTrue(r.isFailure());
        assertTrue(r.links().isEmpty());
        FetchException e = r.failure().orElseThrow();
        assertEquals(FetchException.Kind.HTTP_STATUS, e.getKind());
        assertEquals(404, e.getStatus());
        assertEquals(PAGE, e.getUrl());
    }

    @Test
    void links_resolve_against_the_page_that_answered_after_redirect() {
        URI requested = URI.create("https://ex.com/docs");
        URI landed = URI.create("https://ex.com/docs/");
        PageFetcher f = url -> new FetchedPage(landed, "<a href='intro.html'>intro</a><a href='../top.html'>top</a>");

        assertThat(new HtmlLinkSource(f).links(requested).links()).containsExactly(
                URI.create("https://ex.com/docs/intro.html"),
                URI.create("https://ex.com/top.html"));
    }

    @Test
    void host_filter_follows_the_redirect_target() {
        URI requested = URI.create("https://ex.com/moved");
        PageFetcher f = url -> new FetchedPage(URI.create("https://new.ex.org/home/"),
                "<a href='a.html'>a</a><a href='https://ex.com/b.html'>b</a>");

        assertThat(new HtmlLinkSource(f).links(requested).links())
                .containsExactly(URI.create("https://new.ex.org/home/a.html"));
    }

    @Test
    void jsoup_extractor_gives_same_links() {
        MapFetcher f = new MapFetcher().page(PAGE.toString(), "<a href=x.html>a</a><a href='/abs'>b</a>");
        assertThat(new HtmlLinkSource(f, JsoupHrefExtractor.anchors()).links(PAGE).links()).containsExactly(
                URI.create("https://ex.com/dir/x.html"),
                URI.create("https://ex.com/abs"));
    }
}
