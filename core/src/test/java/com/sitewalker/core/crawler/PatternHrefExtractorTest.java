package com.sitewalker.core.crawler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatternHrefExtractorTest {

    @Test
    void anchor_double_and_single_quotes() {
        String html = "<p><a href=\"x.html\">x</a> <A class='n' HREF='/y'>y</A></p>";
        assertThat(PatternHrefExtractor.anchors().extract(html)).containsExactly("x.html", "/y");
    }

    @Test
    void image_src() {
        String html = "<img src='y.png'><img alt=\"a\" src=\"/img/z.gif\">";
        assertThat(PatternHrefExtractor.images().extract(html)).containsExactly("y.png", "/img/z.gif");
    }

    @Test
    void anchors_ignore_images_and_vice_versa() {
        String html = "<a href=\"a.html\"><img src=\"b.png\"></a>";
        assertThat(PatternHrefExtractor.anchors().extract(html)).containsExactly("a.html");
        assertThat(PatternHrefExtractor.images().extract(html)).containsExactly("b.png");
    }

    @Test
    void raw_values_are_not_resolved_or_validated() {
        String html = "<a href=\"http://[broken\">b</a><a href=\"#top\">t</a>";
        assertThat(PatternHrefExtractor.anchors().extract(html)).containsExactly("http://[broken", "#top");
    }

    @Test
    void unterminated_quote_yields_nothing() {
        assertThat(PatternHrefExtractor.anchors().extract("<a href=\"broken>text")).isEmpty();
    }

    @Test
    void empty_or_null_content() {
        assertThat(PatternHrefExtractor.anchors().extract("")).isEmpty();
        assertThat(PatternHrefExtractor.anchors().extract(null)).isEmpty();
        assertThat(PatternHrefExtractor.anchors().extract("plain text only")).isEmpty();
    }
}
