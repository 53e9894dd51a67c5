package com.sitewalker.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** JSoup DOM 기반 추출기: a[href] / img[src] 의 raw 속성값 수집 (해석은 호출자가 한다) */
public final class JsoupHrefExtractor implements HrefExtractor {

    private static final JsoupHrefExtractor ANCHORS = new JsoupHrefExtractor("a[href]", "href");
    private static final JsoupHrefExtractor IMAGES = new JsoupHrefExtractor("img[src]", "src");

    private final String selector;
    private final String attribute;

    private JsoupHrefExtractor(String selector, String attribute) {
        this.selector = selector;
        this.attribute = attribute;
    }

    public static JsoupHrefExtractor anchors() { return ANCHORS; }

    public static JsoupHrefExtractor images() { return IMAGES; }

    @Override
    public List<String> extract(String content) {
        List<String> out = new ArrayList<>();
        if (content == null || content.isBlank()) return out;

        Document doc = Jsoup.parse(content);
        for (Element e : doc.select(selector)) {
            String v = e.attr(attribute);
            if (v.isBlank()) continue;
            out.add(v.trim());
        }
        return out;
    }
}
