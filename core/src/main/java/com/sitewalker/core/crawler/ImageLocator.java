package com.sitewalker.core.crawler;

import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 페이지의 {@code <img src>} 위치를 최종 페이지 URL 기준 절대 URL 로 돌려준다. host 필터 없음. */
public final class ImageLocator {

    private final PageFetcher fetcher;
    private final HrefExtractor extractor;

    public ImageLocator(PageFetcher fetcher) {
        this(fetcher, PatternHrefExtractor.images());
    }

    public ImageLocator(PageFetcher fetcher, HrefExtractor extractor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public static ImageLocator from(WalkConfig cfg) {
        HrefExtractor ex = cfg.getExtractor() == WalkConfig.ExtractorKind.JSOUP
                ? JsoupHrefExtractor.images()
                : PatternHrefExtractor.images();
        return new ImageLocator(HttpPageFetcher.from(cfg), ex);
    }

    public List<URI> imageLocations(URI page) throws FetchException {
        FetchedPage fetched = fetcher.fetch(page);
        Set<URI> out = new LinkedHashSet<>();
        for (String raw : extractor.extract(fetched.body())) {
            UrlUtils.resolve(fetched.url(), raw).ifPresent(out::add);
        }
        return new ArrayList<>(out);
    }
}
