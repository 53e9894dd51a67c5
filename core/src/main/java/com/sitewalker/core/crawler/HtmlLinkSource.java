package com.sitewalker.core.crawler;

import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 기본 LinkSource: fetch → href 추출 → 최종 페이지 URL 기준 해석 → same-host 필터.
 * - 리다이렉트된 페이지는 실제로 본문을 준 주소가 해석 기준이다
 * - 해석 불가/비 http(s) 참조는 버린다(순회는 계속)
 * - 발견 순서 유지, 중복 제거
 */
public class HtmlLinkSource implements LinkSource {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlLinkSource.class);

    private final PageFetcher fetcher;
    private final HrefExtractor extractor;

    public HtmlLinkSource(PageFetcher fetcher) {
        this(fetcher, PatternHrefExtractor.anchors());
    }

    public HtmlLinkSource(PageFetcher fetcher, HrefExtractor extractor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /** 설정 기반 기본 구성(HttpPageFetcher + 설정된 추출기) */
    public static HtmlLinkSource from(WalkConfig cfg) {
        HrefExtractor ex = cfg.getExtractor() == WalkConfig.ExtractorKind.JSOUP
                ? JsoupHrefExtractor.anchors()
                : PatternHrefExtractor.anchors();
        return new HtmlLinkSource(HttpPageFetcher.from(cfg), ex);
    }

    @Override
    public LinkResult links(URI page) {
        FetchedPage fetched;
        try {
            fetched = fetcher.fetch(page);
        } catch (FetchException e) {
            return LinkResult.failed(e);
        }
        URI base = fetched.url();
        if (fetched.wasRedirectedFrom(page)) {
            LOG.debug("{} redirected to {}", page, base);
        }

        Set<URI> out = new LinkedHashSet<>();
        int dropped = 0;
        for (String raw : extractor.extract(fetched.body())) {
            Optional<URI> resolved = UrlUtils.resolve(base, raw);
            if (resolved.isEmpty()) {
                dropped++;
                LOG.debug("Dropping unresolvable reference '{}' on {}", raw, page);
                continue;
            }
            URI link = resolved.get();
            if (UrlUtils.sameHost(base, link)) out.add(link);
        }
        if (dropped > 0) {
            LOG.debug("{}: {} reference(s) dropped as malformed", page, dropped);
        }
        return LinkResult.ok(new ArrayList<>(out));
    }
}
