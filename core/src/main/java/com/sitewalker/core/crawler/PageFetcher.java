package com.sitewalker.core.crawler;

import java.net.URI;

/** 페이지 본문을 가져오는 전략 인터페이스. 결과에는 최종(리다이렉트 후) URL 이 함께 실린다. */
@FunctionalInterface
public interface PageFetcher {
    FetchedPage fetch(URI url) throws FetchException;
}
