package com.sitewalker.core.crawler;

import java.net.URI;

/** 페이지 하나의 same-host 외부 링크를 돌려주는 협력자. */
@FunctionalInterface
public interface LinkSource {
    /**
     * page 에서 같은 host 로 향하는 절대 링크(발견 순서, 중복 제거)를 반환.
     * 가져오기 실패는 예외 대신 {@link LinkResult#failed(FetchException)} 로 알린다.
     */
    LinkResult links(URI page);
}
