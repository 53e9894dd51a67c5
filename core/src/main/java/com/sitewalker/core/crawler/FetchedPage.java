package com.sitewalker.core.crawler;

import java.net.URI;
import java.util.Objects;

/**
 * 가져온 페이지 1건.
 * url 은 리다이렉트를 따라간 뒤 실제로 본문을 준 주소다. 상대 링크는 이 주소 기준으로 해석한다.
 */
public record FetchedPage(URI url, String body) {

    public FetchedPage {
        Objects.requireNonNull(url, "url");
        body = (body == null) ? "" : body;
    }

    /** 리다이렉트로 요청 주소와 달라졌는가 */
    public boolean wasRedirectedFrom(URI requested) {
        return !url.equals(requested);
    }
}
