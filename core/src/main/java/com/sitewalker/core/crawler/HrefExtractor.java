package com.sitewalker.core.crawler;

import java.util.List;

/** HTML 본문에서 raw 참조 문자열(href/src 값)을 문서 순서대로 추출. 해석은 하지 않는다. */
@FunctionalInterface
public interface HrefExtractor {
    List<String> extract(String content);
}
