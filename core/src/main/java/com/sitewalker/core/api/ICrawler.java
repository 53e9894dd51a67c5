package com.sitewalker.core.api;

import com.sitewalker.core.crawler.Traversal;

/** 순회 엔진 최소 계약: 시작 URL + 전략 이름 → 방문 순서 URL 시퀀스. */
public interface ICrawler {
    Traversal traverse(String startUrl, String strategyName);
}
