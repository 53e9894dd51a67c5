package com.sitewalker.core.crawler.robots;

import java.net.URI;

/** 순회 엔진이 URL 방출/확장 전에 묻는 허용 여부 게이트. */
@FunctionalInterface
public interface PermissionCheck {

    boolean isAllowed(URI url, String userAgent);

    PermissionCheck ALLOW_ALL = (url, userAgent) -> true;
}
