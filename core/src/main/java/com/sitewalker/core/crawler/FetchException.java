package com.sitewalker.core.crawler;

import java.net.URI;

/** 페이지를 가져오지 못함. URL 한 건에 국한된 실패. */
public class FetchException extends Exception {

    public enum Kind { IO, HTTP_STATUS, INTERRUPTED }

    private final URI url;
    private final Kind kind;
    private final int status;

    public FetchException(URI url, Kind kind, String message, Throwable cause) {
        this(url, kind, -1, message, cause);
    }

    public FetchException(URI url, Kind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.kind = kind;
        this.status = status;
    }

    public static FetchException httpStatus(URI url, int status) {
        return new FetchException(url, Kind.HTTP_STATUS, status, "HTTP " + status + " for " + url, null);
    }

    public URI getUrl() { return url; }
    public Kind getKind() { return kind; }

    /** HTTP 상태 코드(HTTP_STATUS 가 아니면 -1) */
    public int getStatus() { return status; }
}
