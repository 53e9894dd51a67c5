package com.sitewalker.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/** URL 정규화 + 상대참조 해석 + same-host 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로
     *
     * 경로/쿼리는 인코딩된 원문(raw) 그대로 유지한다.
     */
    public static URI normalize(URI u) {
        if (u == null) return null;
        if (u.isOpaque()) return u; // mailto:, javascript: 등은 손대지 않음

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getRawAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        String query = u.getRawQuery();

        StringBuilder sb = new StringBuilder(64);
        sb.append(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (query != null) sb.append('?').append(query);

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            // 재조립 실패 시 원본 유지(보수적)
            return u;
        }
    }

    /**
     * 페이지 URL(base) 기준으로 raw 참조를 해석해 정규화된 절대 URL을 돌려준다.
     * 해석 불가(잘못된 문법, http/https 외 스킴, host 없음)면 empty.
     */
    public static Optional<URI> resolve(URI base, String rawRef) {
        if (base == null || rawRef == null) return Optional.empty();
        String ref = rawRef.trim();
        if (ref.isEmpty()) return Optional.empty();

        try {
            // "http://host" + "x.html" → "http://hostx.html" 방지: base를 먼저 정규화
            URI resolved = normalize(base).resolve(new URI(ref));
            if (!isHttp(resolved) || resolved.getHost() == null) return Optional.empty();
            return Optional.of(normalize(resolved));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** 문자열 URL 파싱 + 정규화. 실패 시 IllegalArgumentException */
    public static URI parse(String url) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("url is blank");
        URI u = URI.create(url.trim());
        if (!isHttp(u) || u.getHost() == null) {
            throw new IllegalArgumentException("not an absolute http(s) url: " + url);
        }
        return normalize(u);
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme();
        return s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https");
    }

    /** host 기준 동일 호스트 판정(소문자 비교, 포트/스킴 무시) */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return !ha.isEmpty() && ha.equals(hb);
    }
}
