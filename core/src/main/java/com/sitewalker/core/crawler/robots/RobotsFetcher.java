package com.sitewalker.core.crawler.robots;

import java.net.URI;
import java.util.Optional;

/** robots.txt 한 번 요청. 리다이렉트는 따라가지 않고 결과로 돌려준다(판단은 RobotsLoader). */
public interface RobotsFetcher {

    /**
     * status 0: 응답을 받지 못함(error 에 사유).
     * 3xx: location 에 다음 위치.
     */
    record Response(int status, String body, URI location, String error) {

        public static Response ok(int status, String body) {
            return new Response(status, body == null ? "" : body, null, null);
        }

        public static Response redirect(int status, URI location) {
            return new Response(status, "", location, null);
        }

        public static Response fail(String error) {
            return new Response(0, "", null, error);
        }

        public boolean isFailure() { return status == 0; }

        public boolean isSuccess() { return status >= 200 && status < 300; }

        public boolean isRedirect() {
            return location != null && (status == 301 || status == 302 || status == 303 || status == 307 || status == 308);
        }

        public Optional<String> errorMessage() { return Optional.ofNullable(error); }
    }

    Response fetch(URI robotsTxtUri);
}
