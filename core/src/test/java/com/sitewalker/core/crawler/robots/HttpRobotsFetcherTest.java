package com.sitewalker.core.crawler.robots;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpRobotsFetcherTest {

    private HttpServer server;
    private String base;
    private final AtomicReference<String> seenUa = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/robots.txt", ex -> {
            seenUa.set(ex.getRequestHeaders().getFirst("User-Agent"));
            byte[] body = "User-agent: *\nDisallow: /private\n".getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.createContext("/moved/robots.txt", ex -> {
            ex.getResponseHeaders().add("Location", "/robots.txt");
            ex.sendResponseHeaders(301, -1);
            ex.close();
        });
        server.createContext("/missing/robots.txt", ex -> {
            ex.sendResponseHeaders(404, -1);
            ex.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private HttpRobotsFetcher fetcher() {
        return new HttpRobotsFetcher("SiteWalker/test", Duration.ofSeconds(5));
    }

    @Test
    void ok_returns_body_and_sends_user_agent() {
        RobotsFetcher.Response r = fetcher().fetch(URI.create(base + "/robots.txt"));
        assertEquals(200, r.status());
        assertTrue(r.body().contains("Disallow: /private"));
        assertEquals("SiteWalker/test", seenUa.get());
        assertTrue(r.errorMessage().isEmpty());
    }

    @Test
    void redirect_is_reported_not_followed() {
        RobotsFetcher.Response r = fetcher().fetch(URI.create(base + "/moved/robots.txt"));
        assertEquals(301, r.status());
        assertEquals(URI.create(base + "/robots.txt"), r.location());
    }

    @Test
    void not_found_status_passed_through() {
        RobotsFetcher.Response r = fetcher().fetch(URI.create(base + "/missing/robots.txt"));
        assertEquals(404, r.status());
    }

    @Test
    void connection_failure_is_status_zero() throws IOException {
        HttpServer gone = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = gone.getAddress().getPort();
        gone.stop(0);
        RobotsFetcher.Response r = fetcher().fetch(URI.create("http://127.0.0.1:" + port + "/robots.txt"));
        assertEquals(0, r.status());
        assertTrue(r.errorMessage().isPresent());
    }

    @Test
    void loader_over_http_end_to_end() {
        RobotsPolicy p = new RobotsLoader(fetcher()).prepareFor(URI.create(base + "/some/page"));
        assertFalse(p.isAllowed(URI.create(base + "/private/x")));
        assertTrue(p.isAllowed(URI.create(base + "/open")));
    }
}
