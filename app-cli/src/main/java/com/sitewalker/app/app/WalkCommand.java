package com.sitewalker.app.app;

import com.sitewalker.core.crawler.HtmlLinkSource;
import com.sitewalker.core.crawler.Strategy;
import com.sitewalker.core.crawler.Traversal;
import com.sitewalker.core.crawler.TraversalAbortedException;
import com.sitewalker.core.crawler.TraversalEngine;
import com.sitewalker.core.crawler.robots.PermissionCheck;
import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.net.URI;
import java.util.concurrent.Callable;

/** 시작 URL 에서 같은 호스트 링크 그래프를 순회하며 방문 순서대로 URL 을 출력한다. */
@Command(name = "walk", mixinStandardHelpOptions = true,
        description = "Print every reachable same-host page in visit order.")
public class WalkCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(WalkCommand.class);

    @ParentCommand
    App app;

    @Mixin
    CliOptions options;

    @Parameters(index = "0", paramLabel = "<startUrl>", description = "Absolute http(s) start URL")
    String startUrl;

    @Option(names = {"-s", "--strategy"}, paramLabel = "S",
            description = "depth-first | breadth-first (also dfs, bfs; default breadth-first)")
    String strategy;

    @Option(names = "--max-pages", paramLabel = "N", converter = CliOptions.NonNegativeInt.class,
            description = "Stop after N visited pages (0 = unlimited)")
    Integer maxPages;

    @Option(names = "--no-robots", description = "Ignore robots.txt")
    boolean noRobots;

    @Option(names = "--abort-after", paramLabel = "N", converter = CliOptions.NonNegativeInt.class,
            description = "Abort after N consecutive fetch failures (0 = never)")
    Integer abortAfter;

    @Override
    public Integer call() {
        return app.execute(options, startUrl, this::override, this::walk);
    }

    private void override(WalkConfig cfg) {
        if (strategy != null) cfg.setStrategy(strategy);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (abortAfter != null) cfg.getFailures().setAbortAfterConsecutive(abortAfter);
        if (noRobots) cfg.getRobots().setRespect(false);
    }

    private int walk(WalkConfig cfg) {
        // 전략부터 검증: 잘못되면 robots 조회 등 어떤 부작용도 없이 종료
        Strategy resolved = Strategy.resolve(cfg.getStrategy());
        URI start = UrlUtils.parse(cfg.getStart());
        LOG.info("Walking {} ({})", start, cfg);

        PermissionCheck gate = PermissionCheck.ALLOW_ALL;
        if (cfg.getRobots().isRespect()) {
            gate = App.robotsLoader(cfg).prepareFor(start);
        }

        TraversalEngine engine = TraversalEngine.builder(HtmlLinkSource.from(cfg), cfg)
                .permissionCheck(gate)
                .build();

        Traversal traversal = engine.traverse(start, resolved);
        try {
            for (URI url : traversal) {
                app.out.println(url);
            }
        } catch (TraversalAbortedException e) {
            LOG.error("Traversal aborted: {}", e.getMessage());
            app.err.println("error: " + e.getMessage());
            return App.EXIT_FAILURE;
        } finally {
            app.out.flush();
        }
        LOG.info("Visited {} page(s), {} fetch failure(s), {} disallowed",
                traversal.getVisitedCount(), traversal.getFailureCount(), traversal.getDisallowedCount());
        return App.EXIT_OK;
    }
}
