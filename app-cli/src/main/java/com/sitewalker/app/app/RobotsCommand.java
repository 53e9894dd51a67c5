package com.sitewalker.app.app;

import com.sitewalker.core.crawler.robots.RobotsPolicy;
import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.util.UrlUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.net.URI;
import java.util.concurrent.Callable;

/** robots.txt 기준으로 URL 하나의 허용 여부를 출력한다 (allowed / disallowed). */
@Command(name = "robots", mixinStandardHelpOptions = true,
        description = "Check one URL against its host's robots.txt.")
public class RobotsCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Mixin
    CliOptions options;

    @Parameters(index = "0", paramLabel = "<url>")
    String url;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<userAgent>",
            description = "Agent name to match (default: " + RobotsPolicy.DEFAULT_UA + ")")
    String agent;

    @Override
    public Integer call() {
        return app.execute(options, url, cfg -> { }, this::check);
    }

    private int check(WalkConfig cfg) {
        URI target = UrlUtils.parse(cfg.getStart());
        String ua = (agent != null) ? agent : RobotsPolicy.DEFAULT_UA;
        boolean allowed = App.robotsLoader(cfg).prepareFor(target).isAllowed(target, ua);
        app.out.println(allowed ? "allowed" : "disallowed");
        app.out.flush();
        return App.EXIT_OK;
    }
}
