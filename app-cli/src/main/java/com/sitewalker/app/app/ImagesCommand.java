package com.sitewalker.app.app;

import com.sitewalker.core.crawler.FetchException;
import com.sitewalker.core.crawler.ImageLocator;
import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.net.URI;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "images", mixinStandardHelpOptions = true,
        description = "Print the resolved <img src> locations of one page.")
public class ImagesCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ImagesCommand.class);

    @ParentCommand
    App app;

    @Mixin
    CliOptions options;

    @Parameters(index = "0", paramLabel = "<pageUrl>")
    String pageUrl;

    @Override
    public Integer call() {
        return app.execute(options, pageUrl, cfg -> { }, this::images);
    }

    private int images(WalkConfig cfg) {
        URI page = UrlUtils.parse(cfg.getStart());
        try {
            List<URI> images = ImageLocator.from(cfg).imageLocations(page);
            images.forEach(app.out::println);
            app.out.flush();
            LOG.info("{} image location(s) on {}", images.size(), page);
            return App.EXIT_OK;
        } catch (FetchException e) {
            LOG.warn("Could not fetch {}: {}", page, e.getMessage());
            app.err.println("error: " + e.getMessage());
            return App.EXIT_FAILURE;
        }
    }
}
