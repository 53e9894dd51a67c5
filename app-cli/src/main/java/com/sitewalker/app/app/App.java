package com.sitewalker.app.app;

import com.sitewalker.app.logging.LogSetup;
import com.sitewalker.core.crawler.UnknownStrategyException;
import com.sitewalker.core.crawler.robots.HttpRobotsFetcher;
import com.sitewalker.core.crawler.robots.RobotsLoader;
import com.sitewalker.core.model.WalkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.function.ToIntFunction;

/**
 * 명령행 드라이버. 방문 URL 은 stdout 에 한 줄씩, 로그는 stderr/파일로 나간다.
 * 종료 코드: 0 성공, 1 실행 중 실패, 2 사용법 오류(알 수 없는 전략, 잘못된 설정 포함)
 */
@Command(name = "sitewalker",
        mixinStandardHelpOptions = true,
        version = "sitewalker 0.1.0",
        description = "Walks the same-host link graph of a site, depth-first or breadth-first.",
        subcommands = {WalkCommand.class, ImagesCommand.class, RobotsCommand.class})
public final class App implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_FAILURE = CommandLine.ExitCode.SOFTWARE;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    final PrintStream out;
    final PrintStream err;
    private final Consumer<Path> logInit;

    @Spec
    CommandSpec spec;

    App(PrintStream out, PrintStream err, Consumer<Path> logInit) {
        this.out = out;
        this.err = err;
        this.logInit = logInit;
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        // 로그 디렉터리는 설정(output.dir)을 읽은 뒤 정해진다
        System.exit(new App(System.out, System.err, LogSetup::configure).run(args));
    }

    int run(String... args) {
        PrintWriter outWriter = new PrintWriter(out, true);
        PrintWriter errWriter = new PrintWriter(err, true);
        CommandLine cmd = new CommandLine(this)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setOut(outWriter)
                .setErr(errWriter);
        try {
            return cmd.execute(args);
        } finally {
            outWriter.flush();
            errWriter.flush();
        }
    }

    /** 하위 명령 없이 호출된 경우 */
    @Override
    public Integer call() {
        err.println("error: missing command");
        spec.commandLine().usage(err);
        return EXIT_USAGE;
    }

    /**
     * 설정 로드 → 명령별 덮어쓰기 → 검증 → 로그 초기화 → 실행.
     * 설정/입력 오류는 사용법 오류(2), 설정 파일 읽기 실패는 1.
     */
    int execute(CliOptions options, String url, Consumer<WalkConfig> overrides, ToIntFunction<WalkConfig> command) {
        WalkConfig cfg;
        try {
            cfg = options.load(url);
            overrides.accept(cfg);
            cfg.validate();
        } catch (IOException e) {
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (YAMLException e) {
            err.println("error: malformed config: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        logInit.accept(cfg.getOutputDir());

        try {
            return command.applyAsInt(cfg);
        } catch (UnknownStrategyException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("error: invalid input: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    static RobotsLoader robotsLoader(WalkConfig cfg) {
        return new RobotsLoader(new HttpRobotsFetcher(cfg.getUserAgent(), cfg.getTimeout()));
    }
}
