package com.sitewalker.app.app;

import com.sitewalker.core.model.WalkConfig;
import com.sitewalker.core.util.YamlConfigLoader;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.TypeConversionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * walk/images/robots 공통 옵션 (picocli mixin).
 * 지정되지 않은 옵션은 null 로 남고 walk.yml / 기본값이 쓰인다.
 */
public class CliOptions {

    @Option(names = {"-c", "--config"}, paramLabel = "FILE",
            description = "YAML config file (default: ./walk.yml when present)")
    Path config;

    @Option(names = "--user-agent", paramLabel = "UA", description = "User-Agent for page and robots.txt requests")
    String userAgent;

    @Option(names = "--extractor", paramLabel = "KIND", description = "Link extractor: ${COMPLETION-CANDIDATES}")
    WalkConfig.ExtractorKind extractor;

    @Option(names = "--timeout-ms", paramLabel = "N", converter = NonNegativeInt.class,
            description = "Per-request timeout in milliseconds")
    Integer timeoutMs;

    /** walk.yml(지정 또는 현재 디렉터리) → 공통 옵션 덮어쓰기. validate 는 호출자 몫 */
    WalkConfig load(String url) throws IOException {
        WalkConfig cfg;
        if (config != null) {
            cfg = YamlConfigLoader.loadPartial(config);
        } else if (Files.exists(Path.of(YamlConfigLoader.DEFAULT_FILE))) {
            cfg = YamlConfigLoader.loadPartial(Path.of(YamlConfigLoader.DEFAULT_FILE));
        } else {
            cfg = WalkConfig.defaults();
        }

        cfg.setStart(url);
        if (userAgent != null) cfg.setUserAgent(userAgent);
        if (extractor != null) cfg.setExtractor(extractor);
        if (timeoutMs != null && timeoutMs > 0) cfg.setTimeoutMs(timeoutMs);
        return cfg;
    }

    /** 0 이상 정수만 받는 변환기 */
    public static final class NonNegativeInt implements ITypeConverter<Integer> {
        @Override
        public Integer convert(String value) {
            int n;
            try {
                n = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new TypeConversionException("expects a number but was '" + value + "'");
            }
            if (n < 0) throw new TypeConversionException("must be >= 0 but was " + n);
            return n;
        }
    }
}
