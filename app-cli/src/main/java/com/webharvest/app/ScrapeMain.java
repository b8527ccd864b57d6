package com.webharvest.app;

import com.webharvest.app.logging.LogSetup;
import com.webharvest.core.export.ScrapeResultJson;
import com.webharvest.core.model.ScrapeConfig;
import com.webharvest.core.model.ScrapeResult;
import com.webharvest.core.service.ScrapeService;
import com.webharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

/** 명령행 진입점: 사이트 하나를 스크랩해 JSON 으로 출력 */
public final class ScrapeMain {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapeMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private ScrapeMain() {}

    public static void main(String[] args) {
        LogSetup.configure(Path.of(System.getProperty("wh.out", "out")));
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        // ---- 1) 인자/설정 ----
        CliOptions opts;
        ScrapeConfig cfg;
        try {
            opts = CliOptions.parse(Arrays.asList(args));
            if (opts.help) {
                out.println(CliOptions.USAGE);
                return EXIT_OK;
            }
            cfg = opts.applyTo(opts.config != null ? YamlConfigLoader.load(opts.config) : ScrapeConfig.defaults());
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: cannot read config: " + e.getMessage());
            return EXIT_USAGE;
        }

        // ---- 2) 실행 ----
        try {
            ScrapeResult result = new ScrapeService(cfg).run(
                    (p, phase, done, total) -> LOG.debug("progress phase={} {}/{}", phase, done, total));

            // ---- 3) 출력 ----
            if (opts.output != null) {
                ScrapeResultJson.write(result, opts.output);
                LOG.info("Wrote {} items to {}", result.getItems().size(), opts.output.toAbsolutePath());
            } else {
                out.write((ScrapeResultJson.toJson(result) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
            return EXIT_OK;
        } catch (IOException e) {
            LOG.error("Failed to write result: {}", e.toString());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalStateException e) {
            LOG.error("Scrape could not start: {}", e.toString(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }
}
