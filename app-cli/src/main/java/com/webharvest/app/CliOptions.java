package com.webharvest.app;

import com.webharvest.core.model.ScrapeConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * 명령행 인자.
 * <pre>
 * webharvest &lt;url&gt; [--max-items N] [--browser] [--max-concurrent N]
 *            [--chunk-size N] [--config scrape.yml] [--output out.json]
 * </pre>
 * 설정 파일 값 위에 명령행 값이 덮어쓰인다.
 */
final class CliOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: webharvest <url> [options]",
            "  --max-items N        maximum pages to extract (default 100)",
            "  --browser            enable headless browser fallback",
            "  --max-concurrent N   concurrent page extractions (default 10)",
            "  --chunk-size N       target chunk size in characters (default 8000)",
            "  --config FILE        YAML config (scrape.yml layout)",
            "  --output FILE        write JSON here instead of stdout");

    String url;
    Integer maxItems;
    boolean browser;
    Integer maxConcurrent;
    Integer chunkSize;
    Path config;
    Path output;
    boolean help;

    static CliOptions parse(List<String> args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.size(); i++) {
            String a = args.get(i);
            switch (a) {
                case "-h", "--help" -> o.help = true;
                case "--browser" -> o.browser = true;
                case "--max-items" -> o.maxItems = intArg(args, ++i, a);
                case "--max-concurrent" -> o.maxConcurrent = intArg(args, ++i, a);
                case "--chunk-size" -> o.chunkSize = intArg(args, ++i, a);
                case "--config" -> o.config = Path.of(strArg(args, ++i, a));
                case "--output" -> o.output = Path.of(strArg(args, ++i, a));
                default -> {
                    if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (o.url != null) throw new IllegalArgumentException("Unexpected argument: " + a);
                    o.url = a;
                }
            }
        }
        if (!o.help && o.url == null) throw new IllegalArgumentException("Missing <url>");
        return o;
    }

    /** 명령행 값을 설정에 덮어쓴다 */
    ScrapeConfig applyTo(ScrapeConfig cfg) {
        cfg.setBaseUrl(url);
        if (maxItems != null) cfg.setMaxItems(maxItems);
        if (browser) cfg.setUseBrowser(true);
        if (maxConcurrent != null) cfg.setMaxConcurrent(maxConcurrent);
        if (chunkSize != null) cfg.setChunkSize(chunkSize);
        return cfg;
    }

    private static String strArg(List<String> args, int i, String opt) {
        if (i >= args.size()) throw new IllegalArgumentException(opt + " requires a value");
        return args.get(i);
    }

    private static int intArg(List<String> args, int i, String opt) {
        String v = strArg(args, i, opt);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects an integer, got: " + v);
        }
    }
}
