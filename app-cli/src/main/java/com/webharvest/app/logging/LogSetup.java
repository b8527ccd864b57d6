package com.webharvest.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * SLF4J 는 slf4j-jdk14 바인딩으로 여기 핸들러에 합류한다.
 * 콘솔은 stderr(ConsoleHandler 기본) 이므로 stdout 의 JSON 결과와 섞이지 않는다.
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/scrape-%g.log 로 저장. System props:
     *  -Dwh.log.level=FINE|INFO|WARNING|SEVERE
     *  -Dwh.log.sizeMb=2
     *  -Dwh.log.files=5
     *  -Dwh.log.console=true|false (기본 true)
     *  -Dwh.log.file=true|false (기본 true)
     */
    public static synchronized void configure(Path outRoot) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("wh.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("wh.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("wh.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("wh.log.console", "true"));
        boolean toFile    = !"false".equalsIgnoreCase(System.getProperty("wh.log.file", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        if (toFile) {
            Path logDir = outRoot.resolve("logs");
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("scrape-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 콘솔만으로 진행
                Logger.getAnonymousLogger().log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
            }
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. dir=" + outRoot.resolve("logs").toAbsolutePath() + ", level=" + level.getName());
    }

    /** 문자열을 Level 로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try {
            return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    static int parseInt(String s, int def) {
        try {
            return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
