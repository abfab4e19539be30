package com.artifactguard.app.logging;

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
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5)
 * - configure(outRoot, debug): outRoot/logs 기준 초기화
 * - init(logDir, level): logs 디렉터리를 직접 넘겨 초기화
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/scanner-%g.log 로 저장. System props:
     *  -Dag.log.level=FINE|INFO|WARNING|SEVERE (debug=true면 기본 FINE)
     *  -Dag.log.sizeMb=2
     *  -Dag.log.files=5
     *  -Dag.log.console=true|false (기본 true)
     */
    public static synchronized void configure(Path outRoot, boolean debug) {
        init(outRoot.resolve("logs"), resolveLevel(debug));
    }

    public static synchronized void init(Path logDir, Level level) {
        if (initialized) return;
        initialized = true;

        int sizeMb   = parseInt(System.getProperty("ag.log.sizeMb"), 2);
        int fileCnt  = parseInt(System.getProperty("ag.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("ag.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("scanner-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            file.setEncoding("UTF-8");
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 핸들러 실패: 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.INFO,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** -Dag.log.level 우선, 없으면 debug 여부로 결정 */
    public static Level resolveLevel(boolean debug) {
        String sys = System.getProperty("ag.log.level");
        if (sys != null && !sys.isBlank()) return levelOf(sys);
        return debug ? Level.FINE : Level.INFO;
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
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
