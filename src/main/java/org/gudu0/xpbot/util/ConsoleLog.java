package org.gudu0.xpbot.util;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

public final class ConsoleLog {
    private ConsoleLog() {}

    // Toggled from the operator console ("debug on|off").
    public static volatile boolean DEBUG = false;

    private static final String ESC = "\u001B[";
    private static final String PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";

    private static volatile DateTimeFormatter ts =
            DateTimeFormatter.ofPattern(PATTERN).withZone(ZoneId.systemDefault());

    private static final AtomicLong WARNINGS = new AtomicLong();
    private static final AtomicLong ERRORS = new AtomicLong();

    /** Log timestamps follow the zone calendar days are counted in. */
    public static void useZone(ZoneId zone) {
        ts = DateTimeFormatter.ofPattern(PATTERN).withZone(zone);
    }

    public static long warnings() { return WARNINGS.get(); }
    public static long errors() { return ERRORS.get(); }

    private static void emit(PrintStream out, String level, String tag, String msg) {
        out.println("[" + ts.format(Instant.now()) + "] [" + level + "] [" + tag + "] " + msg);
    }

    public static void info(String tag, String msg) {
        emit(System.out, "INFO", tag, msg);
    }

    public static void warn(String tag, String msg) {
        WARNINGS.incrementAndGet();
        emit(System.out, ESC + "93m" + "WARN" + ESC + "0m", tag, msg);
    }

    public static void debug(String tag, String msg) {
        if (!DEBUG) return;
        emit(System.out, ESC + "32m" + "DEBUG" + ESC + "0m", tag, msg);
    }

    public static void error(String tag, String msg) {
        error(tag, msg, null);
    }

    public static void error(String tag, String msg, Throwable t) {
        ERRORS.incrementAndGet();
        emit(System.err, ESC + "31m" + "ERROR" + ESC + "0m", tag, msg);
        if (t != null) t.printStackTrace(System.err);
    }
}
