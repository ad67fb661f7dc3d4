package org.ipusage;

import java.io.PrintStream;

/**
 * Diagnostic output. Standard output carries only the report, so everything here goes to the
 * error stream.
 */
public final class Console {
    private final PrintStream err;
    private final boolean verbose;
    private final boolean debug;

    public Console(PrintStream err, boolean verbose, boolean debug) {
        this.err = err;
        this.verbose = verbose || debug;
        this.debug = debug;
    }

    public static Console quiet(PrintStream err) {
        return new Console(err, false, false);
    }

    public void info(String format, Object... args) {
        if (verbose) err.printf(format + "%n", args);
    }

    public void debug(String format, Object... args) {
        if (debug) err.printf(format + "%n", args);
    }

    public void error(String message) {
        err.println(message);
    }
}
