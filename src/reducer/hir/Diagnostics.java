package reducer.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Collects the diagnostics reported against a program. While suppressed, any
* reported diagnostic is dropped without being printed or counted.
*/
public class Diagnostics {

    /** Severity of a diagnostic. */
    public enum Level {
        NOTE, WARNING, ERROR, FATAL
    }

    /** A single reported diagnostic. */
    public static class Diagnostic {

        private final Level level;

        private final String message;

        public Diagnostic(Level level, String message) {
            this.level = level;
            this.message = message;
        }

        public Level getLevel() {
            return level;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + message;
        }
    }

    private boolean suppress_all;

    private List<Diagnostic> reported;

    private int num_errors;

    private int num_fatals;

    public Diagnostics() {
        suppress_all = false;
        reported = new ArrayList<Diagnostic>();
    }

    /**
    * Turns suppression of all diagnostics on or off.
    *
    * @param suppress true to drop every diagnostic reported afterwards.
    */
    public void setSuppressAllDiagnostics(boolean suppress) {
        suppress_all = suppress;
    }

    public boolean getSuppressAllDiagnostics() {
        return suppress_all;
    }

    /**
    * Reports a diagnostic. Notes and warnings are printed at verbosity 1 and
    * errors at verbosity 0.
    *
    * @param level the severity.
    * @param message the message text.
    */
    public void report(Level level, String message) {
        if (suppress_all) {
            return;
        }
        Diagnostic diag = new Diagnostic(level, message);
        reported.add(diag);
        switch (level) {
        case ERROR:
            num_errors++;
            PrintTools.printlnStatus(0, diag);
            break;
        case FATAL:
            num_fatals++;
            PrintTools.printlnStatus(0, diag);
            break;
        default:
            PrintTools.printlnStatus(1, diag);
            break;
        }
    }

    /** Checks if an error or a fatal error has been reported. */
    public boolean hasErrorOccurred() {
        return (num_errors > 0 || num_fatals > 0);
    }

    /** Checks if a fatal error has been reported. */
    public boolean hasFatalErrorOccurred() {
        return (num_fatals > 0);
    }

    /** Returns the diagnostics reported so far, in order. */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(reported);
    }

    /** Forgets every reported diagnostic and lifts suppression. */
    public void reset() {
        reported.clear();
        num_errors = 0;
        num_fatals = 0;
        suppress_all = false;
    }

}
