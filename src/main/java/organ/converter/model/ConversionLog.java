package organ.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cumulative event log of one conversion run. Owned by the caller.
 */
public final class ConversionLog {

    public enum Severity {
        INFO,
        WARNING,
        ERROR,
        INTERNAL
    }

    public record Entry(Severity severity, String message) {
        @Override
        public String toString() {
            return severity + ": " + message;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public void info(String message) {
        entries.add(new Entry(Severity.INFO, message));
    }

    public void warn(String message) {
        entries.add(new Entry(Severity.WARNING, message));
    }

    public void error(String message) {
        entries.add(new Entry(Severity.ERROR, message));
    }

    public void internal(String message) {
        entries.add(new Entry(Severity.INTERNAL, message));
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int count(Severity severity) {
        int n = 0;
        for (Entry e : entries) {
            if (e.severity() == severity) {
                n++;
            }
        }
        return n;
    }

    public boolean contains(Severity severity, String fragment) {
        for (Entry e : entries) {
            if (e.severity() == severity && e.message().contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    public void clear() {
        entries.clear();
    }
}
