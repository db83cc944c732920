package com.ttennebkram.fusion.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every message in memory so the caller can decide how to surface them.
 */
public class RecordingDiagnostics implements FusionDiagnostics {

    public enum Level { INFO, ERROR }

    /**
     * One recorded message.
     */
    public static class Entry {
        public final Level level;
        public final String message;
        public final Throwable cause;

        Entry(Level level, String message, Throwable cause) {
            this.level = level;
            this.message = message;
            this.cause = cause;
        }

        @Override
        public String toString() {
            return level + " " + message;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    @Override
    public void info(String message) {
        entries.add(new Entry(Level.INFO, message, null));
    }

    @Override
    public void error(String message, Throwable cause) {
        entries.add(new Entry(Level.ERROR, message, cause));
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<String> getMessages(Level level) {
        List<String> messages = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.level == level) {
                messages.add(entry.message);
            }
        }
        return messages;
    }

    public boolean hasErrors() {
        return !getMessages(Level.ERROR).isEmpty();
    }

    public void clear() {
        entries.clear();
    }
}
