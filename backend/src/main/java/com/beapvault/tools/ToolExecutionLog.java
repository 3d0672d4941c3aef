package com.beapvault.tools;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Bounded in-memory log of tool invocations. The oldest entries are dropped once
 * {@link #MAX_ENTRIES} is reached.
 */
@Component
public class ToolExecutionLog {

    public static final int MAX_ENTRIES = 1000;

    private final Deque<ToolExecutionLogEntry> entries = new ArrayDeque<>();

    public synchronized void record(ToolExecutionLogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > MAX_ENTRIES) {
            entries.removeFirst();
        }
    }

    /** Oldest first. */
    public synchronized List<ToolExecutionLogEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized List<ToolExecutionLogEntry> recent(int limit) {
        List<ToolExecutionLogEntry> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized void clear() {
        entries.clear();
    }
}
