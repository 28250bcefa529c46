package com.artifactduo.server.service.history;

import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.model.history.HistoryEntry;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

public class InMemoryHistoryStore implements HistoryStore {

    private final LinkedList<HistoryEntry> entries = new LinkedList<>();

    @Override
    public synchronized void append(HistoryEntry historyEntry) {
        this.entries.addFirst(historyEntry);
        while (this.entries.size() > MAX_ENTRIES) {
            this.entries.removeLast();
        }
    }

    @Override
    public synchronized List<HistoryEntry> getHistory() {
        return new ArrayList<>(this.entries);
    }

    @Override
    public synchronized void clear() {
        this.entries.clear();
    }

    public synchronized List<HistoryEntry> getByAction(HistoryActionEnum action) {
        return this.entries.stream().filter(entry -> entry.getActionType() == action).toList();
    }
}
