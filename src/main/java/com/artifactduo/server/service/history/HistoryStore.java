package com.artifactduo.server.service.history;

import com.artifactduo.server.model.history.HistoryEntry;

import java.util.List;

/**
 * Append-only audit log, newest entry first, capped at {@link #MAX_ENTRIES}.
 */
public interface HistoryStore {

    int MAX_ENTRIES = 100;

    void append(HistoryEntry historyEntry);

    List<HistoryEntry> getHistory();

    void clear();
}
