package com.artifactduo.server.controller;

import com.artifactduo.server.model.api.global.ArtifactDuoHttpResponse;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.service.history.HistoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/history")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class HistoryController {

    private final HistoryStore historyStore;

    @Autowired
    public HistoryController(HistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    @GetMapping("/get-history")
    public ArtifactDuoHttpResponse<List<HistoryEntry>> getHistory() {
        return ArtifactDuoHttpResponse.success(this.historyStore.getHistory());
    }

    @PostMapping("/clear-history")
    public ArtifactDuoHttpResponse<Void> clearHistory() {
        this.historyStore.clear();
        return ArtifactDuoHttpResponse.success();
    }
}
