package com.artifactduo.server.model.history;

import com.artifactduo.server.enums.HistoryActionEnum;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@Accessors(chain = true)
public class HistoryEntry {

    private String id;

    private OffsetDateTime timestamp;

    private HistoryActionEnum actionType;

    private String description;

    // copy 相关的字段, system event 时为空
    private String folderName = "";

    private String sourcePath = "";

    private String targetPath = "";

    private int copiedFilesCount;

    @JsonSerialize(using = ToStringSerializer.class)
    private long totalSize;

    private List<String> files = new ArrayList<>();

    public static HistoryEntry of(HistoryActionEnum actionType, String description) {
        return new HistoryEntry()
                .setId(UUID.randomUUID().toString())
                .setTimestamp(OffsetDateTime.now())
                .setActionType(actionType)
                .setDescription(description);
    }
}
