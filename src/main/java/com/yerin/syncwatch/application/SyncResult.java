package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.SyncSource;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record SyncResult(
        SyncSource source,
        int fetched,
        int created,
        int updated,
        int unchanged,
        int skipped,
        boolean payloadUnchanged,
        Map<String, Object> summary,
        Instant completedAt
) {
    public int changed() {
        return created + updated;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("source", source.key());
        out.put("status", "completed");
        out.put("fetched", fetched);
        out.put("created", created);
        out.put("updated", updated);
        out.put("unchanged", unchanged);
        out.put("skipped", skipped);
        out.put("payloadUnchanged", payloadUnchanged);
        if (summary != null && !summary.isEmpty()) out.put("summary", summary);
        out.put("timestamp", completedAt.toString());
        return out;
    }
}
