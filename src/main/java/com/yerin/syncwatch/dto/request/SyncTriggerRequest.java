package com.yerin.syncwatch.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record SyncTriggerRequest(
        String source,
        @Min(value = 0, message = "priority 는 0 이상이어야 합니다.")
        @Max(value = 100, message = "priority 는 100 이하여야 합니다.")
        Integer priority,
        boolean waitForCompletion
) {
    public String sourceOrAll() {
        return source == null || source.isBlank() ? "all" : source;
    }
}
