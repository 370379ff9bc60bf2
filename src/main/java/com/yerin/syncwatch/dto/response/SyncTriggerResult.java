package com.yerin.syncwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * 수동 동기화 결과. 실패는 예외 스택이 아니라 메시지와 실패한 단계로 돌려준다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncTriggerResult(
        String status,
        String source,
        Map<String, String> jobs,
        Map<String, Object> results,
        String error,
        String failedSource,
        String phase,
        Instant triggeredAt
) {
    public static final String SUBMITTED = "submitted";
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static SyncTriggerResult submitted(String source, Map<String, String> jobs, Instant at) {
        return new SyncTriggerResult(SUBMITTED, source, jobs, null, null, null, null, at);
    }
}
