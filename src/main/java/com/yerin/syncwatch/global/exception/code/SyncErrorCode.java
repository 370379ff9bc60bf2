package com.yerin.syncwatch.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum SyncErrorCode implements ErrorCode {
    INVALID_SOURCE(HttpStatus.BAD_REQUEST, "알 수 없는 동기화 소스입니다.", "SYNC-001"),
    INVALID_SCHEDULER_CONFIG(HttpStatus.BAD_REQUEST, "스케줄러 설정이 올바르지 않습니다.", "SYNC-002");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
