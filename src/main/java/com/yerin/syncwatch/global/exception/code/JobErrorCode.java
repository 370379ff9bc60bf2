package com.yerin.syncwatch.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    JOB_NOT_CANCELLABLE(HttpStatus.CONFLICT, "대기 또는 실행 중인 작업만 취소할 수 있습니다.", "JOB-002"),
    JOB_NOT_RETRYABLE(HttpStatus.CONFLICT, "재시도 한도 안의 실패한 작업만 재시도할 수 있습니다.", "JOB-003"),
    UNKNOWN_JOB_TYPE(HttpStatus.BAD_REQUEST, "알 수 없는 작업 타입입니다.", "JOB-004");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
