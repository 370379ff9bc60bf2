package com.yerin.syncwatch.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    MALFORMED_BODY(HttpStatus.BAD_REQUEST, "요청 본문을 읽을 수 없습니다.", "COMMON-001"),
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "요청 파라미터가 잘못되었습니다.", "COMMON-002"),
    NO_SUCH_PATH(HttpStatus.NOT_FOUND, "존재하지 않는 경로입니다.", "COMMON-003"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부에서 에러가 발생했습니다.", "COMMON-004"),
    INTERRUPTED(HttpStatus.SERVICE_UNAVAILABLE, "서버가 종료 중이라 요청을 끝내지 못했습니다.", "COMMON-005");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
