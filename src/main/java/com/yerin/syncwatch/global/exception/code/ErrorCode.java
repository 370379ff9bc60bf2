package com.yerin.syncwatch.global.exception.code;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
    HttpStatus getHttpStatus();
    String getMessage();
    String getCode();

    /** 상태와 코드는 그대로 두고 메시지만 바꾼다. */
    default ErrorCode withDetail(String detailMessage) {
        return new Detailed(this, detailMessage);
    }

    record Detailed(ErrorCode base, String detail) implements ErrorCode {
        @Override
        public HttpStatus getHttpStatus() {
            return base.getHttpStatus();
        }

        @Override
        public String getMessage() {
            return detail;
        }

        @Override
        public String getCode() {
            return base.getCode();
        }
    }
}
