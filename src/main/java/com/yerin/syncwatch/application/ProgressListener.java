package com.yerin.syncwatch.application;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message) -> {};

    void onProgress(int percent, String message);

    // 취소를 확인할 수 없는 호출자는 항상 false
    default boolean isCancelled() {
        return false;
    }
}
