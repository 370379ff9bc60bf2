package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.Job;

import java.util.Map;

/**
 * 핸들러가 보는 실행 중인 Job. 진행률 보고와 협력적 취소 확인만 열어 둔다.
 */
public final class JobContext implements ProgressListener {

    private final Job job;

    public JobContext(Job job) {
        this.job = job;
    }

    public String jobId() {
        return job.getId();
    }

    public Map<String, Object> params() {
        return job.getParams();
    }

    public boolean isCancelled() {
        return job.isCancelled();
    }

    @Override
    public void onProgress(int percent, String message) {
        job.reportProgress(percent, message);
    }
}
