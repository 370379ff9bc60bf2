package com.yerin.syncwatch.service;

import com.yerin.syncwatch.domain.JobMetricsSnapshot;
import com.yerin.syncwatch.domain.JobType;
import com.yerin.syncwatch.domain.JobView;
import com.yerin.syncwatch.global.exception.AppException;
import com.yerin.syncwatch.global.exception.code.JobErrorCode;
import com.yerin.syncwatch.infra.JobWorkerPool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class JobService {

    static final int MAX_LIST_LIMIT = 500;

    private final JobWorkerPool pool;

    public String submit(String typeTag, String source, Map<String, Object> params, Integer priority) {
        JobType type = JobType.fromTag(typeTag)
                .orElseThrow(() -> new AppException(
                        JobErrorCode.UNKNOWN_JOB_TYPE.withDetail("알 수 없는 작업 타입입니다: " + typeTag)));
        return pool.submit(type, source, params, priority);
    }

    public JobView get(String jobId) {
        return pool.status(jobId).orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }

    public List<JobView> list(int limit) {
        return pool.listRecent(Math.max(1, Math.min(limit, MAX_LIST_LIMIT)));
    }

    public JobView cancel(String jobId) {
        get(jobId);
        if (!pool.cancel(jobId)) {
            throw new AppException(JobErrorCode.JOB_NOT_CANCELLABLE);
        }
        return get(jobId);
    }

    /** @return 새로 만들어진 작업 */
    public JobView retry(String jobId) {
        get(jobId);
        String newId = pool.retry(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_RETRYABLE));
        return get(newId);
    }

    public JobMetricsSnapshot metrics() {
        return pool.metrics();
    }
}
