package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.JobType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 잡 타입 하나를 해당 소스의 동기화 파이프라인에 연결한다.
 */
@Slf4j
@RequiredArgsConstructor
public class SyncJobHandler implements JobHandler {

    private final JobType type;
    private final SourceSyncService syncService;

    @Override
    public JobType type() {
        return type;
    }

    @Override
    public Map<String, Object> handle(JobContext context) throws Exception {
        log.info("[Handler.{}] jobId={}, params={}", type.tag(), context.jobId(), context.params());
        return syncService.sync(type.source(), context).toMap();
    }
}
