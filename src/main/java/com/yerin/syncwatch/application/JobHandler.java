package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.JobType;

import java.util.Map;

public interface JobHandler {
    JobType type();

    Map<String, Object> handle(JobContext context) throws Exception;
}
