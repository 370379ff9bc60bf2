package com.yerin.syncwatch.config;

import com.yerin.syncwatch.application.JobHandler;
import com.yerin.syncwatch.application.SourceSyncService;
import com.yerin.syncwatch.application.SyncJobHandler;
import com.yerin.syncwatch.domain.JobType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JobHandlerConfig {

    @Bean
    public JobHandler dwsSyncHandler(SourceSyncService syncService) {
        return new SyncJobHandler(JobType.DWS_SYNC, syncService);
    }

    @Bean
    public JobHandler treasurySyncHandler(SourceSyncService syncService) {
        return new SyncJobHandler(JobType.TREASURY_SYNC, syncService);
    }

    @Bean
    public JobHandler correlationAnalysisHandler(SourceSyncService syncService) {
        return new SyncJobHandler(JobType.CORRELATION_ANALYSIS, syncService);
    }
}
