package com.yerin.syncwatch.controller;

import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.dto.request.SyncTriggerRequest;
import com.yerin.syncwatch.dto.response.SyncTriggerResult;
import com.yerin.syncwatch.global.dto.DataResponse;
import com.yerin.syncwatch.scheduler.SchedulerStatus;
import com.yerin.syncwatch.service.SyncOrchestrator;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class SchedulerController {

    private final SyncOrchestrator orchestrator;
    private final SyncProperties properties;

    @GetMapping("/scheduler/status")
    public ResponseEntity<DataResponse<SchedulerStatus>> status() {
        return ResponseEntity.ok(DataResponse.from(orchestrator.schedulerStatus()));
    }

    @PostMapping("/admin/scheduler/start")
    public ResponseEntity<DataResponse<SchedulerStatus>> start(@RequestHeader(value = "X-Admin-Token", required = true)
                                                               @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                               String adminToken) {
        return ResponseEntity.ok(DataResponse.from(orchestrator.startScheduler()));
    }

    @PostMapping("/admin/scheduler/stop")
    public ResponseEntity<DataResponse<SchedulerStatus>> stop(@RequestHeader(value = "X-Admin-Token", required = true)
                                                              @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                              String adminToken) {
        return ResponseEntity.ok(DataResponse.from(orchestrator.stopScheduler()));
    }

    @PutMapping("/admin/scheduler/config")
    public ResponseEntity<DataResponse<Map<String, Object>>> updateConfig(
            @RequestBody Map<String, Object> changes,
            @RequestHeader(value = "X-Admin-Token", required = true)
            @Parameter(description = "관리자 토큰", example = "test-admin-token")
            String adminToken) {
        return ResponseEntity.ok(DataResponse.from(orchestrator.updateSchedulerConfig(changes)));
    }

    @PostMapping("/sync/trigger")
    public ResponseEntity<DataResponse<SyncTriggerResult>> trigger(
            @Valid @RequestBody(required = false) SyncTriggerRequest body) throws InterruptedException {
        SyncTriggerRequest req = body != null ? body : new SyncTriggerRequest(null, null, false);
        if (req.waitForCompletion()) {
            SyncTriggerResult result = orchestrator.triggerSyncAndWait(req.sourceOrAll(), req.priority(),
                    properties.getWorker().getJobTimeout());
            return ResponseEntity.ok(DataResponse.from(result));
        }
        return ResponseEntity.accepted().body(DataResponse.from(orchestrator.triggerSync(req.sourceOrAll(), req.priority())));
    }
}
