package com.yerin.syncwatch.controller;

import com.yerin.syncwatch.domain.JobMetricsSnapshot;
import com.yerin.syncwatch.global.dto.DataResponse;
import com.yerin.syncwatch.notification.NotificationHub;
import com.yerin.syncwatch.service.JobService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/admin/metrics")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final JobService jobService;
    private final NotificationHub hub;

    @GetMapping("/jobs")
    public ResponseEntity<DataResponse<JobMetricsSnapshot>> jobs(@RequestHeader(value = "X-Admin-Token", required = true)
                                                                 @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                 String adminToken) {
        return ResponseEntity.ok(DataResponse.from(jobService.metrics()));
    }

    @GetMapping("/connections")
    public Map<String, Object> connections(@RequestHeader(value = "X-Admin-Token", required = true)
                                           @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                           String adminToken) {
        return Map.of(
                "connections", hub.connectionCount(),
                "ts", Instant.now().toString()
        );
    }
}
