package com.yerin.syncwatch.controller;

import com.yerin.syncwatch.domain.JobView;
import com.yerin.syncwatch.global.dto.DataResponse;
import com.yerin.syncwatch.service.JobService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/jobs")
public class AdminJobController {
    private final JobService jobService;

    @PostMapping("/{id}/cancel")
    public ResponseEntity<DataResponse<JobView>> cancel(@PathVariable String id,
                                                        @RequestHeader(value = "X-Admin-Token", required = true)
                                                        @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                        String adminToken) {
        return ResponseEntity.ok(DataResponse.from(jobService.cancel(id)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<DataResponse<JobView>> retry(@PathVariable String id,
                                                       @RequestHeader(value = "X-Admin-Token", required = true)
                                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                       String adminToken) {
        return ResponseEntity.accepted().body(DataResponse.from(jobService.retry(id)));
    }
}
