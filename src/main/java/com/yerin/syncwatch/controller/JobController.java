package com.yerin.syncwatch.controller;

import com.yerin.syncwatch.domain.JobView;
import com.yerin.syncwatch.dto.request.SubmitJobRequest;
import com.yerin.syncwatch.global.dto.DataResponse;
import com.yerin.syncwatch.service.JobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @PostMapping("/{type}")
    public ResponseEntity<DataResponse<Map<String, String>>> submit(
            @PathVariable String type,
            @Valid @RequestBody(required = false) SubmitJobRequest body
    ) {
        SubmitJobRequest req = body != null ? body : new SubmitJobRequest(null, null, null);
        String jobId = jobService.submit(type, req.source(), req.params(), req.priority());
        return ResponseEntity.accepted().body(DataResponse.from(Map.of("jobId", jobId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DataResponse<JobView>> get(@PathVariable String id) {
        return ResponseEntity.ok(DataResponse.from(jobService.get(id)));
    }

    @GetMapping
    public ResponseEntity<DataResponse<List<JobView>>> list(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(DataResponse.from(jobService.list(limit)));
    }
}
