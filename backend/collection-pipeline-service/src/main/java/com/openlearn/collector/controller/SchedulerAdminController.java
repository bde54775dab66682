package com.openlearn.collector.controller;

import com.openlearn.collector.dto.CollectionJobDTO;
import com.openlearn.collector.dto.ConnectionTestResponse;
import com.openlearn.collector.dto.PageResponse;
import com.openlearn.collector.dto.SchedulerStatusDTO;
import com.openlearn.collector.dto.SourceStatusDTO;
import com.openlearn.collector.dto.TriggerResponse;
import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.mapper.EntityMapper;
import com.openlearn.collector.scheduler.TieredCollectionScheduler;
import com.openlearn.collector.service.CollectionAdminService;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/scheduler")
public class SchedulerAdminController {

    private final TieredCollectionScheduler scheduler;
    private final CollectionAdminService adminService;
    private final EntityMapper entityMapper;

    public SchedulerAdminController(TieredCollectionScheduler scheduler,
                                    CollectionAdminService adminService,
                                    EntityMapper entityMapper) {
        this.scheduler = scheduler;
        this.adminService = adminService;
        this.entityMapper = entityMapper;
    }

    /**
     * GET /api/v1/scheduler/status - 스케줄러 전체 상태
     */
    @GetMapping("/status")
    public ResponseEntity<SchedulerStatusDTO> status() {
        return ResponseEntity.ok(scheduler.status());
    }

    /**
     * GET /api/v1/scheduler/sources - 소스별 다음/마지막 실행, 연속 실패 수
     */
    @GetMapping("/sources")
    public ResponseEntity<List<SourceStatusDTO>> sources() {
        return ResponseEntity.ok(scheduler.getAllStatuses());
    }

    @GetMapping("/sources/{sourceKey}")
    public ResponseEntity<SourceStatusDTO> source(@PathVariable String sourceKey) {
        return ResponseEntity.ok(scheduler.getStatus(sourceKey));
    }

    /**
     * POST /api/v1/scheduler/sources/{sourceKey}/trigger - 즉시 수집
     */
    @PostMapping("/sources/{sourceKey}/trigger")
    public ResponseEntity<TriggerResponse> trigger(@PathVariable String sourceKey) {
        Long jobId = scheduler.triggerNow(sourceKey);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new TriggerResponse(sourceKey, jobId, "Collection triggered for " + sourceKey));
    }

    @PostMapping("/sources/{sourceKey}/pause")
    public ResponseEntity<SourceStatusDTO> pause(@PathVariable String sourceKey) {
        scheduler.pause(sourceKey);
        return ResponseEntity.ok(scheduler.getStatus(sourceKey));
    }

    @PostMapping("/sources/{sourceKey}/resume")
    public ResponseEntity<SourceStatusDTO> resume(@PathVariable String sourceKey) {
        scheduler.resume(sourceKey);
        return ResponseEntity.ok(scheduler.getStatus(sourceKey));
    }

    /**
     * POST /api/v1/scheduler/sources/{sourceKey}/test - 소스 연결 테스트
     */
    @PostMapping("/sources/{sourceKey}/test")
    public ResponseEntity<ConnectionTestResponse> testConnection(@PathVariable String sourceKey) {
        return ResponseEntity.ok(adminService.testConnection(sourceKey));
    }

    /**
     * GET /api/v1/scheduler/jobs - 작업 이력 (소스/상태/시작 시각 필터)
     */
    @GetMapping("/jobs")
    public ResponseEntity<PageResponse<CollectionJobDTO>> jobs(
            @RequestParam(required = false) String sourceKey,
            @RequestParam(required = false) JobStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime since,
            @PageableDefault(size = 20, sort = "triggerTime", direction = Sort.Direction.DESC) Pageable pageable) {
        return ResponseEntity.ok(PageResponse.from(
                adminService.searchJobs(sourceKey, status, since, pageable), entityMapper::toDTO));
    }
}
