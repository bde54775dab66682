package com.openlearn.collector.controller;

import com.openlearn.collector.dto.AlertDTO;
import com.openlearn.collector.dto.PageResponse;
import com.openlearn.collector.mapper.EntityMapper;
import com.openlearn.collector.service.AlertService;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/alerts")
public class AlertController {

    private final AlertService alertService;
    private final EntityMapper entityMapper;

    public AlertController(AlertService alertService, EntityMapper entityMapper) {
        this.alertService = alertService;
        this.entityMapper = entityMapper;
    }

    /**
     * GET /api/v1/alerts - 임계값/dead_letter 알림 조회
     */
    @GetMapping
    public ResponseEntity<PageResponse<AlertDTO>> list(
            @RequestParam(required = false) String sourceKey,
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime since,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        return ResponseEntity.ok(PageResponse.from(
                alertService.search(sourceKey, kind, since, pageable), entityMapper::toDTO));
    }
}
