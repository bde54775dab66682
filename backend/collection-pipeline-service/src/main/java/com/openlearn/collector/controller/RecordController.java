package com.openlearn.collector.controller;

import com.openlearn.collector.dto.RecordDTO;
import com.openlearn.collector.service.RecordQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/records")
public class RecordController {

    private final RecordQueryService recordQueryService;

    public RecordController(RecordQueryService recordQueryService) {
        this.recordQueryService = recordQueryService;
    }

    /**
     * GET /api/v1/records?sourceKey=&limit= - 최근 저장 레코드 (캐시 경유)
     */
    @GetMapping
    public ResponseEntity<List<RecordDTO>> recent(
            @RequestParam(required = false) String sourceKey,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(recordQueryService.recent(sourceKey, limit));
    }
}
