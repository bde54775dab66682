package com.openlearn.collector.controller;

import com.openlearn.collector.dto.CacheInvalidationResponse;
import com.openlearn.collector.service.CollectionAdminService;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cache")
public class CacheAdminController {

    private final CollectionAdminService adminService;

    public CacheAdminController(CollectionAdminService adminService) {
        this.adminService = adminService;
    }

    /**
     * DELETE /api/v1/cache?pattern=records:v1:* - 패턴 일치 캐시 항목 삭제
     */
    @DeleteMapping
    public ResponseEntity<CacheInvalidationResponse> invalidate(@RequestParam String pattern) {
        return ResponseEntity.ok(adminService.invalidateCache(pattern));
    }

    @GetMapping("/stats")
    public ResponseEntity<LayeredCacheManager.CacheStats> stats() {
        return ResponseEntity.ok(adminService.cacheStats());
    }
}
