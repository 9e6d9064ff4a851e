package com.dashboard.api;

import com.dashboard.domain.model.DashboardStatsResponse;
import com.dashboard.domain.model.TenantOverviewResponse;
import com.dashboard.domain.service.DashboardQueryService;
import com.dashboard.domain.service.StatsRefreshScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for dashboard statistics.
 * 
 * Endpoints:
 * - GET /api/v1/dashboard/ac/{acId}/stats - Stats for one AC
 * - GET /api/v1/dashboard/overview - Roll-up across all ACs
 * - POST /api/v1/dashboard/refresh - Start a snapshot refresh cycle now
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
public class DashboardController {
    
    private final DashboardQueryService dashboardQueryService;
    private final StatsRefreshScheduler refreshScheduler;
    
    /**
     * Dashboard statistics for one AC.
     * 
     * GET /api/v1/dashboard/ac/111/stats
     * 
     * Response:
     * - acId, acName
     * - totalFamilies, totalMembers, surveysCompleted, totalBooths
     * - boothStats: per-booth voter counts sorted by booth number
     * - source: cache | precomputed | realtime
     * - computedAt: when the underlying numbers were computed
     */
    @GetMapping("/ac/{acId}/stats")
    public ResponseEntity<DashboardStatsResponse> getStats(@PathVariable("acId") int acId) {
        log.info("Get dashboard stats: acId={}", acId);
        
        DashboardStatsResponse response = dashboardQueryService.getStats(acId);
        
        return ResponseEntity.ok(response);
    }
    
    /**
     * Roll-up across all ACs, built from precomputed snapshots.
     */
    @GetMapping("/overview")
    public ResponseEntity<TenantOverviewResponse> getOverview() {
        log.info("Get dashboard overview");
        
        return ResponseEntity.ok(dashboardQueryService.getOverview());
    }
    
    /**
     * Start a refresh cycle.
     * 
     * 202 when started, 409 when a cycle is already running.
     */
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, String>> triggerRefresh() {
        log.info("Manual refresh requested");
        
        if (refreshScheduler.triggerRefresh().isPresent()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "started"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "already-running"));
    }
    
    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
