package com.example.rentalrepairs.controller;

import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.model.enums.TenantRequestUrgency;
import com.example.rentalrepairs.service.TenantRequestService;
import com.example.rentalrepairs.specification.TenantRequestSpecifications;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;

@RestController
@RequestMapping("/metrics")
public class MetricsController {

    private final TenantRequestService requestService;
    private final Clock clock;

    public MetricsController(TenantRequestService requestService, Clock clock) {
        this.requestService = requestService;
        this.clock = clock;
    }

    /**
     * Request counts across the portfolio.
     *
     * Key metrics:
     *  - byStatus          : number of requests currently in each status
     *  - openRequests      : everything not yet COMPLETED or DECLINED
     *  - overdueByUrgency  : open requests past their expected resolution time
     */
    @GetMapping("/summary")
    public Map<String, Object> summary() {
        LocalDateTime now = LocalDateTime.now(clock);

        Map<TenantRequestStatus, Long> byStatus = new EnumMap<>(TenantRequestStatus.class);
        for (TenantRequestStatus status : TenantRequestStatus.values()) {
            byStatus.put(status, requestService.countRequests(TenantRequestSpecifications.byStatus(status)));
        }

        Map<TenantRequestUrgency, Long> overdue = new EnumMap<>(TenantRequestUrgency.class);
        for (TenantRequestUrgency urgency : TenantRequestUrgency.values()) {
            overdue.put(urgency, requestService.countRequests(TenantRequestSpecifications.overdue(urgency, now)));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("generatedAt", now);
        result.put("byStatus", byStatus);
        result.put("openRequests", requestService.countRequests(TenantRequestSpecifications.open()));
        result.put("overdueByUrgency", overdue);
        result.put("overdueTotal", overdue.values().stream().mapToLong(Long::longValue).sum());
        return result;
    }

    /** Overdue requests of one urgency, oldest deadline first */
    @GetMapping("/overdue")
    public List<Map<String, Object>> overdue(@RequestParam TenantRequestUrgency urgency) {
        LocalDateTime now = LocalDateTime.now(clock);
        return requestService.findRequests(TenantRequestSpecifications.overdue(urgency, now)).stream()
                .map(request -> buildOverdueEntry(request, now))
                .toList();
    }

    private Map<String, Object> buildOverdueEntry(TenantRequest request, LocalDateTime now) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("requestId", request.getId());
        m.put("code", request.getCode());
        m.put("status", request.getStatus());
        m.put("requiredSpecialization", request.getRequiredSpecialization());
        m.put("assignedWorkerId", request.getAssignedWorkerId());
        m.put("dueAt", request.getDueAt());
        m.put("overdueHours", Duration.between(request.getDueAt(), now).toHours());
        return m;
    }
}
