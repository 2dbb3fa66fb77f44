package com.sandy.aiot.pump.incidents.controller;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import com.sandy.aiot.pump.incidents.entity.Incident;
import com.sandy.aiot.pump.incidents.exception.IncidentNotFoundException;
import com.sandy.aiot.pump.incidents.exception.ReportValidationException;
import com.sandy.aiot.pump.incidents.service.ConditionReport;
import com.sandy.aiot.pump.incidents.service.IncidentQueryService;
import com.sandy.aiot.pump.incidents.service.IncidentTracker;
import com.sandy.aiot.pump.incidents.service.Outcome;
import com.sandy.aiot.pump.incidents.tools.PayloadParser;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST endpoints for condition reports posted by pump monitors and for operator actions on incidents.
 * Kept under /api/events, the path the device firmware posts to.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class IncidentController {

    private static final int MAX_LIMIT = 1000;

    private final IncidentTracker incidentTracker;
    private final IncidentQueryService incidentQueryService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody Map<String, Object> body) {
        ConditionReport report = PayloadParser.parseConditionReport(body);
        Outcome outcome = incidentTracker.submit(report);

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        if (outcome instanceof Outcome.Created c) {
            resp.put("id", c.incidentId());
            resp.put("created", true);
            return ResponseEntity.status(HttpStatus.CREATED).body(resp);
        }
        if (outcome instanceof Outcome.Updated u) {
            resp.put("id", u.incidentId());
            resp.put("updated", true);
        } else if (outcome instanceof Outcome.Resolved r) {
            resp.put("id", r.incidentId());
            resp.put("resolved", true);
        } else {
            resp.put("message", "No active event to resolve");
        }
        return ResponseEntity.ok(resp);
    }

    @GetMapping
    public EventPage list(@RequestParam(defaultValue = "100") int limit,
                          @RequestParam(defaultValue = "0") int offset,
                          @RequestParam(required = false) String device,
                          @RequestParam(required = false) String active,
                          @RequestParam(required = false) String type,
                          @RequestParam(required = false) String startDate,
                          @RequestParam(required = false) String endDate) {
        if (limit < 1 || offset < 0) {
            throw new ReportValidationException("limit must be positive and offset non-negative");
        }
        int effectiveLimit = Math.min(limit, MAX_LIMIT);
        IncidentQueryService.Filter filter = IncidentQueryService.Filter.builder()
                .device(device == null || device.isBlank() ? null : device)
                .active(active == null ? null : "true".equalsIgnoreCase(active))
                .conditionType(parseType(type))
                .from(PayloadParser.parseDateParam(startDate, "startDate"))
                .to(PayloadParser.parseDateParam(endDate, "endDate"))
                .build();
        IncidentQueryService.Page page = incidentQueryService.search(filter, effectiveLimit, offset);

        EventPage resp = new EventPage();
        resp.setData(page.data().stream().map(this::toItem).collect(Collectors.toList()));
        Pagination p = new Pagination();
        p.setTotal(page.total());
        p.setLimit(effectiveLimit);
        p.setOffset(offset);
        p.setHasMore((long) offset + effectiveLimit < page.total());
        resp.setPagination(p);
        return resp;
    }

    @PatchMapping
    public ResponseEntity<Map<String, Object>> update(@RequestParam(required = false) String id,
                                                      @RequestParam(required = false) String action,
                                                      @RequestParam(required = false) String actor) {
        if (id == null || id.isBlank()) {
            throw new ReportValidationException("Event ID is required");
        }
        Long incidentId = parseId(id);
        Outcome outcome;
        String message;
        if ("acknowledge".equals(action)) {
            outcome = incidentTracker.acknowledge(incidentId, actor);
            message = "Event acknowledged successfully";
        } else if ("resolve".equals(action)) {
            outcome = incidentTracker.resolveManually(incidentId);
            message = "Event resolved successfully";
        } else {
            throw new ReportValidationException("Invalid action");
        }
        log.debug("Operator action={} id={} outcome={}", action, incidentId, outcome);

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("id", incidentId);
        resp.put("message", message);
        return ResponseEntity.ok(resp);
    }

    private Long parseId(String id) {
        try {
            return Long.valueOf(id.trim());
        } catch (NumberFormatException e) {
            // ids are numeric; anything else cannot exist
            throw new IncidentNotFoundException(null);
        }
    }

    private ConditionType parseType(String type) {
        if (type == null || type.isBlank()) return null;
        String t = type.trim();
        try {
            if (t.chars().allMatch(Character::isDigit)) {
                return ConditionType.fromCode(Integer.parseInt(t))
                        .orElseThrow(() -> new ReportValidationException("Invalid event type: " + type));
            }
            return ConditionType.valueOf(t.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException("Invalid event type: " + type);
        }
    }

    private EventItem toItem(Incident i) {
        EventItem it = new EventItem();
        it.setId(i.getId());
        it.setDevice(i.getDevice());
        it.setLocation(i.getLocation());
        it.setType(i.getConditionType());
        it.setValue(i.getValue());
        it.setThreshold(i.getThreshold());
        it.setDescription(i.getDescription());
        it.setStartTime(i.getStartTime());
        it.setTimestamp(i.getTimestamp());
        it.setDuration(String.valueOf(i.getDuration()));
        it.setActive(i.isActive());
        it.setAcknowledged(i.isAcknowledged());
        it.setAcknowledgedAt(i.getAcknowledgedAt());
        it.setAcknowledgedBy(i.getAcknowledgedBy());
        it.setCreatedAt(i.getCreatedAt());
        return it;
    }

    @Data
    public static class EventItem {
        private Long id;
        private String device;
        private String location;
        private ConditionType type;
        private double value;
        private double threshold;
        private String description;
        private Instant startTime;
        private Instant timestamp;
        // string so the 64-bit millisecond count survives JSON number handling on the client
        private String duration;
        private boolean active;
        private boolean acknowledged;
        private Instant acknowledgedAt;
        private String acknowledgedBy;
        private Instant createdAt;
    }

    @Data
    public static class Pagination {
        private long total;
        private int limit;
        private int offset;
        private boolean hasMore;
    }

    @Data
    public static class EventPage {
        private List<EventItem> data;
        private Pagination pagination;
    }
}
