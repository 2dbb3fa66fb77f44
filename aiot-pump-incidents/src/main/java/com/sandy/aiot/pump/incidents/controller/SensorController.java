package com.sandy.aiot.pump.incidents.controller;

import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.exception.ReportValidationException;
import com.sandy.aiot.pump.incidents.service.SensorQueryService;
import com.sandy.aiot.pump.incidents.service.SensorReadingService;
import com.sandy.aiot.pump.incidents.tools.PayloadParser;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telemetry windows from the pump monitor. They also feed the missing-data check.
 */
@RestController
@RequestMapping("/api/sensors")
@RequiredArgsConstructor
public class SensorController {

    private static final int MAX_LIMIT = 1000;

    private final SensorReadingService sensorReadingService;
    private final SensorQueryService sensorQueryService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> save(@RequestBody Map<String, Object> body) {
        SensorReading saved = sensorReadingService.save(PayloadParser.parseSensorReading(body));
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("id", saved.getId());
        resp.put("message", "Sensor data saved successfully");
        return ResponseEntity.status(HttpStatus.CREATED).body(resp);
    }

    @GetMapping
    public SensorPage list(@RequestParam(defaultValue = "100") int limit,
                           @RequestParam(defaultValue = "0") int offset,
                           @RequestParam(required = false) String device,
                           @RequestParam(required = false) String startDate,
                           @RequestParam(required = false) String endDate) {
        if (limit < 1 || offset < 0) {
            throw new ReportValidationException("limit must be positive and offset non-negative");
        }
        int effectiveLimit = Math.min(limit, MAX_LIMIT);
        SensorQueryService.Filter filter = SensorQueryService.Filter.builder()
                .device(blankToNull(device))
                .from(PayloadParser.parseDateParam(startDate, "startDate"))
                .to(PayloadParser.parseDateParam(endDate, "endDate"))
                .build();
        SensorQueryService.Page page = sensorQueryService.search(filter, effectiveLimit, offset);

        SensorPage resp = new SensorPage();
        resp.setData(page.data());
        IncidentController.Pagination p = new IncidentController.Pagination();
        p.setTotal(page.total());
        p.setLimit(effectiveLimit);
        p.setOffset(offset);
        p.setHasMore((long) offset + effectiveLimit < page.total());
        resp.setPagination(p);
        return resp;
    }

    @GetMapping(params = "aggregate")
    public AggregatePage aggregate(@RequestParam String aggregate,
                                   @RequestParam(required = false) String device,
                                   @RequestParam(required = false) String startDate,
                                   @RequestParam(required = false) String endDate) {
        SensorQueryService.Interval interval;
        if ("hour".equals(aggregate)) {
            interval = SensorQueryService.Interval.HOUR;
        } else if ("6hour".equals(aggregate)) {
            interval = SensorQueryService.Interval.SIX_HOURS;
        } else {
            throw new ReportValidationException("Invalid aggregate: " + aggregate);
        }
        Instant from = PayloadParser.parseDateParam(startDate, "startDate");
        Instant to = PayloadParser.parseDateParam(endDate, "endDate");
        if (from == null || to == null) {
            throw new ReportValidationException("startDate and endDate are required for aggregate");
        }

        AggregatePage resp = new AggregatePage();
        resp.setData(sensorQueryService.aggregate(interval, from, to, blankToNull(device)));
        Aggregation a = new Aggregation();
        a.setInterval(aggregate);
        a.setStartDate(from);
        a.setEndDate(to);
        resp.setAggregation(a);
        return resp;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    @Data
    public static class SensorPage {
        private List<SensorReading> data;
        private IncidentController.Pagination pagination;
    }

    @Data
    public static class Aggregation {
        private String interval;
        private Instant startDate;
        private Instant endDate;
    }

    @Data
    public static class AggregatePage {
        private List<SensorQueryService.Bucket> data;
        private Aggregation aggregation;
    }
}
