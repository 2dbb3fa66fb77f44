package com.sandy.aiot.pump.incidents.tools;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.exception.ReportValidationException;
import com.sandy.aiot.pump.incidents.service.ConditionReport;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Utility class turning the loosely typed JSON sent by the pump monitor into validated domain objects.
 * Epoch millisecond fields may arrive as strings or numbers.
 */
public class PayloadParser {

    public static final List<String> EVENT_FIELDS = List.of(
            "device", "location", "timestamp", "type", "value", "threshold",
            "startTime", "duration", "active", "description");

    public static final List<String> SENSOR_FIELDS = List.of(
            "device", "location", "timestamp", "startTime", "endTime", "sampleCount",
            "tempMin", "tempMax", "tempAvg",
            "humMin", "humMax", "humAvg",
            "pressMin", "pressMax", "pressAvg",
            "current1Min", "current1Max", "current1Avg", "current1RMS", "dutyCycle1",
            "current2Min", "current2Max", "current2Avg", "current2RMS", "dutyCycle2");

    private PayloadParser() {
    }

    /**
     * Validates an event payload and maps it to a report.
     *
     * @param body decoded JSON object, e.g. {"device":"pump-1","type":1,"timestamp":"1640995200000",...}
     * @throws ReportValidationException on a missing field, a value of the wrong shape or an unknown type code
     */
    public static ConditionReport parseConditionReport(Map<String, Object> body) {
        requireFields(body, EVENT_FIELDS);
        long code = toLong(body.get("type"), "type");
        ConditionType type = (code < Integer.MIN_VALUE || code > Integer.MAX_VALUE
                ? Optional.<ConditionType>empty()
                : ConditionType.fromCode((int) code))
                .orElseThrow(() -> new ReportValidationException("Invalid event type: " + body.get("type")));
        long duration = toLong(body.get("duration"), "duration");
        if (duration < 0) {
            throw new ReportValidationException("Invalid duration: " + duration);
        }
        return ConditionReport.builder()
                .device(toText(body.get("device"), "device"))
                .location(toText(body.get("location"), "location"))
                .description(toText(body.get("description"), "description"))
                .conditionType(type)
                .timestamp(toInstant(body.get("timestamp"), "timestamp"))
                .startTime(toInstant(body.get("startTime"), "startTime"))
                .value(toDouble(body.get("value"), "value"))
                .threshold(toDouble(body.get("threshold"), "threshold"))
                .duration(duration)
                .active(toBoolean(body.get("active"), "active"))
                .build();
    }

    public static SensorReading parseSensorReading(Map<String, Object> body) {
        requireFields(body, SENSOR_FIELDS);
        return SensorReading.builder()
                .device(toText(body.get("device"), "device"))
                .location(toText(body.get("location"), "location"))
                .timestamp(toInstant(body.get("timestamp"), "timestamp"))
                .startTime(toInstant(body.get("startTime"), "startTime"))
                .endTime(toInstant(body.get("endTime"), "endTime"))
                .sampleCount(toInt(body.get("sampleCount"), "sampleCount"))
                .tempMin(toDouble(body.get("tempMin"), "tempMin"))
                .tempMax(toDouble(body.get("tempMax"), "tempMax"))
                .tempAvg(toDouble(body.get("tempAvg"), "tempAvg"))
                .humMin(toDouble(body.get("humMin"), "humMin"))
                .humMax(toDouble(body.get("humMax"), "humMax"))
                .humAvg(toDouble(body.get("humAvg"), "humAvg"))
                .pressMin(toDouble(body.get("pressMin"), "pressMin"))
                .pressMax(toDouble(body.get("pressMax"), "pressMax"))
                .pressAvg(toDouble(body.get("pressAvg"), "pressAvg"))
                .current1Min(toDouble(body.get("current1Min"), "current1Min"))
                .current1Max(toDouble(body.get("current1Max"), "current1Max"))
                .current1Avg(toDouble(body.get("current1Avg"), "current1Avg"))
                .current1Rms(toDouble(body.get("current1RMS"), "current1RMS"))
                .dutyCycle1(toDouble(body.get("dutyCycle1"), "dutyCycle1"))
                .current2Min(toDouble(body.get("current2Min"), "current2Min"))
                .current2Max(toDouble(body.get("current2Max"), "current2Max"))
                .current2Avg(toDouble(body.get("current2Avg"), "current2Avg"))
                .current2Rms(toDouble(body.get("current2RMS"), "current2RMS"))
                .dutyCycle2(toDouble(body.get("dutyCycle2"), "dutyCycle2"))
                .build();
    }

    /**
     * Query parameter date: ISO-8601 instant or epoch millis. Blank means no bound.
     */
    public static Instant parseDateParam(String raw, String name) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();
        try {
            if (s.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochMilli(Long.parseLong(s));
            }
            return Instant.parse(s);
        } catch (DateTimeException | NumberFormatException e) {
            throw new ReportValidationException("Invalid " + name + ": " + raw);
        }
    }

    private static void requireFields(Map<String, Object> body, List<String> fields) {
        if (body == null) {
            throw new ReportValidationException("Request body is required");
        }
        for (String field : fields) {
            if (!body.containsKey(field) || body.get(field) == null) {
                throw new ReportValidationException("Missing required field: " + field);
            }
        }
    }

    private static String toText(Object v, String field) {
        String s = v instanceof CharSequence cs ? cs.toString().trim() : null;
        if (s == null || s.isEmpty()) {
            throw new ReportValidationException("Field must be a non-empty string: " + field);
        }
        return s;
    }

    private static long toLong(Object v, String field) {
        try {
            if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
                return ((Number) v).longValue();
            }
            if (v instanceof BigInteger bi) return bi.longValueExact();
            if (v instanceof BigDecimal bd) return bd.longValueExact();
            if (v instanceof Number n) {
                // 2^63 itself is not representable as a long
                double d = n.doubleValue();
                if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) return (long) d;
            }
            if (v instanceof CharSequence cs) {
                return Long.parseLong(cs.toString().trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ReportValidationException("Field must be an integer: " + field);
        }
        throw new ReportValidationException("Field must be an integer: " + field);
    }

    private static int toInt(Object v, String field) {
        try {
            return Math.toIntExact(toLong(v, field));
        } catch (ArithmeticException e) {
            throw new ReportValidationException("Field must be an integer: " + field);
        }
    }

    private static double toDouble(Object v, String field) {
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof CharSequence cs) {
            try {
                return Double.parseDouble(cs.toString().trim());
            } catch (NumberFormatException e) {
                throw new ReportValidationException("Field must be numeric: " + field);
            }
        }
        throw new ReportValidationException("Field must be numeric: " + field);
    }

    private static boolean toBoolean(Object v, String field) {
        if (v instanceof Boolean b) return b;
        if (v instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if ("true".equalsIgnoreCase(s)) return true;
            if ("false".equalsIgnoreCase(s)) return false;
        }
        throw new ReportValidationException("Field must be a boolean: " + field);
    }

    private static Instant toInstant(Object v, String field) {
        return Instant.ofEpochMilli(toLong(v, field));
    }
}
