package com.sandy.aiot.pump.incidents.tools;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import com.sandy.aiot.pump.incidents.exception.ReportValidationException;
import com.sandy.aiot.pump.incidents.service.ConditionReport;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadParserTest {

    private Map<String, Object> payload() {
        Map<String, Object> m = new HashMap<>();
        m.put("device", "well-pump-monitor");
        m.put("location", "Pump House");
        m.put("timestamp", "1640995200000");
        m.put("type", 3);
        m.put("value", 1.5);
        m.put("threshold", 2);
        m.put("startTime", 1640995180000L);
        m.put("duration", "20000");
        m.put("active", true);
        m.put("description", "Low temperature");
        return m;
    }

    @Test
    void parsesStringAndNumericEncodings() {
        ConditionReport r = PayloadParser.parseConditionReport(payload());
        assertEquals(ConditionType.LOW_TEMPERATURE, r.getConditionType());
        assertEquals(Instant.ofEpochMilli(1640995200000L), r.getTimestamp());
        assertEquals(Instant.ofEpochMilli(1640995180000L), r.getStartTime());
        assertEquals(20000L, r.getDuration());
        assertEquals(2.0, r.getThreshold(), 1e-9);
        assertTrue(r.isActive());
    }

    @Test
    void missingDataHasNoWireCode() {
        Map<String, Object> m = payload();
        m.put("type", 0);
        ReportValidationException ex = assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(m));
        assertEquals("Invalid event type: 0", ex.getMessage());
    }

    @Test
    void rejectsBlankTextNegativeDurationAndBadTimestamp() {
        Map<String, Object> blank = payload();
        blank.put("device", "  ");
        assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(blank));

        Map<String, Object> negative = payload();
        negative.put("duration", -1);
        assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(negative));

        Map<String, Object> badTs = payload();
        badTs.put("timestamp", "yesterday");
        ReportValidationException ex = assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(badTs));
        assertEquals("Field must be an integer: timestamp", ex.getMessage());

        Map<String, Object> nullActive = payload();
        nullActive.put("active", null);
        ex = assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(nullActive));
        assertEquals("Missing required field: active", ex.getMessage());
    }

    @Test
    void typeCodeOutsideIntRangeIsNotWrappedOntoAKnownType() {
        Map<String, Object> m = payload();
        m.put("type", 4294967297L);
        ReportValidationException ex = assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(m));
        assertEquals("Invalid event type: 4294967297", ex.getMessage());
    }

    @Test
    void overflowingIntegersAreRejectedInsteadOfClamped() {
        Map<String, Object> big = payload();
        big.put("duration", new BigInteger("99999999999999999999"));
        ReportValidationException ex = assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(big));
        assertEquals("Field must be an integer: duration", ex.getMessage());

        Map<String, Object> huge = payload();
        huge.put("timestamp", 1e20);
        ex = assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(huge));
        assertEquals("Field must be an integer: timestamp", ex.getMessage());

        Map<String, Object> tooLongText = payload();
        tooLongText.put("startTime", "99999999999999999999");
        assertThrows(ReportValidationException.class, () -> PayloadParser.parseConditionReport(tooLongText));
    }

    @Test
    void sampleCountMustFitAnInt() {
        Map<String, Object> reading = new HashMap<>();
        for (String field : PayloadParser.SENSOR_FIELDS) {
            reading.put(field, 1);
        }
        reading.put("device", "well-pump-monitor");
        reading.put("location", "Pump House");
        assertEquals(1, PayloadParser.parseSensorReading(reading).getSampleCount());

        reading.put("sampleCount", 4294967297L);
        ReportValidationException ex = assertThrows(ReportValidationException.class, () -> PayloadParser.parseSensorReading(reading));
        assertEquals("Field must be an integer: sampleCount", ex.getMessage());
    }

    @Test
    void dateParamAcceptsIsoAndEpochMillis() {
        assertEquals(Instant.parse("2022-01-01T00:00:00Z"), PayloadParser.parseDateParam("2022-01-01T00:00:00Z", "startDate"));
        assertEquals(Instant.ofEpochMilli(1640995200000L), PayloadParser.parseDateParam("1640995200000", "startDate"));
        assertNull(PayloadParser.parseDateParam(" ", "startDate"));
        assertThrows(ReportValidationException.class, () -> PayloadParser.parseDateParam("01/01/2022", "startDate"));
    }
}
