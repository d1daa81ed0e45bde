package in.co.vedicwisdom.services;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class TimezoneUtilsTest {

    @Test
    void testGetTimezoneOffset_NewYorkObservesDst() {
        assertEquals(-5.0, TimezoneUtils.getTimezoneOffset(40.71, -74.0, LocalDate.of(2024, 1, 15)), 0.0);
        assertEquals(-4.0, TimezoneUtils.getTimezoneOffset(40.71, -74.0, LocalDate.of(2024, 7, 15)), 0.0);
    }

    @Test
    void testGetTimezoneOffset_HalfHourZone() {
        assertEquals(5.5, TimezoneUtils.getTimezoneOffset(22.57, 88.36, LocalDate.of(2024, 7, 15)), 0.0);
        assertEquals(ZoneOffset.ofHoursMinutes(5, 30),
                TimezoneUtils.getZoneOffset(22.57, 88.36, LocalDate.of(2024, 7, 15)));
    }

    @Test
    void testGetZoneId() {
        assertEquals("Asia/Kolkata", TimezoneUtils.getZoneId(22.57, 88.36).orElseThrow().getId());
    }

    @Test
    void testGetFallbackTimezoneOffset() {
        assertEquals(5.0, TimezoneUtils.getFallbackTimezoneOffset(77.0), 0.0);
        assertEquals(-5.0, TimezoneUtils.getFallbackTimezoneOffset(-74.4), 0.0);
        assertEquals(0.0, TimezoneUtils.getFallbackTimezoneOffset(0.0), 0.0);
    }
}
