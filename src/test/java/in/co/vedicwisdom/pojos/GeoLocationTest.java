package in.co.vedicwisdom.pojos;

import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class GeoLocationTest {

    @Test
    void testConstructor_RejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new GeoLocation(90.5, 0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new GeoLocation(0.0, -180.5, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new GeoLocation(0.0, 0.0, 14.5));
        assertThrows(IllegalArgumentException.class, () -> new GeoLocation(Double.NaN, 0.0, 0.0));
    }

    @Test
    void testGetZoneOffset_HalfHour() {
        GeoLocation chennai = new GeoLocation("Chennai", 13.08, 80.27, 5.5);

        assertEquals(ZoneOffset.ofHoursMinutes(5, 30), chennai.getZoneOffset());
    }

    @Test
    void testEquals() {
        assertEquals(new GeoLocation("A", 10.0, 20.0, 1.0), new GeoLocation("A", 10.0, 20.0, 1.0));
        assertNotEquals(new GeoLocation("A", 10.0, 20.0, 1.0), new GeoLocation("A", 10.0, 20.0, 2.0));
    }
}
