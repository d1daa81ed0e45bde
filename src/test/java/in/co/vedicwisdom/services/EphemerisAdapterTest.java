package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.SunriseSunset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class EphemerisAdapterTest {

    private static final GeoLocation LOCATION = new GeoLocation("New Jersey", 40.0, -74.4, -5.0);
    private static final ZonedDateTime MOMENT = ZonedDateTime.of(2024, 5, 7, 4, 50, 0, 0, ZoneOffset.ofHours(-5));
    private static final LocalDate DATE = LocalDate.of(2024, 5, 7);

    @Mock
    private EphemerisProvider provider;

    private EphemerisAdapter adapter;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        adapter = new EphemerisAdapter(provider);
    }

    @Test
    void testPositions_NormalizesLongitudes() throws Exception {
        when(provider.reading(any(Instant.class), anyDouble(), anyDouble()))
                .thenReturn(new CelestialPosition(MOMENT.toInstant(), 370.0, -10.0, 23.44));

        CelestialPosition position = adapter.positions(MOMENT, LOCATION);

        assertEquals(10.0, position.getSunLongitude(), 1e-9);
        assertEquals(350.0, position.getMoonLongitude(), 1e-9);
        assertEquals(MOMENT.toInstant(), position.getInstant());
        verify(provider).reading(MOMENT.toInstant(), 40.0, -74.4);
    }

    @Test
    void testPositions_AbsurdValueIsUnavailable() throws Exception {
        when(provider.reading(any(Instant.class), anyDouble(), anyDouble()))
                .thenReturn(new CelestialPosition(MOMENT.toInstant(), 721.0, 10.0, 23.44));

        ComputationException e = assertThrows(ComputationException.class, () -> adapter.positions(MOMENT, LOCATION));
        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
    }

    @Test
    void testPositions_NonFiniteValueIsUnavailable() throws Exception {
        when(provider.reading(any(Instant.class), anyDouble(), anyDouble()))
                .thenReturn(new CelestialPosition(MOMENT.toInstant(), 10.0, Double.NaN, 23.44));

        ComputationException e = assertThrows(ComputationException.class, () -> adapter.positions(MOMENT, LOCATION));
        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
    }

    @Test
    void testPositions_ProviderFailureIsUnavailable() throws Exception {
        IOException cause = new IOException("connection refused");
        when(provider.reading(any(Instant.class), anyDouble(), anyDouble())).thenThrow(cause);

        ComputationException e = assertThrows(ComputationException.class, () -> adapter.positions(MOMENT, LOCATION));
        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
        assertSame(cause, e.getCause());
    }

    @Test
    void testPositions_NullReadingIsUnavailable() throws Exception {
        when(provider.reading(any(Instant.class), anyDouble(), anyDouble())).thenReturn(null);

        ComputationException e = assertThrows(ComputationException.class, () -> adapter.positions(MOMENT, LOCATION));
        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
    }

    @Test
    void testSunriseSunset_InvalidDatePropagates() throws Exception {
        when(provider.sunriseSunset(any(LocalDate.class), anyDouble(), anyDouble(), any(ZoneOffset.class)))
                .thenThrow(new ComputationException(ErrorCode.INVALID_DATE, "polar night"));

        ComputationException e = assertThrows(ComputationException.class, () -> adapter.sunriseSunset(DATE, LOCATION));
        assertEquals(ErrorCode.INVALID_DATE, e.getErrorCode());
    }

    @Test
    void testSunriseSunset_SunriseAfterSunsetIsUnavailable() throws Exception {
        ZoneOffset offset = LOCATION.getZoneOffset();
        when(provider.sunriseSunset(any(LocalDate.class), anyDouble(), anyDouble(), any(ZoneOffset.class)))
                .thenReturn(new SunriseSunset(DATE.atTime(19, 0).atZone(offset), DATE.atTime(6, 0).atZone(offset)));

        ComputationException e = assertThrows(ComputationException.class, () -> adapter.sunriseSunset(DATE, LOCATION));
        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
    }

    @Test
    void testSunriseSunset_WrongDayIsUnavailable() throws Exception {
        ZoneOffset offset = LOCATION.getZoneOffset();
        LocalDate farAway = DATE.plusDays(3);
        when(provider.sunriseSunset(any(LocalDate.class), anyDouble(), anyDouble(), any(ZoneOffset.class)))
                .thenReturn(new SunriseSunset(farAway.atTime(6, 0).atZone(offset), farAway.atTime(18, 0).atZone(offset)));

        ComputationException e = assertThrows(ComputationException.class, () -> adapter.sunriseSunset(DATE, LOCATION));
        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
    }

    @Test
    void testSunriseSunset_ReturnedAtLocationOffset() throws Exception {
        when(provider.sunriseSunset(any(LocalDate.class), anyDouble(), anyDouble(), any(ZoneOffset.class)))
                .thenReturn(new SunriseSunset(
                        DATE.atTime(9, 50).atZone(ZoneOffset.UTC),
                        DATE.atTime(23, 59).atZone(ZoneOffset.UTC)));

        SunriseSunset result = adapter.sunriseSunset(DATE, LOCATION);

        assertEquals(ZoneOffset.ofHours(-5), result.getSunrise().getOffset());
        assertEquals(4, result.getSunrise().getHour());
        assertEquals(50, result.getSunrise().getMinute());
    }
}
