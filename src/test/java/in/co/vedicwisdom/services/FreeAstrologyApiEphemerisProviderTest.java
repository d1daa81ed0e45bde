package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.GeoLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class FreeAstrologyApiEphemerisProviderTest {

    private static final String URL = "https://json.freeastrologyapi.com/planets";
    private static final Instant MOMENT = Instant.parse("2024-05-07T09:50:00Z");

    private static final String INDEXED_RESPONSE = "{\"statusCode\":200,\"output\":[{"
            + "\"0\":{\"name\":\"Ascendant\",\"fullDegree\":12.5},"
            + "\"1\":{\"name\":\"Sun\",\"fullDegree\":23.25},"
            + "\"2\":{\"name\":\"Moon\",\"fullDegree\":13.75}}]}";

    private static final String NAMED_RESPONSE = "{\"output\":["
            + "{\"Sun\":{\"fullDegree\":100.0,\"isRetro\":\"false\"}},"
            + "{\"Moon\":{\"fullDegree\":250.5,\"isRetro\":\"false\"}}]}";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testParseSunAndMoon_IndexedShape() {
        double[] sunMoon = FreeAstrologyApiEphemerisProvider.parseSunAndMoon(INDEXED_RESPONSE);

        assertEquals(23.25, sunMoon[0], 1e-9);
        assertEquals(13.75, sunMoon[1], 1e-9);
    }

    @Test
    void testParseSunAndMoon_NamedShape() {
        double[] sunMoon = FreeAstrologyApiEphemerisProvider.parseSunAndMoon(NAMED_RESPONSE);

        assertEquals(100.0, sunMoon[0], 1e-9);
        assertEquals(250.5, sunMoon[1], 1e-9);
    }

    @Test
    void testParseSunAndMoon_MissingMoon() {
        String body = "{\"output\":[{\"1\":{\"name\":\"Sun\",\"fullDegree\":23.25}}]}";

        assertThrows(IllegalArgumentException.class, () -> FreeAstrologyApiEphemerisProvider.parseSunAndMoon(body));
    }

    @Test
    void testParseSunAndMoon_OutputNotArray() {
        assertThrows(IllegalArgumentException.class,
                () -> FreeAstrologyApiEphemerisProvider.parseSunAndMoon("{\"output\":{}}"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReading_SendsKeyAndParsesBody() throws Exception {
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(INDEXED_RESPONSE);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        FreeAstrologyApiEphemerisProvider provider = new FreeAstrologyApiEphemerisProvider(httpClient, "test-key", URL);

        CelestialPosition position = provider.reading(MOMENT, 40.0, -74.4);

        assertEquals(23.25, position.getSunLongitude(), 1e-9);
        assertEquals(13.75, position.getMoonLongitude(), 1e-9);
        assertEquals(MOMENT, position.getInstant());

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        HttpRequest request = captor.getValue();
        assertEquals(URL, request.uri().toString());
        assertEquals("POST", request.method());
        assertEquals("test-key", request.headers().firstValue("x-api-key").orElse(null));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReading_Non2xxIsIOException() throws Exception {
        when(httpResponse.statusCode()).thenReturn(429);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        FreeAstrologyApiEphemerisProvider provider = new FreeAstrologyApiEphemerisProvider(httpClient, "test-key", URL);

        IOException e = assertThrows(IOException.class, () -> provider.reading(MOMENT, 40.0, -74.4));
        assertTrue(e.getMessage().contains("429"));
    }

    @Test
    void testReading_MissingKey() throws Exception {
        FreeAstrologyApiEphemerisProvider provider = new FreeAstrologyApiEphemerisProvider(httpClient, "", URL);

        assertThrows(IllegalStateException.class, () -> provider.reading(MOMENT, 40.0, -74.4));
        verifyNoInteractions(httpClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReading_FailureThroughAdapterIsUnavailable() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("connection reset"));
        EphemerisAdapter adapter = new EphemerisAdapter(
                new FreeAstrologyApiEphemerisProvider(httpClient, "test-key", URL));
        GeoLocation location = new GeoLocation("New Jersey", 40.0, -74.4, -5.0);

        ComputationException e = assertThrows(ComputationException.class,
                () -> adapter.positions(ZonedDateTime.ofInstant(MOMENT, ZoneOffset.ofHours(-5)), location));
        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
    }
}
