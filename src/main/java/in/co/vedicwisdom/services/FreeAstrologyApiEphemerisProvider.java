package in.co.vedicwisdom.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.SunriseSunset;
import in.co.vedicwisdom.pojos.ThirdPartyAstrologyRequest;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads sidereal (Lahiri) Sun and Moon longitudes from the Free Astrology API planets endpoint.
 * The API has no sunrise endpoint, so sunrise/sunset come from the analytic solar routine.
 */
public class FreeAstrologyApiEphemerisProvider implements EphemerisProvider {

    private final HttpClient httpClient;
    private final Gson gson;
    private final String apiKey;
    private final String planetsUrl;
    private final AnalyticEphemerisProvider solarProvider;

    public FreeAstrologyApiEphemerisProvider() {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(EphemerisServiceConfig.HTTP_TIMEOUT_SECONDS))
                        .build(),
                SecretsProvider.astrologyApiKey(),
                EphemerisServiceConfig.FREE_ASTROLOGY_API_PLANETS_URL);
    }

    public FreeAstrologyApiEphemerisProvider(HttpClient httpClient, String apiKey, String planetsUrl) {
        this.httpClient = httpClient;
        this.gson = new GsonBuilder().create();
        this.apiKey = apiKey;
        this.planetsUrl = planetsUrl;
        this.solarProvider = new AnalyticEphemerisProvider(AnalyticEphemerisProvider.Ayanamsha.LAHIRI);
    }

    @Override
    public CelestialPosition reading(Instant instant, double latitude, double longitude)
            throws IOException, InterruptedException {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalStateException("Free Astrology API key is not configured; set "
                    + EphemerisServiceConfig.ASTROLOGY_API_KEY_SECRET + " in the environment or the secrets file");
        }

        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        Map<String, String> settings = new HashMap<>();
        settings.put("observation_point", EphemerisServiceConfig.OBSERVATION_POINT);
        settings.put("ayanamsha", EphemerisServiceConfig.AYANAMSHA);
        ThirdPartyAstrologyRequest payload = new ThirdPartyAstrologyRequest(
                utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth(),
                utc.getHour(), utc.getMinute(), utc.getSecond(),
                latitude, longitude, 0.0, settings);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(planetsUrl))
                .timeout(Duration.ofSeconds(EphemerisServiceConfig.HTTP_TIMEOUT_SECONDS))
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(gson.toJson(payload)))
                .build();

        HttpResponse<String> httpResponse = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (httpResponse.statusCode() < 200 || httpResponse.statusCode() >= 300) {
            throw new IOException("Free Astrology API request failed with status code: " + httpResponse.statusCode());
        }
        double[] sunMoon = parseSunAndMoon(httpResponse.body());
        double t = AnalyticEphemerisProvider.julianCenturies(AnalyticEphemerisProvider.julianDay(instant));
        return new CelestialPosition(instant, sunMoon[0], sunMoon[1], AnalyticEphemerisProvider.meanObliquity(t));
    }

    @Override
    public SunriseSunset sunriseSunset(LocalDate date, double latitude, double longitude, ZoneOffset offset)
            throws ComputationException {
        return solarProvider.sunriseSunset(date, latitude, longitude, offset);
    }

    /**
     * Picks the Sun and Moon {@code fullDegree} values out of a planets response. The {@code output} array
     * holds either index-keyed objects with a {@code name} field or objects keyed by planet name; both
     * shapes are accepted.
     */
    static double[] parseSunAndMoon(String responseBody) {
        JsonObject root = JsonParser.parseString(responseBody).getAsJsonObject();
        JsonElement output = root.get("output");
        if (output == null || !output.isJsonArray()) {
            throw new IllegalArgumentException("Invalid response format: output is not an array");
        }

        Double sun = null;
        Double moon = null;
        for (JsonElement element : output.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                continue;
            }
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                if (!entry.getValue().isJsonObject()) {
                    continue;
                }
                JsonObject planet = entry.getValue().getAsJsonObject();
                String name = planet.has("name") ? planet.get("name").getAsString() : entry.getKey();
                if (!planet.has("fullDegree")) {
                    continue;
                }
                if ("Sun".equals(name) && sun == null) {
                    sun = planet.get("fullDegree").getAsDouble();
                } else if ("Moon".equals(name) && moon == null) {
                    moon = planet.get("fullDegree").getAsDouble();
                }
            }
        }
        if (sun == null || moon == null) {
            throw new IllegalArgumentException("Invalid response format: Sun or Moon missing from output");
        }
        return new double[]{sun, moon};
    }
}
