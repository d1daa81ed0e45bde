package in.co.vedicwisdom.services;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.co.vedicwisdom.pojos.AppConfig;
import in.co.vedicwisdom.pojos.GeoLocation;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;

/**
 * Reads config.json and turns its settings into runtime objects. The file comes from
 * {@value #CONFIG_PATH_ENV} when set, else from the classpath.
 */
public final class ConfigLoader {

    public static final String CONFIG_PATH_ENV = "VEDIC_CONFIG_PATH";
    public static final String CONFIG_RESOURCE = "/config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigLoader() {
    }

    public static AppConfig load() {
        String path = System.getenv(CONFIG_PATH_ENV);
        if (path != null && !path.isBlank()) {
            return loadFile(new File(path));
        }
        return loadResource(CONFIG_RESOURCE);
    }

    public static AppConfig loadFile(File file) {
        try {
            AppConfig config = MAPPER.readValue(file, AppConfig.class);
            LoggingService.info("config_loaded", LoggingService.data("source", file.getPath()));
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read configuration from " + file.getPath(), e);
        }
    }

    public static AppConfig loadResource(String resource) {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Configuration resource not found: " + resource);
            }
            AppConfig config = MAPPER.readValue(in, AppConfig.class);
            LoggingService.info("config_loaded", LoggingService.data("source", "classpath:" + resource));
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read configuration resource " + resource, e);
        }
    }

    /**
     * Location with its UTC offset. A missing offset is looked up from the coordinates as of {@code onDate}.
     */
    public static GeoLocation resolveLocation(AppConfig.LocationSettings settings, LocalDate onDate) {
        if (settings == null || settings.getLatitude() == null || settings.getLongitude() == null) {
            throw new IllegalStateException("Location latitude and longitude must be configured");
        }
        double latitude = settings.getLatitude();
        double longitude = settings.getLongitude();
        double offset = settings.getUtcOffsetHours() != null
                ? settings.getUtcOffsetHours()
                : TimezoneUtils.getTimezoneOffset(latitude, longitude, onDate);
        try {
            return new GeoLocation(settings.getName(), latitude, longitude, offset);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid configured location: " + e.getMessage(), e);
        }
    }

    public static EphemerisProvider buildProvider(AppConfig.EphemerisSettings settings) {
        String provider = settings == null ? EphemerisServiceConfig.BUILT_IN_PROVIDER : settings.getProvider();
        if (EphemerisServiceConfig.isFreeAstrologyApiProvider(provider)) {
            LoggingService.info("ephemeris_provider_selected",
                    LoggingService.data("provider", EphemerisServiceConfig.FREE_ASTROLOGY_API_PROVIDER));
            return new FreeAstrologyApiEphemerisProvider();
        }
        if (provider == null || EphemerisServiceConfig.isBuiltInProvider(provider)) {
            AnalyticEphemerisProvider builtIn = new AnalyticEphemerisProvider(
                    AnalyticEphemerisProvider.Ayanamsha.fromString(settings == null ? null : settings.getAyanamsha()));
            LoggingService.info("ephemeris_provider_selected", builtIn.describe());
            return builtIn;
        }
        throw new IllegalStateException("Unknown ephemeris provider: " + provider);
    }

    public static VerseScorer buildScorer(AppConfig.CorpusSettings settings) {
        try {
            return VerseScorer.forBackend(settings == null ? null : settings.getMatchingBackend());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    public static CorpusStore loadCorpus(AppConfig.CorpusSettings settings) {
        AppConfig.CorpusSettings corpus = settings == null ? new AppConfig.CorpusSettings() : settings;
        return CorpusStore.load(corpus.getSource(), corpus.getDefaultVerseId());
    }
}
