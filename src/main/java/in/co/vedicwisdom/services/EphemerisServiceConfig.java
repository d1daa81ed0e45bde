package in.co.vedicwisdom.services;

/**
 * Constants for ephemeris provider selection and the Free Astrology API.
 */
public class EphemerisServiceConfig {

    // Provider options (config.json "ephemeris.provider")
    public static final String BUILT_IN_PROVIDER = "BUILT_IN";
    public static final String FREE_ASTROLOGY_API_PROVIDER = "FREE_ASTROLOGY_API";

    // Free Astrology API
    public static final String FREE_ASTROLOGY_API_BASE_URL = "https://json.freeastrologyapi.com";
    public static final String FREE_ASTROLOGY_API_PLANETS_URL = FREE_ASTROLOGY_API_BASE_URL + "/planets";
    public static final String OBSERVATION_POINT = "topocentric";
    public static final String AYANAMSHA = "lahiri";

    // Secrets
    public static final String ASTROLOGY_API_KEY_SECRET = "ASTROLOGY_API_KEY";
    public static final String SECRETS_PATH_ENV = "VEDIC_SECRETS_PATH";
    public static final String DEFAULT_SECRETS_FILE = "secrets.json";

    // Timeout settings
    public static final int HTTP_TIMEOUT_SECONDS = 10;

    public static boolean isFreeAstrologyApiProvider(String provider) {
        return FREE_ASTROLOGY_API_PROVIDER.equalsIgnoreCase(provider);
    }

    public static boolean isBuiltInProvider(String provider) {
        return provider == null || provider.isBlank() || BUILT_IN_PROVIDER.equalsIgnoreCase(provider);
    }
}
