package in.co.vedicwisdom.services;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;

/**
 * Free Astrology API key lookup. The {@value EphemerisServiceConfig#ASTROLOGY_API_KEY_SECRET} environment
 * variable wins; otherwise the key is read from the secrets file named by
 * {@value EphemerisServiceConfig#SECRETS_PATH_ENV}, or {@value EphemerisServiceConfig#DEFAULT_SECRETS_FILE}
 * in the working directory. Resolved once per container.
 */
class SecretsProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SecretsProvider() {}

    /**
     * Empty when no key is configured; the provider fails on first use rather than at startup, so a
     * built-in deployment never needs one.
     */
    static String astrologyApiKey() {
        return ApiKeyHolder.API_KEY;
    }

    static String resolveApiKey(String environmentValue, File secretsFile) {
        if (environmentValue != null && !environmentValue.isBlank()) {
            LoggingService.info("astrology_api_key_resolved", LoggingService.data("source", "environment"));
            return environmentValue.trim();
        }
        String key = readApiKey(secretsFile);
        LoggingService.info("astrology_api_key_resolved", LoggingService.data(
                "source", secretsFile.getPath(), "present", !key.isEmpty()));
        return key;
    }

    /**
     * Key from a secrets file; other entries are ignored. A missing file means no key, an unreadable one is
     * a configuration error.
     */
    static String readApiKey(File secretsFile) {
        if (!secretsFile.isFile()) {
            return "";
        }
        try {
            Secrets secrets = MAPPER.readValue(secretsFile, Secrets.class);
            return secrets.astrologyApiKey == null ? "" : secrets.astrologyApiKey.trim();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read secrets from " + secretsFile.getPath(), e);
        }
    }

    private static File secretsFile() {
        String path = System.getenv(EphemerisServiceConfig.SECRETS_PATH_ENV);
        return new File(path == null || path.isBlank() ? EphemerisServiceConfig.DEFAULT_SECRETS_FILE : path);
    }

    private static final class ApiKeyHolder {
        static final String API_KEY = resolveApiKey(
                System.getenv(EphemerisServiceConfig.ASTROLOGY_API_KEY_SECRET), secretsFile());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Secrets {
        @JsonProperty(EphemerisServiceConfig.ASTROLOGY_API_KEY_SECRET)
        String astrologyApiKey;
    }
}
