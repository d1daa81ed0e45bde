package in.co.vedicwisdom.pojos;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Configuration snapshot read from config.json. Read once per invocation and never re-read mid-computation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private LocationSettings location = new LocationSettings();
    private EphemerisSettings ephemeris = new EphemerisSettings();
    private CorpusSettings corpus = new CorpusSettings();
    private DigestSettings digest = new DigestSettings();
    private JanamPatriProfile janamPatri;

    public LocationSettings getLocation() {
        return location;
    }

    public void setLocation(LocationSettings location) {
        this.location = location;
    }

    public EphemerisSettings getEphemeris() {
        return ephemeris;
    }

    public void setEphemeris(EphemerisSettings ephemeris) {
        this.ephemeris = ephemeris;
    }

    public CorpusSettings getCorpus() {
        return corpus;
    }

    public void setCorpus(CorpusSettings corpus) {
        this.corpus = corpus;
    }

    public DigestSettings getDigest() {
        return digest;
    }

    public void setDigest(DigestSettings digest) {
        this.digest = digest;
    }

    public JanamPatriProfile getJanamPatri() {
        return janamPatri;
    }

    public void setJanamPatri(JanamPatriProfile janamPatri) {
        this.janamPatri = janamPatri;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocationSettings {
        private String name;
        private Double latitude;
        private Double longitude;
        private Double utcOffsetHours; // resolved from coordinates when absent

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Double getLatitude() {
            return latitude;
        }

        public void setLatitude(Double latitude) {
            this.latitude = latitude;
        }

        public Double getLongitude() {
            return longitude;
        }

        public void setLongitude(Double longitude) {
            this.longitude = longitude;
        }

        public Double getUtcOffsetHours() {
            return utcOffsetHours;
        }

        public void setUtcOffsetHours(Double utcOffsetHours) {
            this.utcOffsetHours = utcOffsetHours;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EphemerisSettings {
        private String provider = "BUILT_IN";
        private String ayanamsha = "LAHIRI";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getAyanamsha() {
            return ayanamsha;
        }

        public void setAyanamsha(String ayanamsha) {
            this.ayanamsha = ayanamsha;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CorpusSettings {
        private String source = "classpath:/verses.json";
        private String defaultVerseId;
        private String matchingBackend = "TOKEN_OVERLAP";

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getDefaultVerseId() {
            return defaultVerseId;
        }

        public void setDefaultVerseId(String defaultVerseId) {
            this.defaultVerseId = defaultVerseId;
        }

        public String getMatchingBackend() {
            return matchingBackend;
        }

        public void setMatchingBackend(String matchingBackend) {
            this.matchingBackend = matchingBackend;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DigestSettings {
        private boolean parallel;

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JanamPatriProfile {
        private boolean enabled;
        private String birthDate;
        private String birthTime;
        private LocationSettings birthPlace;
        private String janmaNakshatra;
        private String rashi;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBirthDate() {
            return birthDate;
        }

        public void setBirthDate(String birthDate) {
            this.birthDate = birthDate;
        }

        public String getBirthTime() {
            return birthTime;
        }

        public void setBirthTime(String birthTime) {
            this.birthTime = birthTime;
        }

        public LocationSettings getBirthPlace() {
            return birthPlace;
        }

        public void setBirthPlace(LocationSettings birthPlace) {
            this.birthPlace = birthPlace;
        }

        public String getJanmaNakshatra() {
            return janmaNakshatra;
        }

        public void setJanmaNakshatra(String janmaNakshatra) {
            this.janmaNakshatra = janmaNakshatra;
        }

        public String getRashi() {
            return rashi;
        }

        public void setRashi(String rashi) {
            this.rashi = rashi;
        }
    }
}
