package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.AppConfig;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.JanamPatri;
import in.co.vedicwisdom.pojos.JanamPatriOverride;
import in.co.vedicwisdom.pojos.JanamPatriReport;
import in.co.vedicwisdom.pojos.RecommendationResult;
import in.co.vedicwisdom.pojos.VerseRecord;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Birth chart plus verse and lifestyle recommendations for the configured profile.
 */
public class JanamPatriReportService {

    public static final int VERSES_PER_REPORT = 5;
    static final String DEFAULT_BIRTH_DATE = "1990-01-01";
    static final String DEFAULT_BIRTH_TIME = "10:30";
    static final String DEFAULT_BIRTH_PLACE_NAME = "Birth place";

    private final JanamPatriCalculator calculator;
    private final VerseRecommender recommender;
    private final LifestyleAdvisor lifestyleAdvisor;
    private final RecommendationSink sink;

    public JanamPatriReportService(JanamPatriCalculator calculator, VerseRecommender recommender,
                                   LifestyleAdvisor lifestyleAdvisor, RecommendationSink sink) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.recommender = Objects.requireNonNull(recommender, "recommender");
        this.lifestyleAdvisor = Objects.requireNonNull(lifestyleAdvisor, "lifestyleAdvisor");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Empty when the profile is absent or disabled. {@code defaultPlace} is used when the profile has no
     * birth place coordinates. Either way the UTC offset, when not configured, is the one in force on the
     * birth date.
     */
    public Optional<JanamPatriReport> buildReport(AppConfig.JanamPatriProfile profile,
                                                  AppConfig.LocationSettings defaultPlace,
                                                  List<VerseRecord> corpus) throws ComputationException {
        if (profile == null || !profile.isEnabled()) {
            LoggingService.info("janam_patri_disabled");
            return Optional.empty();
        }
        long start = LoggingService.logOperationStart("janam_patri_report", LoggingService.data());
        try {
            JanamPatriReport report = build(profile, defaultPlace, corpus);
            sink.emit(DigestJson.janamPatriRecord(report, recommender.getScorer().name()));
            LoggingService.logOperationEnd("janam_patri_report", start, LoggingService.data(
                    "nakshatra", CalendarNames.nakshatraName(report.getChart().getNakshatra()),
                    "verseCount", report.getVerses().size()));
            return Optional.of(report);
        } catch (ComputationException | RuntimeException e) {
            LoggingService.logOperationFailed("janam_patri_report", start, e);
            throw e;
        }
    }

    private JanamPatriReport build(AppConfig.JanamPatriProfile profile, AppConfig.LocationSettings defaultPlace,
                                   List<VerseRecord> corpus) throws ComputationException {
        LocalDate birthDate = parseDate(valueOr(profile.getBirthDate(), DEFAULT_BIRTH_DATE));
        LocalTime birthTime = parseTime(valueOr(profile.getBirthTime(), DEFAULT_BIRTH_TIME));
        AppConfig.LocationSettings placeSettings =
                profile.getBirthPlace() == null || profile.getBirthPlace().getLatitude() == null
                        ? Objects.requireNonNull(defaultPlace, "defaultPlace")
                        : profile.getBirthPlace();
        GeoLocation place = ConfigLoader.resolveLocation(placeSettings, birthDate);
        ZonedDateTime birthMoment = ZonedDateTime.of(birthDate, birthTime, place.getZoneOffset());

        int nakshatraOverride = configuredIndex(profile.getJanmaNakshatra(), CalendarNames.nakshatraIndex(profile.getJanmaNakshatra()), "nakshatra");
        int rashiOverride = configuredIndex(profile.getRashi(), CalendarNames.rashiIndex(profile.getRashi()), "rashi");

        JanamPatri chart;
        if (nakshatraOverride > 0 && rashiOverride > 0) {
            chart = calculator.compute(birthMoment, place, new JanamPatriOverride(nakshatraOverride, rashiOverride));
        } else {
            JanamPatri computed = calculator.compute(birthMoment, place);
            // A single configured name replaces only its own field
            chart = new JanamPatri(birthMoment, place,
                    nakshatraOverride > 0 ? nakshatraOverride : computed.getNakshatra(),
                    rashiOverride > 0 ? rashiOverride : computed.getRashi(),
                    false);
        }

        String nakshatraName = CalendarNames.nakshatraName(chart.getNakshatra());
        String theme = CalendarNames.nakshatraTheme(nakshatraName);
        List<RecommendationResult> verses = recommender.recommend(corpus, Set.of(theme), VERSES_PER_REPORT);
        String placeName = place.getName() != null ? place.getName() : DEFAULT_BIRTH_PLACE_NAME;
        return new JanamPatriReport(chart, placeName, theme, verses,
                lifestyleAdvisor.nakshatraRecommendations(nakshatraName));
    }

    private static int configuredIndex(String name, int index, String field) {
        if (name == null || name.isBlank()) {
            return -1;
        }
        if (index < 1) {
            throw new IllegalStateException("Unknown " + field + " in janam patri profile: " + name);
        }
        return index;
    }

    private static String valueOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static LocalDate parseDate(String value) throws ComputationException {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ComputationException(ErrorCode.INVALID_DATE, "Invalid birth date: " + value, e);
        }
    }

    private static LocalTime parseTime(String value) throws ComputationException {
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new ComputationException(ErrorCode.INVALID_DATE, "Invalid birth time: " + value, e);
        }
    }
}
