package in.co.vedicwisdom.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import in.co.vedicwisdom.pojos.AppConfig;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.JanamPatriReport;
import in.co.vedicwisdom.pojos.ObservanceSet;
import in.co.vedicwisdom.pojos.PanchangDay;
import in.co.vedicwisdom.pojos.RequestBody;
import in.co.vedicwisdom.pojos.WeeklyDigest;
import in.co.vedicwisdom.services.ComputationException;
import in.co.vedicwisdom.services.ConfigLoader;
import in.co.vedicwisdom.services.CorpusStore;
import in.co.vedicwisdom.services.DigestFormatter;
import in.co.vedicwisdom.services.DigestJson;
import in.co.vedicwisdom.services.ErrorCode;
import in.co.vedicwisdom.services.JanamPatriReportService;
import in.co.vedicwisdom.services.LoggingService;
import in.co.vedicwisdom.services.ObservanceClassifier;
import in.co.vedicwisdom.services.PanchangCalculator;
import in.co.vedicwisdom.services.WeeklyDigestAssembler;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Calendar operations: weekly digest, single-day panchang and janam patri.
 */
public class CalendarHandler {

    public static final String WEEKLY_DIGEST = "weekly_digest";
    public static final String PANCHANG = "panchang";
    public static final String JANAM_PATRI = "janam_patri";
    public static final String FORMAT_TEXT = "text";

    private final AppConfig config;
    private final CorpusStore corpus;
    private final PanchangCalculator panchangCalculator;
    private final ObservanceClassifier observanceClassifier;
    private final WeeklyDigestAssembler digestAssembler;
    private final JanamPatriReportService janamPatriReportService;
    private final Gson gson;

    public CalendarHandler(AppConfig config, CorpusStore corpus,
                           PanchangCalculator panchangCalculator, ObservanceClassifier observanceClassifier,
                           WeeklyDigestAssembler digestAssembler, JanamPatriReportService janamPatriReportService) {
        this.config = config;
        this.corpus = corpus;
        this.panchangCalculator = panchangCalculator;
        this.observanceClassifier = observanceClassifier;
        this.digestAssembler = digestAssembler;
        this.janamPatriReportService = janamPatriReportService;
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    }

    public String handleRequest(String action, RequestBody requestBody) throws ComputationException {
        return switch (action) {
            case WEEKLY_DIGEST -> handleWeeklyDigest(requestBody);
            case PANCHANG -> handlePanchang(requestBody);
            case JANAM_PATRI -> handleJanamPatri(requestBody);
            default -> gson.toJson(Map.of("success", false, "errorCode", "UNKNOWN_FUNCTION",
                    "errorMessage", "Unknown function: " + action));
        };
    }

    private String handleWeeklyDigest(RequestBody requestBody) throws ComputationException {
        LocalDate weekStart = parseDate(requestBody.getWeekStart(), "weekStart");
        LoggingService.setWeekStart(weekStart.toString());
        GeoLocation location = locationOn(weekStart);
        WeeklyDigest digest = digestAssembler.assemble(weekStart, location, corpus.getVerses());

        JsonObject response = success();
        if (isText(requestBody)) {
            response.addProperty("text", DigestFormatter.format(digest));
        } else {
            response.add("digest", DigestJson.weeklyDigest(digest));
        }
        return gson.toJson(response);
    }

    private String handlePanchang(RequestBody requestBody) throws ComputationException {
        LocalDate date = parseDate(requestBody.getDate(), "date");
        PanchangDay day = panchangCalculator.compute(date, locationOn(date));
        ObservanceSet observances = observanceClassifier.classify(day);

        JsonObject response = success();
        response.add("panchang", DigestJson.panchangDay(day, observances));
        return gson.toJson(response);
    }

    private String handleJanamPatri(RequestBody requestBody) throws ComputationException {
        LoggingService.setProfile(config.getJanamPatri() == null ? null : config.getJanamPatri().getBirthDate());
        Optional<JanamPatriReport> report = janamPatriReportService.buildReport(
                config.getJanamPatri(), config.getLocation(), corpus.getVerses());
        if (report.isEmpty()) {
            return gson.toJson(Map.of("success", true, "enabled", false, "message",
                    "Janam patri is disabled or missing in config. Set janamPatri.enabled to true and add birth details."));
        }

        JsonObject response = success();
        response.addProperty("enabled", true);
        if (isText(requestBody)) {
            response.addProperty("text", DigestFormatter.format(report.get()));
        } else {
            response.add("report", DigestJson.janamPatriReport(report.get()));
        }
        return gson.toJson(response);
    }

    /**
     * Configured location with the UTC offset in force on {@code date}, so a week across a DST change
     * of season uses that season's offset.
     */
    private GeoLocation locationOn(LocalDate date) {
        return ConfigLoader.resolveLocation(config.getLocation(), date);
    }

    /**
     * A missing date means today at the configured location.
     */
    private LocalDate parseDate(String value, String field) throws ComputationException {
        if (value == null || value.isBlank()) {
            LocalDate utcToday = LocalDate.now(ZoneOffset.UTC);
            return LocalDate.now(locationOn(utcToday).getZoneOffset());
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ComputationException(ErrorCode.INVALID_DATE, "Invalid " + field + ": " + value, e);
        }
    }

    private static boolean isText(RequestBody requestBody) {
        return FORMAT_TEXT.equalsIgnoreCase(requestBody.getFormat());
    }

    private static JsonObject success() {
        JsonObject response = new JsonObject();
        response.addProperty("success", true);
        return response;
    }
}
