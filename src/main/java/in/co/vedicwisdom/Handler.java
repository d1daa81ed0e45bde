package in.co.vedicwisdom;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import in.co.vedicwisdom.handlers.CalendarHandler;
import in.co.vedicwisdom.pojos.AppConfig;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.RequestBody;
import in.co.vedicwisdom.pojos.RequestEvent;
import in.co.vedicwisdom.services.ComputationException;
import in.co.vedicwisdom.services.ConfigLoader;
import in.co.vedicwisdom.services.CorpusStore;
import in.co.vedicwisdom.services.EphemerisAdapter;
import in.co.vedicwisdom.services.JanamPatriCalculator;
import in.co.vedicwisdom.services.JanamPatriReportService;
import in.co.vedicwisdom.services.LifestyleAdvisor;
import in.co.vedicwisdom.services.LoggingRecommendationSink;
import in.co.vedicwisdom.services.LoggingService;
import in.co.vedicwisdom.services.ObservanceClassifier;
import in.co.vedicwisdom.services.PanchangCalculator;
import in.co.vedicwisdom.services.RecommendationSink;
import in.co.vedicwisdom.services.VerseRecommender;
import in.co.vedicwisdom.services.WeeklyDigestAssembler;

import java.time.LocalDate;
import java.util.Map;

public class Handler implements RequestHandler<RequestEvent, Object> {

    static final String SCHEDULED_SOURCE = "aws.events";
    static final String WEEKLY_NOTIFICATION_DETAIL = "weekly_notification";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final CalendarHandler calendarHandler;

    public Handler() {
        this(createCalendarHandler(ConfigLoader.load()));
    }

    public Handler(CalendarHandler calendarHandler) {
        this.calendarHandler = calendarHandler;
    }

    static CalendarHandler createCalendarHandler(AppConfig config) {
        long start = LoggingService.logOperationStart("handler_init", LoggingService.data());
        // Fails fast on a bad location; each request resolves the offset for its own date
        GeoLocation location = ConfigLoader.resolveLocation(config.getLocation(), LocalDate.now());
        CorpusStore corpus = ConfigLoader.loadCorpus(config.getCorpus());
        EphemerisAdapter ephemeris = new EphemerisAdapter(ConfigLoader.buildProvider(config.getEphemeris()));
        VerseRecommender recommender;
        try {
            recommender = new VerseRecommender(ConfigLoader.buildScorer(config.getCorpus()), corpus.getDefaultVerse());
        } catch (ComputationException e) {
            LoggingService.logOperationFailed("handler_init", start, e);
            throw new IllegalStateException("Verse corpus is empty", e);
        }
        PanchangCalculator panchangCalculator = new PanchangCalculator(ephemeris);
        ObservanceClassifier classifier = new ObservanceClassifier();
        LifestyleAdvisor advisor = new LifestyleAdvisor();
        RecommendationSink sink = new LoggingRecommendationSink();
        boolean parallel = config.getDigest() != null && config.getDigest().isParallel();

        CalendarHandler handler = new CalendarHandler(config, corpus, panchangCalculator, classifier,
                new WeeklyDigestAssembler(panchangCalculator, classifier, recommender, advisor, sink, parallel),
                new JanamPatriReportService(new JanamPatriCalculator(ephemeris), recommender, advisor, sink));
        LoggingService.logOperationEnd("handler_init", start, LoggingService.data(
                "location", location.toString(), "verseCount", corpus.size()));
        return handler;
    }

    @Override
    public String handleRequest(RequestEvent event, Context context) {
        LoggingService.initRequest(context);
        String function = null;
        try {
            if (SCHEDULED_SOURCE.equals(event.getSource())) {
                if (WEEKLY_NOTIFICATION_DETAIL.equals(event.getDetailType())) {
                    LoggingService.setFunction(CalendarHandler.WEEKLY_DIGEST);
                    RequestBody scheduled = new RequestBody();
                    scheduled.setFunction(CalendarHandler.WEEKLY_DIGEST);
                    scheduled.setFormat(CalendarHandler.FORMAT_TEXT);
                    String response = calendarHandler.handleRequest(CalendarHandler.WEEKLY_DIGEST, scheduled);
                    LoggingService.info("weekly_notification_generated");
                    return response;
                }
                LoggingService.info("warmed_up");
                return "Warmed up!";
            }

            RequestBody requestBody = event.getBody() == null ? null : gson.fromJson(event.getBody(), RequestBody.class);
            if (requestBody == null || requestBody.getFunction() == null) {
                return errorResponse("INVALID_REQUEST", "Request body with a function is required");
            }
            function = requestBody.getFunction();
            LoggingService.setFunction(function);
            LoggingService.info("request_received", LoggingService.data("function", function));
            return calendarHandler.handleRequest(function, requestBody);
        } catch (ComputationException e) {
            LoggingService.error("request_failed", e, LoggingService.data(
                    "function", String.valueOf(function), "errorCode", e.getErrorCode().name()));
            return errorResponse(e.getErrorCode().name(), e.getMessage());
        } catch (JsonParseException e) {
            LoggingService.warn("request_body_unparseable", LoggingService.data("error", String.valueOf(e.getMessage())));
            return errorResponse("INVALID_REQUEST", "Request body is not valid JSON");
        } catch (Exception e) {
            LoggingService.error("request_failed", e, LoggingService.data(
                    "function", String.valueOf(function), "errorCode", "INTERNAL_ERROR"));
            return errorResponse("INTERNAL_ERROR", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            LoggingService.clearContext();
        }
    }

    private String errorResponse(String errorCode, String errorMessage) {
        return gson.toJson(Map.of("success", false, "errorCode", errorCode, "errorMessage", errorMessage));
    }
}
