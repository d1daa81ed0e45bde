package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.DigestDay;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.ObservanceSet;
import in.co.vedicwisdom.pojos.PanchangDay;
import in.co.vedicwisdom.pojos.RecommendationResult;
import in.co.vedicwisdom.pojos.VerseRecord;
import in.co.vedicwisdom.pojos.WeeklyDigest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds the seven-day digest: panchang, observances and one verse per day, plus the verse of the week.
 * Any failing day fails the whole digest; a partial week is never returned.
 */
public class WeeklyDigestAssembler {

    public static final int DAYS_IN_WEEK = 7;

    private final PanchangCalculator panchangCalculator;
    private final ObservanceClassifier observanceClassifier;
    private final VerseRecommender recommender;
    private final LifestyleAdvisor lifestyleAdvisor;
    private final RecommendationSink sink;
    private final boolean parallel;

    public WeeklyDigestAssembler(PanchangCalculator panchangCalculator, ObservanceClassifier observanceClassifier,
                                 VerseRecommender recommender, LifestyleAdvisor lifestyleAdvisor,
                                 RecommendationSink sink, boolean parallel) {
        this.panchangCalculator = Objects.requireNonNull(panchangCalculator, "panchangCalculator");
        this.observanceClassifier = Objects.requireNonNull(observanceClassifier, "observanceClassifier");
        this.recommender = Objects.requireNonNull(recommender, "recommender");
        this.lifestyleAdvisor = Objects.requireNonNull(lifestyleAdvisor, "lifestyleAdvisor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.parallel = parallel;
    }

    public WeeklyDigest assemble(LocalDate weekStart, GeoLocation location, List<VerseRecord> corpus)
            throws ComputationException {
        Objects.requireNonNull(weekStart, "weekStart");
        Objects.requireNonNull(location, "location");
        long start = LoggingService.logOperationStart("weekly_digest_assembly", LoggingService.data(
                "weekStart", weekStart.toString(), "parallel", parallel));
        try {
            WeeklyDigest digest = build(weekStart, location, corpus);
            sink.emit(DigestJson.weeklyRecord(digest, recommender.getScorer().name()));
            LoggingService.logOperationEnd("weekly_digest_assembly", start, LoggingService.data(
                    "verseOfWeekId", digest.getVerseOfWeek().getVerse().getId(),
                    "observanceDays", countObservanceDays(digest)));
            return digest;
        } catch (ComputationException | RuntimeException e) {
            LoggingService.logOperationFailed("weekly_digest_assembly", start, e);
            throw e;
        }
    }

    private WeeklyDigest build(LocalDate weekStart, GeoLocation location, List<VerseRecord> corpus)
            throws ComputationException {
        List<PanchangDay> week = parallel
                ? computeParallel(weekStart, location, DAYS_IN_WEEK)
                : computeSequential(weekStart, location, DAYS_IN_WEEK);
        PanchangDay following = followingDay(weekStart.plusDays(DAYS_IN_WEEK), location);
        List<ObservanceSet> observances = observanceClassifier.classify(week);

        List<DigestDay> days = new ArrayList<>(DAYS_IN_WEEK);
        Set<String> weekTags = new LinkedHashSet<>();
        for (int i = 0; i < DAYS_IN_WEEK; i++) {
            PanchangDay day = week.get(i);
            ObservanceSet set = observances.get(i);
            weekTags.addAll(set.queryTags());
            RecommendationResult verse = recommender.recommendOne(corpus, dayQueryTags(day, set));
            PanchangDay next = i + 1 < DAYS_IN_WEEK ? week.get(i + 1) : following;
            OptionalInt skipped = next == null ? OptionalInt.empty() : PanchangCalculator.skippedTithi(day, next);
            days.add(new DigestDay(day, set, verse, skipped.isPresent() ? skipped.getAsInt() : null));
        }

        RecommendationResult verseOfWeek = recommender.recommendOne(corpus, weekTags);
        List<String> lifestyle = lifestyleAdvisor.weeklyRecommendations(week, observances);
        return new WeeklyDigest(weekStart, weekStart.plusDays(DAYS_IN_WEEK - 1L), location, days, verseOfWeek,
                lifestyle);
    }

    /**
     * Observance tags when the day has any; otherwise the tithi's theme, or its tithi and nakshatra names.
     */
    static Set<String> dayQueryTags(PanchangDay day, ObservanceSet observances) {
        if (!observances.isEmpty()) {
            return observances.queryTags();
        }
        Set<String> tags = new LinkedHashSet<>();
        String tithiName = CalendarNames.tithiName(day.getTithi());
        String theme = CalendarNames.TITHI_THEMES.get(tithiName);
        if (theme != null) {
            tags.add(theme);
        } else {
            tags.add(tithiName);
            tags.add(CalendarNames.nakshatraName(day.getNakshatra()));
            tags.add("dharma");
        }
        return tags;
    }

    /**
     * Panchang of the day after the week, used only to spot a tithi skipped on the last day. Null when it
     * cannot be computed; the week itself is still complete.
     */
    private PanchangDay followingDay(LocalDate date, GeoLocation location) {
        try {
            return panchangCalculator.compute(date, location);
        } catch (ComputationException e) {
            LoggingService.warn("following_day_unavailable", LoggingService.data(
                    "date", date.toString(), "errorCode", e.getErrorCode().name(), "error", e.getMessage()));
            return null;
        }
    }

    private List<PanchangDay> computeSequential(LocalDate weekStart, GeoLocation location, int count)
            throws ComputationException {
        List<PanchangDay> days = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            days.add(panchangCalculator.compute(weekStart.plusDays(i), location));
        }
        return days;
    }

    private List<PanchangDay> computeParallel(LocalDate weekStart, GeoLocation location, int count)
            throws ComputationException {
        ExecutorService executor = Executors.newFixedThreadPool(count);
        try {
            List<Future<PanchangDay>> futures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                LocalDate date = weekStart.plusDays(i);
                futures.add(executor.submit(() -> panchangCalculator.compute(date, location)));
            }
            // Futures are in date order, so the first failure reported is the earliest failing day
            List<PanchangDay> days = new ArrayList<>(count);
            for (Future<PanchangDay> future : futures) {
                days.add(await(future));
            }
            return days;
        } finally {
            executor.shutdownNow();
        }
    }

    private static PanchangDay await(Future<PanchangDay> future) throws ComputationException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE, "Interrupted while computing panchang", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ComputationException) {
                throw (ComputationException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Panchang computation failed", cause);
        }
    }

    private static int countObservanceDays(WeeklyDigest digest) {
        int count = 0;
        for (DigestDay day : digest.getDays()) {
            if (!day.getObservances().isEmpty()) {
                count++;
            }
        }
        return count;
    }
}
