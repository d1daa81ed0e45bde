package in.co.vedicwisdom.services;

import com.google.gson.JsonObject;
import in.co.vedicwisdom.pojos.DigestDay;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.Observance;
import in.co.vedicwisdom.pojos.ObservanceSet;
import in.co.vedicwisdom.pojos.WeeklyDigest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDate;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class WeeklyDigestAssemblerTest {

    private static final GeoLocation LOCATION = new GeoLocation("New Jersey", 40.0, -74.4, -5.0);
    private static final LocalDate WEEK_START = LocalDate.of(2024, 5, 5);

    @Mock
    private RecommendationSink sink;

    private ScriptedEphemerisProvider provider;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        // Ekadashi on day 2, Pradosham on day 4, Amavasya on day 6; one extra sunrise for day 7
        provider = new ScriptedEphemerisProvider(LOCATION.getZoneOffset())
                .withTithis(WEEK_START, 24, 25, 26, 27, 28, 29, 30, 1);
    }

    @Test
    void testAssemble_SevenDaysWithObservances() throws Exception {
        WeeklyDigest digest = assembler(false).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);

        assertEquals(WEEK_START, digest.getWeekStart());
        assertEquals(LocalDate.of(2024, 5, 11), digest.getWeekEnd());
        assertEquals(7, digest.getDays().size());
        for (int i = 0; i < 7; i++) {
            assertEquals(WEEK_START.plusDays(i), digest.getDays().get(i).getDate());
            assertNotNull(digest.getDays().get(i).getRecommendation());
        }
        assertTrue(digest.getDays().get(2).getObservances().contains(Observance.EKADASHI));
        assertTrue(digest.getDays().get(4).getObservances().contains(Observance.PRADOSHAM));
        assertTrue(digest.getDays().get(6).getObservances().contains(Observance.AMAVASYA));

        assertEquals("vishnu-1", digest.getDays().get(2).getRecommendation().getVerse().getId());
        assertEquals("shiva-1", digest.getDays().get(4).getRecommendation().getVerse().getId());
        assertEquals("pitru-1", digest.getDays().get(6).getRecommendation().getVerse().getId());
        assertFalse(digest.getVerseOfWeek().isFallback());
        assertFalse(digest.getLifestyleRecommendations().isEmpty());
    }

    @Test
    void testAssemble_VerseOfWeekUsesObservanceUnion() throws Exception {
        WeeklyDigest digest = assembler(false).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);

        Set<String> tags = digest.getVerseOfWeek().getQueryTags();
        assertTrue(tags.contains("ekadashi"));
        assertTrue(tags.contains("pradosham"));
        assertTrue(tags.contains("pitru"));
    }

    @Test
    void testAssemble_NoObservancesFallsBackForVerseOfWeek() throws Exception {
        provider.withTithis(WEEK_START, 2, 3, 4, 5, 6, 7, 8, 9);

        WeeklyDigest digest = assembler(false).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);

        assertTrue(digest.getVerseOfWeek().isFallback());
        assertSame(TestVerses.KARMA, digest.getVerseOfWeek().getVerse());
        // Shukla Chaturthi has a tithi theme even without an observance
        assertEquals("ganesha-1", digest.getDays().get(2).getRecommendation().getVerse().getId());
    }

    @Test
    void testAssemble_FailureOnOneDayFailsWeek() {
        provider.failingOn(WEEK_START.plusDays(3));

        ComputationException e = assertThrows(ComputationException.class,
                () -> assembler(false).assemble(WEEK_START, LOCATION, TestVerses.CORPUS));

        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
        verifyNoInteractions(sink);
    }

    @Test
    void testAssemble_ParallelFailureReportsEarliestDay() {
        provider.failingOn(WEEK_START.plusDays(5)).failingOn(WEEK_START.plusDays(2));

        ComputationException e = assertThrows(ComputationException.class,
                () -> assembler(true).assemble(WEEK_START, LOCATION, TestVerses.CORPUS));

        assertEquals(ErrorCode.EPHEMERIS_UNAVAILABLE, e.getErrorCode());
        assertTrue(e.getMessage().contains(WEEK_START.plusDays(2).toString()), e.getMessage());
        verifyNoInteractions(sink);
    }

    @Test
    void testAssemble_ParallelMatchesSequential() throws Exception {
        WeeklyDigest sequential = assembler(false).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);
        WeeklyDigest parallel = assembler(true).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);

        assertEquals(DigestJson.weeklyDigest(sequential), DigestJson.weeklyDigest(parallel));
    }

    @Test
    void testAssemble_EmitsRecordOnSuccess() throws Exception {
        assembler(false).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);

        ArgumentCaptor<JsonObject> captor = ArgumentCaptor.forClass(JsonObject.class);
        verify(sink, times(1)).emit(captor.capture());
        JsonObject record = captor.getValue();
        assertEquals(DigestJson.KIND_WEEKLY_DIGEST, record.get("kind").getAsString());
        assertEquals("2024-05-05", record.get("week_start").getAsString());
        assertEquals(7, record.getAsJsonArray("days").size());
        assertEquals("pitru-1", record.getAsJsonArray("days").get(6).getAsJsonObject()
                .getAsJsonObject("verse").get("verse_id").getAsString());
        assertEquals(VerseScorer.TOKEN_OVERLAP, record.get("matching_backend").getAsString());
    }

    @Test
    void testAssemble_ReportsSkippedTithi() throws Exception {
        provider.withTithis(WEEK_START, 5, 7, 8, 9, 10, 11, 12, 14);

        WeeklyDigest digest = assembler(false).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);

        DigestDay first = digest.getDays().get(0);
        assertEquals(Integer.valueOf(6), first.getSkippedTithi());
        assertNull(digest.getDays().get(1).getSkippedTithi());
        // the skipped tithi after the last day comes from the extra sunrise
        assertEquals(Integer.valueOf(13), digest.getDays().get(6).getSkippedTithi());
    }

    @Test
    void testAssemble_FollowingDayFailureKeepsWeek() throws Exception {
        provider.withTithis(WEEK_START, 5, 7, 8, 9, 10, 11, 12).failingOn(WEEK_START.plusDays(7));

        for (boolean parallel : new boolean[]{false, true}) {
            WeeklyDigest digest = assembler(parallel).assemble(WEEK_START, LOCATION, TestVerses.CORPUS);

            assertEquals(7, digest.getDays().size());
            assertEquals(Integer.valueOf(6), digest.getDays().get(0).getSkippedTithi());
            assertNull(digest.getDays().get(6).getSkippedTithi());
        }
        verify(sink, times(2)).emit(any(JsonObject.class));
    }

    @Test
    void testAssemble_PolarNightAfterWeekKeepsWeek() throws Exception {
        // Tromso: the sun still rises through 2024-11-26 and stays down from 2024-11-27
        GeoLocation tromso = new GeoLocation("Tromso", 69.65, 18.96, 1.0);
        LocalDate weekStart = LocalDate.of(2024, 11, 20);
        WeeklyDigestAssembler assembler = new WeeklyDigestAssembler(
                new PanchangCalculator(new EphemerisAdapter(
                        new AnalyticEphemerisProvider(AnalyticEphemerisProvider.Ayanamsha.LAHIRI))),
                new ObservanceClassifier(), new VerseRecommender(new TokenOverlapScorer(), TestVerses.KARMA),
                new LifestyleAdvisor(), sink, false);

        WeeklyDigest digest = assembler.assemble(weekStart, tromso, TestVerses.CORPUS);

        assertEquals(7, digest.getDays().size());
        assertEquals(LocalDate.of(2024, 11, 26), digest.getWeekEnd());
        assertNull(digest.getDays().get(6).getSkippedTithi());
    }

    @Test
    void testDayQueryTags_WithoutObservance() {
        ObservanceSet none = new ObservanceSet(WEEK_START, Set.of());

        Set<String> dwadashi = WeeklyDigestAssembler.dayQueryTags(ObservanceClassifierTest.day(WEEK_START, 27), none);
        Set<String> saptami = WeeklyDigestAssembler.dayQueryTags(ObservanceClassifierTest.day(WEEK_START, 7), none);

        assertEquals(Set.of("Vishnu devotion"), dwadashi);
        assertEquals(Set.of("Saptami", "Ashwini", "dharma"), saptami);
    }

    private WeeklyDigestAssembler assembler(boolean parallel) {
        PanchangCalculator calculator = new PanchangCalculator(new EphemerisAdapter(provider));
        return new WeeklyDigestAssembler(calculator, new ObservanceClassifier(),
                new VerseRecommender(new TokenOverlapScorer(), TestVerses.KARMA),
                new LifestyleAdvisor(), sink, parallel);
    }
}
