package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.ObservanceSet;
import in.co.vedicwisdom.pojos.PanchangDay;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LifestyleAdvisorTest {

    private static final LocalDate SUNDAY = LocalDate.of(2024, 5, 5);

    private final LifestyleAdvisor advisor = new LifestyleAdvisor();
    private final ObservanceClassifier classifier = new ObservanceClassifier();

    @Test
    void testWeekly_AmavasyaWeek() {
        List<PanchangDay> week = week(24, 25, 27, 28, 29, 30, 1);

        List<String> recommendations = advisor.weeklyRecommendations(week, classifier.classify(week));

        assertTrue(recommendations.get(0).startsWith("Amavasya week"));
        assertTrue(recommendations.stream().anyMatch(r -> r.startsWith("Somavara")));
        assertTrue(recommendations.stream().anyMatch(r -> r.startsWith("Guruvara")));
        assertEquals(LifestyleAdvisor.DAILY_ANCHOR, recommendations.get(recommendations.size() - 1));
    }

    @Test
    void testWeekly_CappedAtFive() {
        // Ekadashi, Sankashti Chaturthi and Amavasya in one (synthetic) week plus Monday and Thursday
        List<PanchangDay> week = week(11, 19, 30, 2, 3, 4, 5);

        List<String> recommendations = advisor.weeklyRecommendations(week, classifier.classify(week));

        assertEquals(LifestyleAdvisor.MAX_WEEKLY_RECOMMENDATIONS, recommendations.size());
        assertFalse(recommendations.contains(LifestyleAdvisor.DAILY_ANCHOR));
    }

    @Test
    void testWeekly_EmptyObservancesStillAnchored() {
        List<PanchangDay> week = week(2, 3, 5, 6, 7, 8, 9);
        List<ObservanceSet> sets = classifier.classify(week);

        List<String> recommendations = advisor.weeklyRecommendations(week, sets);

        assertEquals(3, recommendations.size());
        assertEquals(LifestyleAdvisor.DAILY_ANCHOR, recommendations.get(2));
    }

    @Test
    void testNakshatra_KnownAndGeneral() {
        assertEquals(3, advisor.nakshatraRecommendations("Punarvasu").size());
        assertTrue(advisor.nakshatraRecommendations("Punarvasu").get(0).startsWith("Keep mornings uncluttered"));
        assertTrue(advisor.nakshatraRecommendations("Revati").get(0).startsWith("Maintain a steady wake-sleep cycle"));
    }

    private static List<PanchangDay> week(int... tithis) {
        List<PanchangDay> days = new ArrayList<>();
        for (int i = 0; i < tithis.length; i++) {
            days.add(ObservanceClassifierTest.day(SUNDAY.plusDays(i), tithis[i]));
        }
        return days;
    }
}
