package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.Observance;
import in.co.vedicwisdom.pojos.ObservanceSet;
import in.co.vedicwisdom.pojos.PanchangDay;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Short practical recommendations for a week and for a janma nakshatra.
 */
public class LifestyleAdvisor {

    static final int MAX_WEEKLY_RECOMMENDATIONS = 5;
    static final String DAILY_ANCHOR = "Daily anchor: avoid digital overload for one focused hour after sunrise.";

    private static final int CHATURTHI = 4;
    private static final int KRISHNA_CHATURTHI = 19;

    private static final Map<String, List<String>> NAKSHATRA_LIFESTYLE = Map.of(
            "Punarvasu", List.of(
                    "Keep mornings uncluttered; begin with a short prayer and fresh air.",
                    "Nurture home energy: one small act of care in your living space daily.",
                    "Prefer steady routines over sudden lifestyle swings this week."));

    private static final List<String> GENERAL_LIFESTYLE = List.of(
            "Maintain a steady wake-sleep cycle and keep one daily reflection practice.",
            "Choose sattvic food and avoid over-stimulation in late evenings.",
            "Do one intentional act of service each week.");

    public List<String> weeklyRecommendations(List<PanchangDay> days, List<ObservanceSet> observances) {
        boolean amavasya = false;
        boolean ekadashi = false;
        boolean chaturthi = false;
        for (ObservanceSet set : observances) {
            amavasya |= set.contains(Observance.AMAVASYA);
            ekadashi |= set.contains(Observance.EKADASHI);
            chaturthi |= set.contains(Observance.SANKASHTI_CHATURTHI);
        }
        boolean monday = false;
        boolean thursday = false;
        for (PanchangDay day : days) {
            chaturthi |= day.getTithi() == CHATURTHI || day.getTithi() == KRISHNA_CHATURTHI;
            monday |= day.getWeekday() == DayOfWeek.MONDAY;
            thursday |= day.getWeekday() == DayOfWeek.THURSDAY;
        }

        List<String> recommendations = new ArrayList<>();
        if (amavasya) {
            recommendations.add("Amavasya week: spend time in quiet reflection and gratitude for ancestors.");
        }
        if (ekadashi) {
            recommendations.add("Ekadashi: keep meals light and sattvic, with extra hydration and simple japa.");
        }
        if (chaturthi) {
            recommendations.add("Chaturthi energy: clear one pending task and remove one source of clutter.");
        }
        if (monday) {
            recommendations.add("Somavara: start the week with a short sankalpa and 10 minutes of silence.");
        }
        if (thursday) {
            recommendations.add("Guruvara: reserve time for study, guidance, or one act of teaching.");
        }
        recommendations.add(DAILY_ANCHOR);
        return List.copyOf(recommendations.subList(0, Math.min(MAX_WEEKLY_RECOMMENDATIONS, recommendations.size())));
    }

    public List<String> nakshatraRecommendations(String nakshatra) {
        return NAKSHATRA_LIFESTYLE.getOrDefault(nakshatra, GENERAL_LIFESTYLE);
    }
}
