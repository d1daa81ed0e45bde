package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.DigestDay;
import in.co.vedicwisdom.pojos.JanamPatri;
import in.co.vedicwisdom.pojos.JanamPatriReport;
import in.co.vedicwisdom.pojos.Observance;
import in.co.vedicwisdom.pojos.PanchangDay;
import in.co.vedicwisdom.pojos.RecommendationResult;
import in.co.vedicwisdom.pojos.VerseRecord;
import in.co.vedicwisdom.pojos.WeeklyDigest;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text renderings for notifications.
 */
public final class DigestFormatter {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    private DigestFormatter() {
    }

    public static String format(WeeklyDigest digest) {
        List<String> lines = new ArrayList<>();
        lines.add("=== Vedic Wisdom Weekly ===");
        lines.add("Week: " + digest.getWeekStart() + " to " + digest.getWeekEnd());
        lines.add("");
        lines.add("Daily Panchangam:");
        for (DigestDay day : digest.getDays()) {
            PanchangDay p = day.getPanchang();
            lines.add("  " + p.getDate() + " (" + CalendarNames.vaaraName(p.getWeekday()) + ") | "
                    + p.getPaksha().getDisplayName() + " " + CalendarNames.tithiName(p.getTithi()) + " | "
                    + CalendarNames.nakshatraName(p.getNakshatra()) + " | Sunrise " + p.getSunrise().format(TIME));
        }

        lines.add("");
        lines.add("Observances:");
        boolean any = false;
        for (DigestDay day : digest.getDays()) {
            for (Observance o : day.getObservances().getObservances()) {
                lines.add("  * " + day.getDate() + " - " + o.getDisplayName() + " (" + o.getDeity() + "): "
                        + o.getDescription());
                any = true;
            }
        }
        if (!any) {
            lines.add("  (none this week)");
        }

        lines.add("");
        lines.add("Daily verses:");
        for (DigestDay day : digest.getDays()) {
            PanchangDay p = day.getPanchang();
            lines.add("  " + day.getDate() + " (" + p.getPaksha().getDisplayName() + " "
                    + CalendarNames.tithiName(p.getTithi()) + ")");
            appendVerse(lines, day.getRecommendation(), "    ");
        }

        lines.add("");
        lines.add("Verse of the week:");
        appendVerse(lines, digest.getVerseOfWeek(), "  ");

        if (!digest.getLifestyleRecommendations().isEmpty()) {
            lines.add("");
            lines.add("Lifestyle recommendations:");
            for (String recommendation : digest.getLifestyleRecommendations()) {
                lines.add("  * " + recommendation);
            }
        }
        return String.join("\n", lines);
    }

    public static String format(JanamPatriReport report) {
        JanamPatri chart = report.getChart();
        List<String> lines = new ArrayList<>();
        lines.add("Janam Patri");
        lines.add("Birth: " + chart.getBirthMoment().toLocalDate() + " " + chart.getBirthMoment().toLocalTime()
                + " (" + report.getBirthPlace() + ")");
        lines.add("Janma Nakshatra: " + CalendarNames.nakshatraName(chart.getNakshatra())
                + " | Rashi: " + CalendarNames.rashiName(chart.getRashi()));
        lines.add("Recommended verses:");
        int index = 1;
        for (RecommendationResult result : report.getVerses()) {
            VerseRecord verse = result.getVerse();
            lines.add(index++ + ". " + verse.getSource());
            lines.add("   Transliteration: " + TextNormalizer.normalize(verse.getTransliteration()));
            lines.add("   Meaning: " + verse.getMeaning());
            lines.add("");
        }
        lines.add("Lifestyle recommendations:");
        for (String recommendation : report.getLifestyleRecommendations()) {
            lines.add("  * " + recommendation);
        }
        return String.join("\n", lines);
    }

    private static void appendVerse(List<String> lines, RecommendationResult result, String indent) {
        VerseRecord verse = result.getVerse();
        if (!verse.getDevanagari().isEmpty()) {
            lines.add(indent + verse.getDevanagari());
        }
        if (!verse.getTransliteration().isEmpty()) {
            lines.add(indent + verse.getTransliteration());
        }
        lines.add(indent + verse.getMeaning() + " [" + verse.getSource() + "]");
    }
}
