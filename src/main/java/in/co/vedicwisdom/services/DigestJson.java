package in.co.vedicwisdom.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import in.co.vedicwisdom.pojos.DigestDay;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.JanamPatri;
import in.co.vedicwisdom.pojos.JanamPatriReport;
import in.co.vedicwisdom.pojos.Observance;
import in.co.vedicwisdom.pojos.ObservanceSet;
import in.co.vedicwisdom.pojos.PanchangDay;
import in.co.vedicwisdom.pojos.RecommendationResult;
import in.co.vedicwisdom.pojos.VerseRecord;
import in.co.vedicwisdom.pojos.WeeklyDigest;

import java.util.Collection;

/**
 * JSON views of digests and reports. Field names are snake_case and stable; downstream exports and
 * dashboards read them by name.
 */
public final class DigestJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static final String KIND_WEEKLY_DIGEST = "weekly_digest";
    public static final String KIND_JANAM_PATRI = "janam_patri";

    private DigestJson() {
    }

    public static String toJson(JsonObject object) {
        return GSON.toJson(object);
    }

    public static JsonObject weeklyDigest(WeeklyDigest digest) {
        JsonObject json = new JsonObject();
        json.addProperty("week_start", digest.getWeekStart().toString());
        json.addProperty("week_end", digest.getWeekEnd().toString());
        json.add("location", location(digest.getLocation()));
        JsonArray days = new JsonArray();
        for (DigestDay day : digest.getDays()) {
            days.add(digestDay(day));
        }
        json.add("days", days);
        json.add("verse_of_week", recommendation(digest.getVerseOfWeek()));
        json.add("lifestyle_recommendations", strings(digest.getLifestyleRecommendations()));
        return json;
    }

    public static JsonObject digestDay(DigestDay day) {
        JsonObject json = panchangDay(day.getPanchang(), day.getObservances());
        if (day.getSkippedTithi() != null) {
            json.add("skipped_tithi", indexed(day.getSkippedTithi(), CalendarNames.tithiName(day.getSkippedTithi())));
        }
        json.add("verse", recommendation(day.getRecommendation()));
        return json;
    }

    public static JsonObject panchangDay(PanchangDay day, ObservanceSet observances) {
        JsonObject json = new JsonObject();
        json.addProperty("date", day.getDate().toString());
        json.addProperty("weekday", day.getWeekday().toString());
        json.addProperty("vaara", CalendarNames.vaaraName(day.getWeekday()));
        json.addProperty("sunrise", day.getSunrise().toOffsetDateTime().toString());
        json.addProperty("sunset", day.getSunset().toOffsetDateTime().toString());
        json.add("tithi", indexed(day.getTithi(), CalendarNames.tithiName(day.getTithi())));
        json.addProperty("paksha", day.getPaksha().getDisplayName());
        json.add("nakshatra", indexed(day.getNakshatra(), CalendarNames.nakshatraName(day.getNakshatra())));
        json.add("yoga", indexed(day.getYoga(), CalendarNames.yogaName(day.getYoga())));
        json.add("karana", indexed(day.getKarana(), CalendarNames.karanaName(day.getKarana())));
        JsonArray list = new JsonArray();
        for (Observance observance : observances.getObservances()) {
            JsonObject o = new JsonObject();
            o.addProperty("name", observance.getDisplayName());
            o.addProperty("deity", observance.getDeity());
            o.addProperty("description", observance.getDescription());
            list.add(o);
        }
        json.add("observances", list);
        return json;
    }

    public static JsonObject janamPatriReport(JanamPatriReport report) {
        JanamPatri chart = report.getChart();
        JsonObject json = new JsonObject();
        json.addProperty("birth_date", chart.getBirthMoment().toLocalDate().toString());
        json.addProperty("birth_time", chart.getBirthMoment().toLocalTime().toString());
        json.addProperty("birth_moment", chart.getBirthMoment().toOffsetDateTime().toString());
        json.addProperty("birth_place", report.getBirthPlace());
        json.addProperty("janma_nakshatra", CalendarNames.nakshatraName(chart.getNakshatra()));
        json.addProperty("nakshatra_index", chart.getNakshatra());
        json.addProperty("rashi", CalendarNames.rashiName(chart.getRashi()));
        json.addProperty("rashi_index", chart.getRashi());
        json.addProperty("from_override", chart.isFromOverride());
        json.addProperty("theme", report.getTheme());
        JsonArray verses = new JsonArray();
        for (RecommendationResult result : report.getVerses()) {
            verses.add(recommendation(result));
        }
        json.add("verses", verses);
        json.add("lifestyle_recommendations", strings(report.getLifestyleRecommendations()));
        return json;
    }

    public static JsonObject recommendation(RecommendationResult result) {
        VerseRecord verse = result.getVerse();
        JsonObject json = new JsonObject();
        json.addProperty("verse_id", verse.getId());
        json.addProperty("source", verse.getSource());
        json.addProperty("deity", verse.getDeity());
        json.addProperty("devanagari", verse.getDevanagari());
        json.addProperty("transliteration", verse.getTransliteration());
        json.addProperty("meaning", verse.getMeaning());
        json.addProperty("score", result.getScore());
        json.add("query_tags", strings(result.getQueryTags()));
        json.addProperty("fallback", result.isFallback());
        return json;
    }

    /**
     * Compact replayable record of a digest run: what went in and which verses came out.
     */
    public static JsonObject weeklyRecord(WeeklyDigest digest, String matchingBackend) {
        JsonObject record = new JsonObject();
        record.addProperty("kind", KIND_WEEKLY_DIGEST);
        record.addProperty("record_id", KIND_WEEKLY_DIGEST + ":" + digest.getWeekStart() + ":"
                + digest.getLocation().getLatitude() + "," + digest.getLocation().getLongitude());
        record.addProperty("week_start", digest.getWeekStart().toString());
        record.addProperty("week_end", digest.getWeekEnd().toString());
        record.add("location", location(digest.getLocation()));
        record.addProperty("matching_backend", matchingBackend);
        JsonArray days = new JsonArray();
        for (DigestDay day : digest.getDays()) {
            JsonObject d = new JsonObject();
            d.addProperty("date", day.getDate().toString());
            d.addProperty("tithi", day.getPanchang().getTithi());
            d.addProperty("nakshatra", day.getPanchang().getNakshatra());
            JsonArray observances = new JsonArray();
            for (Observance observance : day.getObservances().getObservances()) {
                observances.add(observance.getDisplayName());
            }
            d.add("observances", observances);
            d.add("verse", compactRecommendation(day.getRecommendation()));
            days.add(d);
        }
        record.add("days", days);
        record.add("verse_of_week", compactRecommendation(digest.getVerseOfWeek()));
        return record;
    }

    public static JsonObject janamPatriRecord(JanamPatriReport report, String matchingBackend) {
        JanamPatri chart = report.getChart();
        JsonObject record = new JsonObject();
        record.addProperty("kind", KIND_JANAM_PATRI);
        record.addProperty("record_id", KIND_JANAM_PATRI + ":" + chart.getBirthMoment().toOffsetDateTime());
        record.addProperty("birth_moment", chart.getBirthMoment().toOffsetDateTime().toString());
        record.addProperty("birth_place", report.getBirthPlace());
        record.addProperty("nakshatra", chart.getNakshatra());
        record.addProperty("rashi", chart.getRashi());
        record.addProperty("from_override", chart.isFromOverride());
        record.addProperty("theme", report.getTheme());
        record.addProperty("matching_backend", matchingBackend);
        JsonArray verses = new JsonArray();
        for (RecommendationResult result : report.getVerses()) {
            verses.add(compactRecommendation(result));
        }
        record.add("verses", verses);
        return record;
    }

    private static JsonObject compactRecommendation(RecommendationResult result) {
        JsonObject json = new JsonObject();
        json.addProperty("verse_id", result.getVerse().getId());
        json.addProperty("score", result.getScore());
        json.add("query_tags", strings(result.getQueryTags()));
        json.addProperty("fallback", result.isFallback());
        return json;
    }

    private static JsonObject location(GeoLocation location) {
        JsonObject json = new JsonObject();
        json.addProperty("name", location.getName());
        json.addProperty("latitude", location.getLatitude());
        json.addProperty("longitude", location.getLongitude());
        json.addProperty("utc_offset_hours", location.getUtcOffsetHours());
        return json;
    }

    private static JsonObject indexed(int index, String name) {
        JsonObject json = new JsonObject();
        json.addProperty("index", index);
        json.addProperty("name", name);
        return json;
    }

    private static JsonArray strings(Collection<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
