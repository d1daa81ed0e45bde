package in.co.vedicwisdom.pojos;

import java.time.LocalDate;
import java.util.List;

public final class WeeklyDigest {
    private final LocalDate weekStart;
    private final LocalDate weekEnd;
    private final GeoLocation location;
    private final List<DigestDay> days;
    private final RecommendationResult verseOfWeek;
    private final List<String> lifestyleRecommendations;

    public WeeklyDigest(LocalDate weekStart, LocalDate weekEnd, GeoLocation location, List<DigestDay> days,
                        RecommendationResult verseOfWeek, List<String> lifestyleRecommendations) {
        this.weekStart = weekStart;
        this.weekEnd = weekEnd;
        this.location = location;
        this.days = List.copyOf(days);
        this.verseOfWeek = verseOfWeek;
        this.lifestyleRecommendations = List.copyOf(lifestyleRecommendations);
    }

    public LocalDate getWeekStart() {
        return weekStart;
    }

    public LocalDate getWeekEnd() {
        return weekEnd;
    }

    public GeoLocation getLocation() {
        return location;
    }

    public List<DigestDay> getDays() {
        return days;
    }

    public RecommendationResult getVerseOfWeek() {
        return verseOfWeek;
    }

    public List<String> getLifestyleRecommendations() {
        return lifestyleRecommendations;
    }
}
