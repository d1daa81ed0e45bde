package in.co.vedicwisdom.pojos;

import java.util.List;

public final class JanamPatriReport {
    private final JanamPatri chart;
    private final String birthPlace;
    private final String theme;
    private final List<RecommendationResult> verses;
    private final List<String> lifestyleRecommendations;

    public JanamPatriReport(JanamPatri chart, String birthPlace, String theme,
                            List<RecommendationResult> verses, List<String> lifestyleRecommendations) {
        this.chart = chart;
        this.birthPlace = birthPlace;
        this.theme = theme;
        this.verses = List.copyOf(verses);
        this.lifestyleRecommendations = List.copyOf(lifestyleRecommendations);
    }

    public JanamPatri getChart() {
        return chart;
    }

    public String getBirthPlace() {
        return birthPlace;
    }

    public String getTheme() {
        return theme;
    }

    public List<RecommendationResult> getVerses() {
        return verses;
    }

    public List<String> getLifestyleRecommendations() {
        return lifestyleRecommendations;
    }
}
