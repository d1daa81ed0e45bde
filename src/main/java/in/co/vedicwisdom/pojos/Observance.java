package in.co.vedicwisdom.pojos;

import java.util.List;

/**
 * Named ritual occasions detected from the sunrise tithi.
 */
public enum Observance {
    EKADASHI("Ekadashi", "Vishnu", "Fast and Vishnu worship",
            List.of("ekadashi", "vishnu", "devotion", "fasting")),
    PRADOSHAM("Pradosham", "Shiva", "Shiva puja during twilight",
            List.of("pradosham", "shiva", "twilight")),
    AMAVASYA("Amavasya", "Pitrus", "Tarpanam for ancestors",
            List.of("amavasya", "pitru", "ancestors", "tarpanam")),
    PURNIMA("Purnima", "All", "Full moon observance",
            List.of("purnima", "full moon", "devotion")),
    SANKASHTI_CHATURTHI("Sankashti Chaturthi", "Ganesha", "Ganesha vrata",
            List.of("chaturthi", "ganesha", "obstacles"));

    private final String displayName;
    private final String deity;
    private final String description;
    private final List<String> queryTags;

    Observance(String displayName, String deity, String description, List<String> queryTags) {
        this.displayName = displayName;
        this.deity = deity;
        this.description = description;
        this.queryTags = queryTags;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDeity() {
        return deity;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getQueryTags() {
        return queryTags;
    }
}
