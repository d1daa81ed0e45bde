package in.co.vedicwisdom.pojos;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One verse of the corpus. Field names match verses.json.
 */
public final class VerseRecord {
    private final String id;
    private final String devanagari;
    private final String transliteration;
    private final String meaning;
    private final String deity;
    private final String source;
    private final Set<String> tags;

    @JsonCreator
    public VerseRecord(@JsonProperty("id") String id,
                       @JsonProperty("devanagari") String devanagari,
                       @JsonProperty("transliteration") String transliteration,
                       @JsonProperty("meaning") String meaning,
                       @JsonProperty("deity") String deity,
                       @JsonProperty("source") String source,
                       @JsonProperty("tags") List<String> tags) {
        this.id = id;
        this.devanagari = devanagari == null ? "" : devanagari;
        this.transliteration = transliteration == null ? "" : transliteration;
        this.meaning = meaning == null ? "" : meaning;
        this.deity = deity == null ? "" : deity;
        this.source = source == null ? "" : source;
        this.tags = tags == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public String getId() {
        return id;
    }

    public String getDevanagari() {
        return devanagari;
    }

    public String getTransliteration() {
        return transliteration;
    }

    public String getMeaning() {
        return meaning;
    }

    public String getDeity() {
        return deity;
    }

    public String getSource() {
        return source;
    }

    public Set<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return id + " [" + source + "]";
    }
}
