package in.co.vedicwisdom.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.co.vedicwisdom.pojos.VerseRecord;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The read-only verse corpus, loaded once from verses.json. Source is either {@code classpath:/path} or a
 * file system path. Record order is preserved because ranking ties resolve by it.
 */
public class CorpusStore {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<VerseRecord> verses;
    private final VerseRecord defaultVerse;

    public CorpusStore(List<VerseRecord> verses, String defaultVerseId) {
        this.verses = List.copyOf(verses);
        validateIds(this.verses);
        this.defaultVerse = resolveDefault(this.verses, defaultVerseId);
    }

    public static CorpusStore load(String source, String defaultVerseId) {
        long start = LoggingService.logOperationStart("corpus_load", LoggingService.data("source", source));
        try (InputStream in = open(source)) {
            CorpusStore store = new CorpusStore(parse(in), defaultVerseId);
            LoggingService.logOperationEnd("corpus_load", start, LoggingService.data(
                    "verseCount", store.size(),
                    "defaultVerseId", store.defaultVerse == null ? "" : store.defaultVerse.getId()));
            return store;
        } catch (IOException e) {
            LoggingService.logOperationFailed("corpus_load", start, e);
            throw new IllegalStateException("Unable to read verse corpus from " + source, e);
        } catch (IllegalStateException e) {
            LoggingService.logOperationFailed("corpus_load", start, e);
            throw e;
        }
    }

    static List<VerseRecord> parse(InputStream in) throws IOException {
        List<VerseRecord> records = MAPPER.readValue(in, new TypeReference<List<VerseRecord>>() {});
        return records == null ? List.of() : records;
    }

    private static InputStream open(String source) throws IOException {
        if (source == null || source.isBlank()) {
            throw new IOException("Corpus source is not configured");
        }
        if (source.startsWith(CLASSPATH_PREFIX)) {
            String resource = source.substring(CLASSPATH_PREFIX.length());
            InputStream in = CorpusStore.class.getResourceAsStream(resource.startsWith("/") ? resource : "/" + resource);
            if (in == null) {
                throw new IOException("Classpath resource not found: " + resource);
            }
            return in;
        }
        return new FileInputStream(source);
    }

    private static void validateIds(List<VerseRecord> verses) {
        Set<String> seen = new HashSet<>();
        for (VerseRecord verse : verses) {
            if (verse.getId() == null || verse.getId().isBlank()) {
                throw new IllegalStateException("Verse without id in corpus");
            }
            if (!seen.add(verse.getId())) {
                throw new IllegalStateException("Duplicate verse id in corpus: " + verse.getId());
            }
        }
    }

    private static VerseRecord resolveDefault(List<VerseRecord> verses, String defaultVerseId) {
        if (verses.isEmpty()) {
            return null;
        }
        if (defaultVerseId == null || defaultVerseId.isBlank()) {
            return verses.get(0);
        }
        for (VerseRecord verse : verses) {
            if (verse.getId().equals(defaultVerseId)) {
                return verse;
            }
        }
        throw new IllegalStateException("Default verse not found: " + defaultVerseId);
    }

    public List<VerseRecord> getVerses() {
        return verses;
    }

    public int size() {
        return verses.size();
    }

    public boolean isEmpty() {
        return verses.isEmpty();
    }

    /**
     * The configured default verse, or the first verse when the id is unknown.
     */
    public VerseRecord getDefaultVerse() throws ComputationException {
        if (defaultVerse == null) {
            throw new ComputationException(ErrorCode.CORPUS_EMPTY, "Verse corpus is empty");
        }
        return defaultVerse;
    }
}
