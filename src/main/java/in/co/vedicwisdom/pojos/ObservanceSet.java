package in.co.vedicwisdom.pojos;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Observances that apply on one date. An empty set only means "nothing today".
 */
public final class ObservanceSet {
    private final LocalDate date;
    private final Set<Observance> observances;

    public ObservanceSet(LocalDate date, Set<Observance> observances) {
        this.date = date;
        this.observances = observances.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(observances));
    }

    public LocalDate getDate() {
        return date;
    }

    public Set<Observance> getObservances() {
        return observances;
    }

    public boolean contains(Observance observance) {
        return observances.contains(observance);
    }

    public boolean isEmpty() {
        return observances.isEmpty();
    }

    /**
     * Query tags of every observance in declaration order, without duplicates.
     */
    public Set<String> queryTags() {
        Set<String> tags = new LinkedHashSet<>();
        for (Observance observance : observances) {
            tags.add(observance.getDisplayName());
            tags.addAll(observance.getQueryTags());
        }
        return tags;
    }

    @Override
    public String toString() {
        return date + " " + observances;
    }
}
