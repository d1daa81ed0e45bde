package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.Observance;
import in.co.vedicwisdom.pojos.ObservanceSet;
import in.co.vedicwisdom.pojos.PanchangDay;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Detects observances from the sunrise tithi. Every matching rule fires; a day can carry several.
 */
public class ObservanceClassifier {

    public List<ObservanceSet> classify(List<PanchangDay> week) {
        Objects.requireNonNull(week, "week");
        List<ObservanceSet> sets = new ArrayList<>(week.size());
        for (PanchangDay day : week) {
            sets.add(classify(day));
        }
        return sets;
    }

    public ObservanceSet classify(PanchangDay day) {
        return new ObservanceSet(day.getDate(), observancesFor(day.getTithi()));
    }

    /**
     * Observances for a sunrise tithi 1-30. Pradosham falls on the Trayodashi of either paksha, so a
     * Monday (Soma) or Tuesday (Bhauma) Trayodashi is covered too.
     */
    static EnumSet<Observance> observancesFor(int tithi) {
        if (tithi < 1 || tithi > 30) {
            throw new IllegalArgumentException("Tithi must be 1-30: " + tithi);
        }
        EnumSet<Observance> found = EnumSet.noneOf(Observance.class);
        if (tithi == 11 || tithi == 26) {
            found.add(Observance.EKADASHI);
        }
        if (tithi == 13 || tithi == 28) {
            found.add(Observance.PRADOSHAM);
        }
        if (tithi == 30) {
            found.add(Observance.AMAVASYA);
        }
        if (tithi == 15) {
            found.add(Observance.PURNIMA);
        }
        if (tithi == 19) {
            found.add(Observance.SANKASHTI_CHATURTHI);
        }
        return found;
    }
}
