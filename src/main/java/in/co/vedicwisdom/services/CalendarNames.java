package in.co.vedicwisdom.services;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Names of the panchang limbs. Every lookup takes the 1-based index used throughout the calendar code.
 */
public final class CalendarNames {

    private CalendarNames() {}

    public static final List<String> TITHI_NAMES = List.of(
            "Pratipada", "Dwitiya", "Tritiya", "Chaturthi", "Panchami",
            "Shashthi", "Saptami", "Ashtami", "Navami", "Dashami",
            "Ekadashi", "Dwadashi", "Trayodashi", "Chaturdashi", "Purnima",
            "Pratipada", "Dwitiya", "Tritiya", "Chaturthi", "Panchami",
            "Shashthi", "Saptami", "Ashtami", "Navami", "Dashami",
            "Ekadashi", "Dwadashi", "Trayodashi", "Chaturdashi", "Amavasya");

    public static final List<String> NAKSHATRA_NAMES = List.of(
            "Ashwini", "Bharani", "Krittika", "Rohini", "Mrigashira",
            "Ardra", "Punarvasu", "Pushya", "Ashlesha", "Magha",
            "Purva Phalguni", "Uttara Phalguni", "Hasta", "Chitra", "Swati",
            "Vishakha", "Anuradha", "Jyeshtha", "Mula", "Purva Ashadha",
            "Uttara Ashadha", "Shravana", "Dhanishta", "Shatabhisha",
            "Purva Bhadrapada", "Uttara Bhadrapada", "Revati");

    public static final List<String> YOGA_NAMES = List.of(
            "Vishkambha", "Priti", "Ayushman", "Saubhagya", "Shobhana",
            "Atiganda", "Sukarma", "Dhriti", "Shula", "Ganda",
            "Vriddhi", "Dhruva", "Vyaghata", "Harshana", "Vajra",
            "Siddhi", "Vyatipata", "Variyan", "Parigha", "Shiva",
            "Siddha", "Sadhya", "Shubha", "Shukla", "Brahma",
            "Indra", "Vaidhriti");

    // 1-7 movable cycle, 8-11 fixed karanas
    public static final List<String> KARANA_NAMES = List.of(
            "Bava", "Balava", "Kaulava", "Taitila", "Garaja",
            "Vanija", "Vishti", "Shakuni", "Chatushpada", "Nagava", "Kimstughna");

    public static final List<String> RASHI_NAMES = List.of(
            "Mesha", "Vrishabha", "Mithuna", "Karka", "Simha", "Kanya",
            "Tula", "Vrishchika", "Dhanu", "Makara", "Kumbha", "Meena");

    // Janma nakshatra -> verse search theme (deity / tradition)
    public static final Map<String, String> NAKSHATRA_THEMES = Map.ofEntries(
            Map.entry("Ashwini", "healing vitality Ashwini Kumaras"),
            Map.entry("Bharani", "transformation Yama dharma"),
            Map.entry("Krittika", "Agni fire purification"),
            Map.entry("Rohini", "moon devotion beauty"),
            Map.entry("Mrigashira", "Soma moon seeking"),
            Map.entry("Ardra", "Shiva Rudra storm"),
            Map.entry("Punarvasu", "Aditi abundance home"),
            Map.entry("Pushya", "Brihaspati wisdom Jupiter"),
            Map.entry("Ashlesha", "serpent wisdom Naga"),
            Map.entry("Magha", "pitru ancestors royalty"),
            Map.entry("Purva Phalguni", "love devotion Venus"),
            Map.entry("Uttara Phalguni", "grace Aryaman"),
            Map.entry("Hasta", "skill Savitr sun"),
            Map.entry("Chitra", "Vishwakarma creation"),
            Map.entry("Swati", "Vayu wind freedom"),
            Map.entry("Vishakha", "Indra Agni victory"),
            Map.entry("Anuradha", "Mitra friendship devotion"),
            Map.entry("Jyeshtha", "Indra protection elder"),
            Map.entry("Mula", "Nirriti dissolution"),
            Map.entry("Purva Ashadha", "Apah waters"),
            Map.entry("Uttara Ashadha", "Vishvedeva universal"),
            Map.entry("Shravana", "Vishnu listening"),
            Map.entry("Dhanishta", "Vasudeva rhythm"),
            Map.entry("Shatabhisha", "Varuna healing"),
            Map.entry("Purva Bhadrapada", "Aja Ekapada"),
            Map.entry("Uttara Bhadrapada", "Ahir Budhnya"),
            Map.entry("Revati", "Pushan nourishment"));

    // Sunrise tithi -> verse search theme on days without an observance
    public static final Map<String, String> TITHI_THEMES = Map.of(
            "Pratipada", "Ganesha beginning auspicious",
            "Chaturthi", "Ganesha chaturthi obstacles",
            "Ekadashi", "Vishnu ekadashi devotion",
            "Trayodashi", "Shiva pradosham",
            "Amavasya", "pitru ancestors amavasya tarpanam",
            "Purnima", "full moon devotion",
            "Dwadashi", "Vishnu devotion");

    public static String tithiName(int tithi) {
        return TITHI_NAMES.get(tithi - 1);
    }

    public static String nakshatraName(int nakshatra) {
        return NAKSHATRA_NAMES.get(nakshatra - 1);
    }

    public static String yogaName(int yoga) {
        return YOGA_NAMES.get(yoga - 1);
    }

    public static String karanaName(int karana) {
        return KARANA_NAMES.get(karana - 1);
    }

    public static String rashiName(int rashi) {
        return RASHI_NAMES.get(rashi - 1);
    }

    public static String vaaraName(DayOfWeek day) {
        switch (day) {
            case SUNDAY: return "Ravivara";
            case MONDAY: return "Somavara";
            case TUESDAY: return "Mangalavara";
            case WEDNESDAY: return "Budhavara";
            case THURSDAY: return "Guruvara";
            case FRIDAY: return "Shukravara";
            case SATURDAY: return "Shanivara";
            default: throw new IllegalArgumentException("Unknown weekday: " + day);
        }
    }

    /**
     * 1-based nakshatra index for a name, case-insensitive. Returns -1 when unknown.
     */
    public static int nakshatraIndex(String name) {
        return indexOf(NAKSHATRA_NAMES, name);
    }

    /**
     * 1-based rashi index for a name, case-insensitive. Returns -1 when unknown.
     */
    public static int rashiIndex(String name) {
        return indexOf(RASHI_NAMES, name);
    }

    public static String nakshatraTheme(String nakshatra) {
        return NAKSHATRA_THEMES.getOrDefault(nakshatra, nakshatra + " devotion dharma");
    }

    private static int indexOf(List<String> names, String name) {
        if (name == null) {
            return -1;
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).toLowerCase(Locale.ROOT).equals(wanted)) {
                return i + 1;
            }
        }
        return -1;
    }
}
