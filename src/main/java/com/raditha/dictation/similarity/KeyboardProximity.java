package com.raditha.dictation.similarity;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Key adjacency on common keyboard layouts.
 * A substitution between neighbouring keys is the most frequent typing slip, so
 * it is charged less than an arbitrary substitution.
 */
public class KeyboardProximity {

    public static final double ADJACENT_COST = 0.8;
    public static final double DEFAULT_COST = 1.0;

    // Each entry is "key" followed by its neighbours
    private static final String[] QWERTZ_ROWS = {
            "12q", "213qw", "324we", "435er", "546rt", "657tz", "768zu", "879ui", "980io", "09ßop", "ß0´pü", "´ßü+",
            "q12wa", "w23qeas", "e34wrsd", "r45etdf", "t56rzfg", "z67tugh", "u78zihj", "i89uojk", "o90ipkl",
            "p0ßoülö", "üßpöä", "+´",
            "aqwsy", "sweadyx", "dersfxc", "frtdgcv", "gtzfhvb", "hzugjbn", "juihknm", "kiojlm,", "lopkö,.",
            "öpülä.-", "äüö-", "#+ä",
            "yasx<", "xsdyc<", "cdfxv", "vfgcb", "bghvn", "nhjbm", "mjkn,", ",klm.", ".lö,-", "-öä."
    };

    private static final String[] QWERTY_ROWS = {
            "12q", "213qw", "324we", "435er", "546rt", "657ty", "768yu", "879ui", "980io", "09-op", "-0=p[", "=-[]",
            "q12wa", "w23qeas", "e34wrsd", "r45etdf", "t56ryfg", "y67tugh", "u78yihj", "i89uojk", "o90ipkl",
            "p0-o[l;", "[-=p];'", "]=['\\",
            "aqwsz", "sweadzx", "dersfxc", "frtdgcv", "gtyfhvb", "hyugjbn", "juihknm", "kiojlm,", "lopk;,.",
            ";p[l'./", "'[];\\/.", "\\]'/",
            "zasx", "xsdzc", "cdfxv", "vfgcb", "bghvn", "nhjbm", "mjkn,", ",klm.", ".l;,/", "/;'.\\"
    };

    private static final String[] AZERTY_ROWS = {
            "&éa", "é&\"az", "\"é'ze", "'\"(er", "('-rt", "-(èty", "è-_yu", "_èçui", "ç_àio", "àç)op", ")à=p",
            "a&ézq", "zé\"aeqs", "e\"'zrsd", "r'(etdf", "t(-ryfg", "y-ètugh", "uè_yihj", "i_çuojk", "oçàipkl",
            "pà)olm",
            "qazsw", "szeqdwx", "dersfxc", "frtdgcv", "gtyfhvb", "hyugjbn", "juihkn,", "kiojl,;", "lopkm;:",
            "mpl:!",
            "wqsx", "xsdwc", "cdfxv", "vfgcb", "bghvn", "nhjb,", ",jkn;", ";kl,:", ":lm;!", "!m:"
    };

    private static final Map<KeyboardLayout, Map<Character, String>> ADJACENCY = new EnumMap<>(KeyboardLayout.class);

    static {
        ADJACENCY.put(KeyboardLayout.QWERTZ, buildMap(QWERTZ_ROWS));
        ADJACENCY.put(KeyboardLayout.QWERTY, buildMap(QWERTY_ROWS));
        ADJACENCY.put(KeyboardLayout.AZERTY, buildMap(AZERTY_ROWS));
    }

    /**
     * Check if two characters are adjacent on the given layout.
     * Comparison is case-insensitive; a character is never adjacent to itself.
     */
    public boolean isAdjacent(char first, char second, KeyboardLayout layout) {
        char c1 = Character.toLowerCase(first);
        char c2 = Character.toLowerCase(second);
        if (c1 == c2) {
            return false;
        }

        if (layout == null || layout == KeyboardLayout.AUTO) {
            return isAdjacentOn(KeyboardLayout.QWERTZ, c1, c2)
                    || isAdjacentOn(KeyboardLayout.QWERTY, c1, c2)
                    || isAdjacentOn(KeyboardLayout.AZERTY, c1, c2);
        }
        return isAdjacentOn(layout, c1, c2);
    }

    /**
     * Substitution cost for an edit-distance calculation: lower for adjacent keys.
     */
    public double proximityCost(char first, char second, KeyboardLayout layout) {
        return isAdjacent(first, second, layout) ? ADJACENT_COST : DEFAULT_COST;
    }

    private static boolean isAdjacentOn(KeyboardLayout layout, char c1, char c2) {
        Map<Character, String> map = ADJACENCY.get(layout);
        String n1 = map.get(c1);
        String n2 = map.get(c2);
        return (n1 != null && n1.indexOf(c2) >= 0) || (n2 != null && n2.indexOf(c1) >= 0);
    }

    private static Map<Character, String> buildMap(String[] rows) {
        Map<Character, String> map = new HashMap<>();
        for (String row : rows) {
            map.put(row.charAt(0), row.substring(1));
        }
        return Map.copyOf(map);
    }
}
