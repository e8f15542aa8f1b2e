package tabular;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Matches wanted header names against a table's actual headers.
 * Matching ignores case and surrounding spaces. A wanted name that has no exact match can
 * fall back to one of its synonyms, e.g. "Guild GP" matches an existing "GP" column.
 */
public class HeaderResolver {

    public static final HeaderResolver DEFAULT = new HeaderResolver(defaultSynonyms());

    private final Map<String, List<String>> synonyms;

    public HeaderResolver(Map<String, List<String>> synonyms) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
            List<String> alternatives = new ArrayList<>();
            for (String alternative : entry.getValue()) {
                alternatives.add(normalize(alternative));
            }
            normalized.put(normalize(entry.getKey()), Collections.unmodifiableList(alternatives));
        }
        this.synonyms = Collections.unmodifiableMap(normalized);
    }

    private static Map<String, List<String>> defaultSynonyms() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("Guild GP", Arrays.asList("GP", "Galactic Power"));
        map.put("Members", Arrays.asList("Number of members", "Member Count"));
        map.put("Guild Name", Arrays.asList("Player Guild", "Guild"));
        map.put("Player Guild", Arrays.asList("Guild Name", "Guild"));
        map.put("Ally code", Arrays.asList("Allycode", "Ally"));
        map.put("Last Update", Arrays.asList("Last Updated"));
        map.put("Player Id", Arrays.asList("PlayerId"));
        map.put("GAC League", Arrays.asList("League"));
        return map;
    }

    /**
     * Normalizes a header for comparison: trimmed and lower case
     */
    public static String normalize(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Finds the column for a single wanted header
     * @return The 0-based column index, or -1 when neither the name nor a synonym is present
     */
    public int resolve(List<String> headers, String wanted) {
        Integer index = resolveAll(headers, Collections.singletonList(wanted)).get(wanted);
        return index == null ? -1 : index;
    }

    /**
     * Finds the columns for several wanted headers at once. Exact matches are assigned first;
     * a synonym can only claim a column that no other wanted header matched exactly.
     * @return wanted name → 0-based index, only for the names that were found
     */
    public Map<String, Integer> resolveAll(List<String> headers, List<String> wanted) {
        Map<String, Integer> result = new LinkedHashMap<>();
        Set<Integer> claimed = new HashSet<>();

        for (String name : wanted) {
            int index = indexOf(headers, normalize(name), claimed);
            if (index >= 0) {
                result.put(name, index);
                claimed.add(index);
            }
        }

        for (String name : wanted) {
            if (result.containsKey(name)) {
                continue;
            }
            for (String alternative : synonyms.getOrDefault(normalize(name), Collections.emptyList())) {
                int index = indexOf(headers, alternative, claimed);
                if (index >= 0) {
                    result.put(name, index);
                    claimed.add(index);
                    break;
                }
            }
        }
        return result;
    }

    private static int indexOf(List<String> headers, String normalizedName, Set<Integer> claimed) {
        for (int i = 0; i < headers.size(); i++) {
            if (!claimed.contains(i) && normalize(headers.get(i)).equals(normalizedName)) {
                return i;
            }
        }
        return -1;
    }
}
