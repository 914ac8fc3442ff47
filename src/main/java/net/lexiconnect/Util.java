package net.lexiconnect;

import net.lexiconnect.model.OrderedModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Utility functions shared by the parsers, the exporters and the graph adapter.
 */
public class Util {

    public static final String UNKNOWN_LANGUAGE = "unknown";

    // Sibling order: by order, then by ID
    public static final Comparator<OrderedModel> ORDER_THEN_ID = Comparator
            .comparingInt(OrderedModel::getOrder)
            .thenComparing(m -> m.getId() == null ? "" : m.getId());

    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Trims a language code, returning null if nothing is left.
     */
    public static String normalizeLanguageCode(String code) {
        if (code == null || code.trim().isEmpty())
            return null;
        return code.trim();
    }

    /**
     * Picks the first usable language code in priority order. Null, blank and "unknown"
     * candidates are skipped.
     *
     * @param candidates - the codes to consider, highest priority first
     * @return the trimmed code, or null if no candidate qualifies
     */
    public static String firstValidLanguage(String... candidates) {
        for (String c : candidates) {
            String normal = normalizeLanguageCode(c);
            if (normal != null && !normal.equalsIgnoreCase(UNKNOWN_LANGUAGE))
                return normal;
        }
        return null;
    }

    /**
     * Returns a copy of the list, sorted by (order, id).
     */
    public static <T extends OrderedModel> List<T> sortedByOrder(Collection<T> items) {
        if (items == null) return new ArrayList<>();
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(ORDER_THEN_ID);
        return sorted;
    }

    /**
     * Flattens a morphosyntactic analysis value into a display string. Lists are joined
     * with commas, maps are rendered as key=value pairs in key order, anything else
     * uses its string form.
     *
     * @param msa - the analysis as it was stored or parsed
     * @return the flattened string; empty if the value is null
     */
    public static String flattenMsa(Object msa) {
        if (msa == null)
            return "";
        if (msa instanceof String)
            return (String) msa;
        if (msa instanceof String[])
            return flattenMsa(List.of((String[]) msa));
        if (msa instanceof Collection)
            return ((Collection<?>) msa).stream()
                    .filter(x -> x != null && !x.toString().isEmpty())
                    .map(Object::toString)
                    .collect(Collectors.joining(", "));
        if (msa instanceof Map) {
            TreeMap<String, String> sorted = new TreeMap<>();
            ((Map<?, ?>) msa).forEach((k, v) -> sorted.put(String.valueOf(k), v == null ? "" : v.toString()));
            return sorted.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining("; "));
        }
        return msa.toString();
    }

    /**
     * Splits text on whitespace, dropping empty tokens.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) return tokens;
        for (String t : text.trim().split("\\s+"))
            if (!t.isEmpty())
                tokens.add(t);
        return tokens;
    }
}
