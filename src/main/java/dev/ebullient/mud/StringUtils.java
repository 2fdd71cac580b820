package dev.ebullient.mud;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

public class StringUtils {

    private static final Pattern WORD_BREAK = Pattern.compile("[\\s,.'\"-]+");

    private static final Map<String, String> DIRECTIONS = Map.ofEntries(
            Map.entry("n", "north"),
            Map.entry("s", "south"),
            Map.entry("e", "east"),
            Map.entry("w", "west"),
            Map.entry("u", "up"),
            Map.entry("d", "down"));

    private StringUtils() {
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase();
    }

    /** Expand n/s/e/w/u/d to the full direction name; other input is just lower-cased. */
    public static String canonicalDirection(String direction) {
        String d = normalize(direction);
        return DIRECTIONS.getOrDefault(d, d);
    }

    public static boolean isDirection(String word) {
        String d = normalize(word);
        return DIRECTIONS.containsKey(d) || DIRECTIONS.containsValue(d);
    }

    /** The direction pointing back the other way, or null if there is no obvious opposite. */
    public static String opposite(String direction) {
        return switch (canonicalDirection(direction)) {
            case "north" -> "south";
            case "south" -> "north";
            case "east" -> "west";
            case "west" -> "east";
            case "up" -> "down";
            case "down" -> "up";
            default -> null;
        };
    }

    public static String listOrNone(Collection<String> values) {
        return values == null || values.isEmpty() ? "none" : String.join(", ", values);
    }

    /**
     * Resolve a partial name against candidates, case-insensitively.
     * <p>
     * Tiers, first non-empty wins: exact full name; a word of the name starts with
     * the fragment; the name contains the fragment. Results are sorted by name, then id,
     * so an ambiguous answer always lists candidates in the same order.
     */
    public static <T> List<T> matchByName(Collection<T> candidates, String fragment,
            Function<T, String> name, Function<T, String> id) {
        String f = normalize(fragment);
        if (f.isEmpty()) {
            return List.of();
        }
        List<T> exact = new ArrayList<>();
        List<T> wordPrefix = new ArrayList<>();
        List<T> contains = new ArrayList<>();
        for (T c : candidates) {
            String n = normalize(name.apply(c));
            if (n.equals(f)) {
                exact.add(c);
            } else if (hasWordStartingWith(n, f)) {
                wordPrefix.add(c);
            } else if (n.contains(f)) {
                contains.add(c);
            }
        }
        List<T> tier = !exact.isEmpty() ? exact : !wordPrefix.isEmpty() ? wordPrefix : contains;
        tier.sort(Comparator.comparing((T c) -> normalize(name.apply(c))).thenComparing(id));
        return tier;
    }

    private static boolean hasWordStartingWith(String name, String fragment) {
        if (name.startsWith(fragment)) {
            return true;
        }
        for (String word : WORD_BREAK.split(name)) {
            if (word.startsWith(fragment)) {
                return true;
            }
        }
        return false;
    }
}
