package com.components.bom.service.core;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores how well a candidate's package fits the package a line item asks for.
 * <ul>
 *   <li>{@code 1.0}: the item names no package, or both texts are equal once normalized
 *       (upper case, spaces, dashes and underscores removed).</li>
 *   <li>{@code 0.5}: the texts are known equivalents: the same chip size (imperial and metric
 *       codes compared as imperial sizes), containment when either side carries no chip size,
 *       or a configured alias group.</li>
 *   <li>{@code 0.0}: the candidate has no package, or nothing matches.</li>
 * </ul>
 */
public class PackageMatcher {

    public static final double EXACT = 1.0;
    public static final double EQUIVALENT = 0.5;
    public static final double NONE = 0.0;

    private static final Pattern NOISE = Pattern.compile("[\\s_\\-]+");
    private static final Pattern CHIP_CODE =
            Pattern.compile("(?<!\\d)(\\d{4,5})(?!\\d)(\\s*metric)?", Pattern.CASE_INSENSITIVE);
    private static final int MIN_CONTAINED_LENGTH = 3;

    /** Imperial chip size code to its metric counterpart. */
    private static final Map<String, String> IMPERIAL_TO_METRIC = Map.ofEntries(
            Map.entry("01005", "0402"),
            Map.entry("0201", "0603"),
            Map.entry("0402", "1005"),
            Map.entry("0603", "1608"),
            Map.entry("0805", "2012"),
            Map.entry("1008", "2520"),
            Map.entry("1206", "3216"),
            Map.entry("1210", "3225"),
            Map.entry("1812", "4532"),
            Map.entry("2010", "5025"),
            Map.entry("2512", "6332"));

    private static final Map<String, String> METRIC_TO_IMPERIAL = invert(IMPERIAL_TO_METRIC);

    /** Normalized package text to the index of its alias group. */
    private final Map<String, Integer> aliasGroups = new HashMap<>();

    public PackageMatcher(final List<List<String>> aliasGroups) {
        if (aliasGroups == null) {
            return;
        }
        for (int i = 0; i < aliasGroups.size(); i++) {
            List<String> group = aliasGroups.get(i);
            if (group == null) {
                continue;
            }
            for (String alias : group) {
                String key = normalize(alias);
                if (!key.isEmpty()) {
                    this.aliasGroups.putIfAbsent(key, i);
                }
            }
        }
    }

    /**
     * @param required package of the line item, may be {@code null}
     * @param offered  package of the candidate, may be {@code null}
     * @return {@link #EXACT}, {@link #EQUIVALENT} or {@link #NONE}
     */
    public double score(final String required, final String offered) {
        String want = normalize(required);
        if (want.isEmpty()) {
            return EXACT;
        }
        String have = normalize(offered);
        if (have.isEmpty()) {
            return NONE;
        }
        if (want.equals(have)) {
            return EXACT;
        }
        return isEquivalent(want, have, required, offered) ? EQUIVALENT : NONE;
    }

    private boolean isEquivalent(final String want, final String have,
                                 final String rawWant, final String rawHave) {
        Set<String> wantCodes = chipCodes(rawWant);
        Set<String> haveCodes = chipCodes(rawHave);
        if (!wantCodes.isEmpty() && !haveCodes.isEmpty()) {
            // both sides sized: only the sizes decide
            for (String code : wantCodes) {
                if (haveCodes.contains(code)) {
                    return true;
                }
            }
        } else {
            String shorter = want.length() <= have.length() ? want : have;
            String longer = shorter == want ? have : want;
            if (shorter.length() >= MIN_CONTAINED_LENGTH && longer.contains(shorter)) {
                return true;
            }
        }

        Integer wantGroup = aliasGroups.get(want);
        return wantGroup != null && wantGroup.equals(aliasGroups.get(have));
    }

    /**
     * Chip size codes found in the text, each reduced to its imperial size.
     * <p>
     * A code that is an imperial size stays as it is, unless the text marks it as metric
     * ({@code "1608 Metric"}). A metric code maps to its imperial pair. Codes outside both tables
     * are kept unchanged. Metric {@code 0603} (imperial {@code 0201}) therefore never matches
     * imperial {@code 0603}.
     * </p>
     */
    static Set<String> chipCodes(final String text) {
        Set<String> codes = new HashSet<>();
        if (text == null) {
            return codes;
        }
        Matcher m = CHIP_CODE.matcher(text);
        while (m.find()) {
            String code = m.group(1);
            boolean markedMetric = m.group(2) != null;
            if (!markedMetric && IMPERIAL_TO_METRIC.containsKey(code)) {
                codes.add(code);
            } else {
                codes.add(METRIC_TO_IMPERIAL.getOrDefault(code, code));
            }
        }
        return codes;
    }

    static String normalize(final String text) {
        if (StringUtils.isBlank(text)) {
            return "";
        }
        return NOISE.matcher(text).replaceAll("").toUpperCase(Locale.ROOT);
    }

    private static Map<String, String> invert(final Map<String, String> map) {
        Map<String, String> inverted = new HashMap<>();
        map.forEach((k, v) -> inverted.put(v, k));
        return Map.copyOf(inverted);
    }
}
