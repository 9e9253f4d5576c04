package com.components.bom.service.core;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Natural ordering of reference designators: alphabetic prefix first (case-insensitive), then
 * the numeric part by value, then any trailing text. {@code R2} sorts before {@code R10}, and
 * {@code U1A} before {@code U1B}.
 */
public final class RefDesOrder implements Comparator<String> {

    public static final RefDesOrder INSTANCE = new RefDesOrder();

    private static final Pattern PARTS = Pattern.compile("^(\\D*)(\\d*)(.*)$", Pattern.DOTALL);

    private RefDesOrder() {
    }

    @Override
    public int compare(final String left, final String right) {
        Matcher a = PARTS.matcher(left);
        Matcher b = PARTS.matcher(right);
        a.matches();
        b.matches();

        int cmp = a.group(1).compareToIgnoreCase(b.group(1));
        if (cmp != 0) {
            return cmp;
        }
        cmp = compareNumbers(a.group(2), b.group(2));
        if (cmp != 0) {
            return cmp;
        }
        cmp = a.group(3).compareToIgnoreCase(b.group(3));
        return cmp != 0 ? cmp : left.compareTo(right);
    }

    private static int compareNumbers(final String left, final String right) {
        if (left.isEmpty() || right.isEmpty()) {
            // designators without a number come first
            return Boolean.compare(!left.isEmpty(), !right.isEmpty());
        }
        return new BigInteger(left).compareTo(new BigInteger(right));
    }
}
