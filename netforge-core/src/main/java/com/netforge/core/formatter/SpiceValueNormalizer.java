package com.netforge.core.formatter;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites engineering-notation values as SPICE exponents.
 *
 * <p>A decimal literal followed by a multiplier and optional unit letters
 * becomes {@code <literal>e<exponent>}:
 * <pre>
 * 1k     -&gt; 1e3
 * 4.7uF  -&gt; 4.7e-6
 * 2.2MEG -&gt; 2.2e6
 * 100nF  -&gt; 100e-9
 * </pre>
 * Anything else, including values already carrying an exponent, plain numbers
 * and unknown suffixes, is returned unchanged.
 */
public final class SpiceValueNormalizer {

    private static final Pattern VALUE = Pattern.compile("([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+))\\s*([A-Za-z]+)");

    private static final Map<Character, Integer> MULTIPLIERS = Map.of(
        'T', 12,
        'G', 9,
        'K', 3,
        'M', -3,
        'U', -6,
        'N', -9,
        'P', -12,
        'F', -15
    );

    private SpiceValueNormalizer() {
        // Utility class
    }

    /**
     * Normalizes one value.
     *
     * @param value value text, may be null
     * @return normalized value, or the trimmed input when it has no known multiplier
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        // micro sign and Greek mu
        String ascii = trimmed.replace('µ', 'u').replace('μ', 'u');
        Matcher m = VALUE.matcher(ascii);
        if (!m.matches()) {
            return trimmed;
        }
        String suffix = m.group(2).toUpperCase(Locale.ROOT);
        if (suffix.startsWith("E")) {
            return trimmed;
        }
        Integer exponent = suffix.startsWith("MEG") ? Integer.valueOf(6) : MULTIPLIERS.get(suffix.charAt(0));
        if (exponent == null) {
            return trimmed;
        }
        return m.group(1) + "e" + exponent;
    }
}
