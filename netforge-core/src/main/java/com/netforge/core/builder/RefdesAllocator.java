package com.netforge.core.builder;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hands out reference designator numbers per prefix.
 *
 * <p>{@link #next(String)} returns the smallest positive number not yet used
 * for the prefix. Existing designators are fed in through
 * {@link #reserve(String, String)} so that generated ones never collide with
 * them.
 *
 * <pre>{@code
 * RefdesAllocator allocator = new RefdesAllocator();
 * allocator.reserve("R", "R1");
 * allocator.reserve("R", "R3");
 * allocator.next("R"); // 2
 * allocator.next("R"); // 4
 * }</pre>
 */
public class RefdesAllocator {

    private static final int MAX_DIGITS = 9;

    private final Map<String, Set<Integer>> used = new HashMap<>();

    /**
     * Takes the smallest free number for a prefix.
     *
     * @param prefix refdes prefix
     * @return the number, now marked used
     */
    public int next(String prefix) {
        Set<Integer> numbers = used.computeIfAbsent(normalize(prefix), k -> new HashSet<>());
        int n = 1;
        while (numbers.contains(n)) {
            n++;
        }
        numbers.add(n);
        return n;
    }

    /**
     * Takes the next free designator for a prefix.
     *
     * @param prefix refdes prefix
     * @return designator such as "R4"
     */
    public String allocate(String prefix) {
        return normalize(prefix) + next(prefix);
    }

    /**
     * Marks the number of an existing designator as used.
     *
     * <p>When the designator is the prefix followed only by digits those digits
     * are taken; otherwise its trailing digit run is. A designator that does not
     * end in a digit reserves nothing.
     *
     * @param prefix refdes prefix
     * @param refdes existing designator
     */
    public void reserve(String prefix, String refdes) {
        if (refdes == null || refdes.isBlank()) {
            return;
        }
        String p = normalize(prefix);
        String designator = refdes.trim();

        String digits;
        String remainder = designator.startsWith(p) ? designator.substring(p.length()) : "";
        if (!remainder.isEmpty() && allDigits(remainder)) {
            digits = remainder;
        } else {
            int start = designator.length();
            while (start > 0 && Character.isDigit(designator.charAt(start - 1))) {
                start--;
            }
            digits = designator.substring(start);
        }

        if (digits.isEmpty() || digits.length() > MAX_DIGITS) {
            return;
        }
        used.computeIfAbsent(p, k -> new HashSet<>()).add(Integer.parseInt(digits));
    }

    /**
     * Returns whether a number is taken for a prefix.
     *
     * @param prefix refdes prefix
     * @param number designator number
     * @return true when used
     */
    public boolean isUsed(String prefix, int number) {
        return used.getOrDefault(normalize(prefix), Set.of()).contains(number);
    }

    private static boolean allDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String normalize(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        return prefix.trim();
    }
}
