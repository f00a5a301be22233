package io.github.huiyu.imgsort.util;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Orders strings the way a file manager does: case-insensitive, with runs of digits
 * compared by numeric value, so {@code img2.jpg} sorts before {@code img10.jpg}.
 * Strings that only differ in case or leading zeros fall back to plain ordering, which
 * keeps the comparator consistent with {@link String#equals(Object)}.
 */
public final class NaturalOrderComparator implements Comparator<String>, Serializable {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    private NaturalOrderComparator() {
    }

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        int la = a.length();
        int lb = b.length();
        while (i < la && j < lb) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int si = skipZeros(a, i);
                int sj = skipZeros(b, j);
                int ei = endOfDigits(a, si);
                int ej = endOfDigits(b, sj);
                int lenA = ei - si;
                int lenB = ej - sj;
                if (lenA != lenB) {
                    return lenA - lenB;
                }
                for (int k = 0; k < lenA; k++) {
                    int diff = a.charAt(si + k) - b.charAt(sj + k);
                    if (diff != 0) {
                        return diff;
                    }
                }
                i = ei;
                j = ej;
            } else {
                int diff = Character.toLowerCase(ca) - Character.toLowerCase(cb);
                if (diff != 0) {
                    return diff;
                }
                i++;
                j++;
            }
        }
        if (i < la || j < lb) {
            return (la - i) - (lb - j);
        }
        return a.compareTo(b);
    }

    private static int skipZeros(String s, int from) {
        int end = endOfDigits(s, from);
        while (from < end - 1 && s.charAt(from) == '0') {
            from++;
        }
        return from;
    }

    private static int endOfDigits(String s, int from) {
        while (from < s.length() && Character.isDigit(s.charAt(from))) {
            from++;
        }
        return from;
    }
}
