package com.di.epistream.util;

/**
 * Edit-distance similarity for country names.
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    public static int levenshtein(String a, String b) {
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * 1 - distance / longer length; 1.0 for identical strings, 0.0 when nothing lines up.
     */
    public static double similarity(String a, String b) {
        if (a == null || b == null) return 0.0;
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) return 1.0;
        return 1.0 - (double) levenshtein(a, b) / longer;
    }
}
