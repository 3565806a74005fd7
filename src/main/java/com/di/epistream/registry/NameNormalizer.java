package com.di.epistream.registry;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Canonical form of a country label used as alias key: lower case, accents stripped,
 * "&amp;" spelled out, punctuation dropped, whitespace collapsed.
 * {@code "Côte d'Ivoire"} and {@code "cote d ivoire"} normalise to the same key.
 */
public final class NameNormalizer {

    private NameNormalizer() {
    }

    public static String normalize(String label) {
        if (label == null) {
            return "";
        }
        String value = Normalizer.normalize(label, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase(Locale.ROOT)
                .replace("&", " and ")
                .replaceAll("[^a-z0-9]+", " ")
                .trim()
                .replaceAll("\\s+", " ");
        if (value.startsWith("the ")) {
            value = value.substring(4);
        }
        return value;
    }
}
