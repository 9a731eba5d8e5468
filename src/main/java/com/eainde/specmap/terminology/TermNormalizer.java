package com.eainde.specmap.terminology;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalization of spec names for lookups and duplicate detection.
 */
public final class TermNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[\\s:：;,.]+$");
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern UNIT_SUFFIX = Pattern.compile("\\s*[\\[(]([^\\])]*)[\\])]\\s*$");

    private TermNormalizer() {
    }

    /**
     * NFKC, lower case, collapsed whitespace, trailing colon/punctuation removed.
     * "Leuchtdichte :" and "leuchtdichte" normalize equally.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String n = Normalizer.normalize(name, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        n = WHITESPACE.matcher(n).replaceAll(" ").strip();
        return TRAILING_PUNCT.matcher(n).replaceAll("");
    }

    /** {@link #normalize} with diacritics removed ("Luminosité" → "luminosite"). */
    public static String fold(String name) {
        String decomposed = Normalizer.normalize(normalize(name), Normalizer.Form.NFD);
        return MARKS.matcher(decomposed).replaceAll("").replace("ß", "ss");
    }

    /** Label without a trailing bracketed unit: "Luminance [cd/m²]" → "Luminance". */
    public static String stripUnitSuffix(String label) {
        if (label == null) {
            return "";
        }
        return UNIT_SUFFIX.matcher(label).replaceFirst("").strip();
    }

    /** The bracketed unit of a label, or null: "Luminance (cd/m²)" → "cd/m²". */
    public static String unitSuffix(String label) {
        if (label == null) {
            return null;
        }
        Matcher m = UNIT_SUFFIX.matcher(label);
        if (!m.find()) {
            return null;
        }
        String unit = m.group(1).strip();
        return unit.isEmpty() ? null : unit;
    }
}
