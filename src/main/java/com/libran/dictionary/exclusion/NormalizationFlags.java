package com.libran.dictionary.exclusion;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization applied when exact and alias lookups fail. All flags default to off.
 *
 * @param ignoreCase          compare terms case-insensitively
 * @param normalizeDiacritics strip combining marks before comparing
 * @param treatHyphenDashEqual treat hyphen, en dash and em dash as the same character
 */
public record NormalizationFlags(boolean ignoreCase, boolean normalizeDiacritics, boolean treatHyphenDashEqual) {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}");
    private static final Pattern DASHES = Pattern.compile("[‐‑‒–—−-]");

    public static NormalizationFlags none() {
        return new NormalizationFlags(false, false, false);
    }

    public boolean anyEnabled() {
        return ignoreCase || normalizeDiacritics || treatHyphenDashEqual;
    }

    public String apply(String term) {
        String result = term.trim();
        if (normalizeDiacritics) {
            result = COMBINING_MARKS.matcher(Normalizer.normalize(result, Normalizer.Form.NFD)).replaceAll("");
        }
        if (treatHyphenDashEqual) {
            result = DASHES.matcher(result).replaceAll("-");
        }
        if (ignoreCase) {
            result = result.toLowerCase(Locale.ROOT);
        }
        return result;
    }
}
