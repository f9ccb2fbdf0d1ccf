package com.libran.dictionary.qa;

import com.libran.dictionary.core.model.Entry;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical tests for donor-language evidence shared by the QA categories and the audit.
 * Donor languages are Latin, Hungarian, Romanian and Icelandic.
 */
public final class DonorLanguageHeuristics {

    private static final Pattern DONOR_NAME = Pattern.compile("latin|hungarian|romanian|icelandic");
    // abbreviations only count as whole words, "hu" inside "human" is not a claim
    private static final Pattern DONOR_ABBREVIATION = Pattern.compile("\\b(lat|hu|hun|ro|rom|isl|ice)\\b");
    private static final Pattern LATIN_CLAIM = Pattern.compile("\\b(lat|latin)\\b");
    private static final Pattern HUNGARIAN_CLAIM = Pattern.compile("\\b(hu|hun|hungarian)\\b");
    private static final Pattern LATIN_ENDING = Pattern.compile("(us|um|ae|is)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern HUNGARIAN_ENDING = Pattern.compile("[áéíóúőű]$");
    private static final Pattern HUNGARIAN_FEATURE = Pattern.compile("[áéíóúőű]|cs|dz|gy|ly|ny|sz|ty|zs");
    private static final Pattern CULTURAL_NOTE = Pattern.compile("cultural|traditional|ceremonial|religious|mythical");

    private DonorLanguageHeuristics() {
    }

    /**
     * Whether the note names a donor language, in full or by a standard abbreviation.
     */
    public static boolean hasDonorNote(String notes) {
        if (notes == null || notes.isBlank()) {
            return false;
        }
        String lower = notes.toLowerCase(Locale.ROOT);
        return DONOR_NAME.matcher(lower).find() || DONOR_ABBREVIATION.matcher(lower).find();
    }

    /**
     * Whether the forms themselves point at a donor language: a Latin ending on the Ancient
     * form or a Hungarian accented vowel ending the Modern form.
     */
    public static boolean hasDonorSignature(Entry entry) {
        String ancient = entry.ancientSurface();
        String modern = entry.modernSurface();
        return (ancient != null && LATIN_ENDING.matcher(ancient).find())
                || (modern != null && HUNGARIAN_ENDING.matcher(modern).find());
    }

    public static boolean isCulturallyGrounded(String notes) {
        return notes != null && CULTURAL_NOTE.matcher(notes.toLowerCase(Locale.ROOT)).find();
    }

    public static boolean claimsLatin(String notes) {
        return notes != null && LATIN_CLAIM.matcher(notes.toLowerCase(Locale.ROOT)).find();
    }

    public static boolean claimsHungarian(String notes) {
        return notes != null && HUNGARIAN_CLAIM.matcher(notes.toLowerCase(Locale.ROOT)).find();
    }

    public static boolean hasLatinEnding(String form) {
        return form != null && LATIN_ENDING.matcher(form).find();
    }

    public static boolean hasHungarianFeatures(String form) {
        return form != null && HUNGARIAN_FEATURE.matcher(form.toLowerCase(Locale.ROOT)).find();
    }
}
