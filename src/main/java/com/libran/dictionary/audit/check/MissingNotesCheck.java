package com.libran.dictionary.audit.check;

import com.libran.dictionary.audit.AuditCheck;
import com.libran.dictionary.audit.AuditCheckType;
import com.libran.dictionary.audit.AuditIssue;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.Severity;
import com.libran.dictionary.core.model.UnifiedDictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Important terms (titles, arms, architecture, magic) whose note is shorter than the minimum.
 */
public class MissingNotesCheck implements AuditCheck {

    public static final int DEFAULT_MIN_NOTES_LENGTH = 10;

    public static final List<String> IMPORTANT_TERMS = List.of(
            "king", "queen", "prince", "princess", "duke", "lord", "lady",
            "knight", "warrior", "soldier", "priest", "monk", "nun",
            "magic", "spell", "potion", "dragon", "unicorn", "phoenix",
            "sword", "shield", "bow", "arrow", "armor", "helmet",
            "castle", "palace", "tower", "temple", "church", "throne");

    // shorter keys would match inside too many terms ("a" in "castle")
    private static final int MIN_REVERSE_MATCH_LENGTH = 3;

    private final int minNotesLength;

    public MissingNotesCheck() {
        this(DEFAULT_MIN_NOTES_LENGTH);
    }

    public MissingNotesCheck(int minNotesLength) {
        if (minNotesLength < 0) {
            throw new IllegalArgumentException("minNotesLength must be >= 0");
        }
        this.minNotesLength = minNotesLength;
    }

    @Override
    public AuditCheckType type() {
        return AuditCheckType.MISSING_NOTES;
    }

    @Override
    public List<AuditIssue> inspect(UnifiedDictionary dictionary) {
        List<AuditIssue> issues = new ArrayList<>();
        for (Entry entry : dictionary.entries()) {
            String notes = entry.getNotes();
            if (isImportant(entry.getEnglish()) && (notes == null || notes.trim().length() < minNotesLength)) {
                issues.add(AuditIssue.of(type(), "important_missing_notes", Severity.MEDIUM, entry,
                        "Important term \"" + entry.getEnglish() + "\" lacks sufficient notes",
                        "Add cultural or historical context"));
            }
        }
        return issues;
    }

    static boolean isImportant(String english) {
        String word = english.toLowerCase(Locale.ROOT);
        for (String term : IMPORTANT_TERMS) {
            if (word.contains(term) || (word.length() >= MIN_REVERSE_MATCH_LENGTH && term.contains(word))) {
                return true;
            }
        }
        return false;
    }
}
