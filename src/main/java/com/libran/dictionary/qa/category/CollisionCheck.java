package com.libran.dictionary.qa.category;

import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.qa.CategoryResult;
import com.libran.dictionary.qa.HomonymPolicy;
import com.libran.dictionary.qa.QaCategory;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaIssue;
import com.libran.dictionary.qa.SemanticGroupHomonymPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Flags every pair of entries that share an Ancient or a Modern surface form but have
 * different English meanings, unless the {@link HomonymPolicy} justifies the pair.
 * The check is symmetric: a pair is reported once regardless of entry order.
 */
public class CollisionCheck implements QaCategory {

    static final double PENALTY = 2.0;

    private final HomonymPolicy homonymPolicy;

    public CollisionCheck() {
        this(new SemanticGroupHomonymPolicy());
    }

    public CollisionCheck(HomonymPolicy homonymPolicy) {
        this.homonymPolicy = Objects.requireNonNull(homonymPolicy, "homonymPolicy is required");
    }

    @Override
    public QaCategoryType type() {
        return QaCategoryType.COLLISION;
    }

    @Override
    public CategoryResult evaluate(UnifiedDictionary dictionary) {
        List<QaIssue> issues = new ArrayList<>();
        collect(dictionary.entries(), Entry::ancientSurface, "ancient_collision", "Ancient", issues);
        collect(dictionary.entries(), Entry::modernSurface, "modern_collision", "Modern", issues);
        return CategoryResult.penalized(type(), issues, PENALTY, issues.size() + " collisions found");
    }

    private void collect(List<Entry> entries, Function<Entry, String> surface, String code, String variant,
                         List<QaIssue> issues) {
        Map<String, List<Entry>> groups = new LinkedHashMap<>();
        for (Entry entry : entries) {
            String form = surface.apply(entry);
            if (form != null && !form.isBlank()) {
                groups.computeIfAbsent(form, k -> new ArrayList<>()).add(entry);
            }
        }
        for (Map.Entry<String, List<Entry>> group : groups.entrySet()) {
            List<Entry> members = group.getValue();
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    Entry a = members.get(i);
                    Entry b = members.get(j);
                    if (a.dedupKey().equals(b.dedupKey())
                            || homonymPolicy.isJustified(a.getEnglish(), b.getEnglish())) {
                        continue;
                    }
                    issues.add(new QaIssue(type(), code, group.getKey(),
                            variant + " form \"" + group.getKey() + "\" shared by \"" + a.getEnglish()
                                    + "\" and \"" + b.getEnglish() + "\""));
                }
            }
        }
    }
}
