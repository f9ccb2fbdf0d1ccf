package com.libran.dictionary.qa;

import com.libran.dictionary.core.model.UnifiedDictionary;

/**
 * A QA category. Implementations must be pure functions of the dictionary snapshot so that
 * categories can be evaluated in any order or in parallel.
 */
public interface QaCategory {

    QaCategoryType type();

    CategoryResult evaluate(UnifiedDictionary dictionary);
}
