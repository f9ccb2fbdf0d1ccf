package com.libran.dictionary.merge;

import com.libran.dictionary.core.DictionaryPipelineException;

/**
 * Thrown when a merge finds no fragment that could be parsed.
 * Raised before any fragment is relocated.
 */
public class NoValidFragmentsException extends DictionaryPipelineException {

    public NoValidFragmentsException(String message) {
        super(message);
    }
}
