package com.libran.dictionary.core;

/**
 * Thrown when a reference data source (baseline snapshot, exclusion list)
 * exists but cannot be read or parsed.
 */
public class ReferenceDataException extends DictionaryPipelineException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
