package com.libran.dictionary.core;

/**
 * Base runtime exception for failures of the dictionary build pipeline.
 */
public class DictionaryPipelineException extends RuntimeException {

    public DictionaryPipelineException(String message) {
        super(message);
    }

    public DictionaryPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
