package com.libran.dictionary.lock;

import com.libran.dictionary.core.DictionaryPipelineException;

/**
 * Thrown when a run lock cannot be acquired, i.e. another run is in progress.
 */
public class LockAcquisitionException extends DictionaryPipelineException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
