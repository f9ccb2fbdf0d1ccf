package com.libran.dictionary.tranche;

import com.libran.dictionary.core.DictionaryPipelineException;

/**
 * Thrown when a single fragment cannot be parsed into entries.
 * The merger treats it as non-fatal and skips the fragment.
 */
public class FragmentParseException extends DictionaryPipelineException {

    private final String fragmentName;

    public FragmentParseException(String fragmentName, String message) {
        super(fragmentName + ": " + message);
        this.fragmentName = fragmentName;
    }

    public FragmentParseException(String fragmentName, String message, Throwable cause) {
        super(fragmentName + ": " + message, cause);
        this.fragmentName = fragmentName;
    }

    public String getFragmentName() {
        return fragmentName;
    }
}
