package com.libran.dictionary.lifecycle;

/**
 * Physical area a fragment lives in. Several lifecycle states share the MERGED area.
 */
public enum FragmentArea {
    PENDING,
    MERGED,
    DELETED
}
