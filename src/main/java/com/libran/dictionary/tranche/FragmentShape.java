package com.libran.dictionary.tranche;

/**
 * The fragment layouts the parser understands. Detection happens once, in
 * {@link TrancheParser#detectShape}; every later stage sees only canonical entries.
 */
public enum FragmentShape {
    /** {@code {"hello": "salaam"}} - English key to a single form of the default variant. */
    FLAT_MAP,
    /** {@code {"hello": {"ancient": "...", "modern": "...", "notes": "..."}}} */
    KEYED_ENTRIES,
    /** {@code [{"english": "hello", ...}]} */
    ENTRY_LIST,
    /** {@code {"data": [{"english": "hello", ...}]}} */
    DATA_WRAPPER,
    /** {@code {"sections": {"Name": {"data": [...], "files": [{"data": [...]}]}}}} */
    SECTIONED,
    /** {@code {"clusters": {"Name": {"ancient": [...], "modern": [...], "commentary": "..."}}}} */
    CLUSTERED
}
