package org.Aayush.redirects.table;

/**
 * How strictly a persisted table is checked while loading.
 */
public enum LoadMode {
    /**
     * Encoded entries and duplicate sources are fatal; documents are checked.
     */
    STRICT,
    /**
     * Encoded entries and duplicate sources are logged and dropped; only URL shape is checked.
     * Used for tables about to be repaired and for building the resolution cache.
     */
    RELAXED
}
