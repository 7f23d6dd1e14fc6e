package com.repo.quality.core;

import java.util.Locale;

/**
 * Source of an author's code change volume.
 */
public enum CodeChangeMode {
    /** Repository line totals prorated by the author's commit share */
    ESTIMATED,
    /** Lines actually inserted and deleted in the author's own commits */
    MEASURED;

    public static CodeChangeMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
