package com.vaultrebalancer.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/**
 * Barbell bucket of a recommended vault. HIGH receives the majority share of capital,
 * LOW the minority share; each share is divided evenly within its bucket.
 */
public enum ConfidenceBucket {
    HIGH,
    LOW;

    /** The ranking service sends lowercase values ("high" / "low"). */
    @JsonCreator
    public static ConfidenceBucket fromValue(String value) {
        if (value == null) {
            return null;
        }
        return ConfidenceBucket.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
