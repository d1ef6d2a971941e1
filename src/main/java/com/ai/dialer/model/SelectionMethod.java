package com.ai.dialer.model;

/**
 * How the caller ID of a single dial was chosen.
 */
public enum SelectionMethod {
    MANUAL,
    LOCAL_PRESENCE,
    PRIMARY_FALLBACK,
    PRIMARY,
    SYSTEM_DEFAULT
}
