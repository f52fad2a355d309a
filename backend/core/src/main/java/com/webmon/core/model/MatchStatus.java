package com.webmon.core.model;

// Stored by ordinal, so constants may only be appended.
public enum MatchStatus {
    NOT_MATCHED,
    MATCHED,
    NOT_APPLICABLE
}
