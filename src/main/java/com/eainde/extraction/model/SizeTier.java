package com.eainde.extraction.model;

/**
 * Document size class, decided once per run from the character count.
 */
public enum SizeTier {
    SMALL,
    MEDIUM,
    LARGE
}
