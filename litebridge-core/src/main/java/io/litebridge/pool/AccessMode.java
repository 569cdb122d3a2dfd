package io.litebridge.pool;

/**
 * Declared intent of a pool submission; decides which actor runs it.
 */
public enum AccessMode {
    /** Rotated across the reader actors. */
    READ,
    /** Always sent to the single writer actor. */
    WRITE
}
