package io.litebridge;

import java.util.Set;

/**
 * SQLite {@code sqlite3_open_v2} flags. The bit values are passed through untouched to
 * the driver's {@code open_mode} property.
 */
public enum OpenFlag {
    READ_ONLY(0x00000001),
    READ_WRITE(0x00000002),
    CREATE(0x00000004),
    URI(0x00000040),
    MEMORY(0x00000080),
    NO_MUTEX(0x00008000),
    FULL_MUTEX(0x00010000),
    SHARED_CACHE(0x00020000),
    PRIVATE_CACHE(0x00040000),
    NO_FOLLOW(0x01000000);

    private final int bits;

    OpenFlag(int bits) {
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    /**
     * Combines flags into the bitmask expected by the engine.
     *
     * @param flags the flags to combine
     * @return the OR of all flag bits, {@code 0} for an empty set
     */
    public static int toMask(Set<OpenFlag> flags) {
        int mask = 0;
        for (OpenFlag flag : flags) {
            mask |= flag.bits;
        }
        return mask;
    }
}
