package com.tessera.core.group;

import com.tessera.core.Player;
import java.util.Objects;

/**
 * Reference to a group slot inside the arena of {@link #owner()}. The packed form sets bit 0 as the
 * validity flag, bit 1 as the owner and the remaining bits as the slot, so the packed value zero
 * means "no group".
 */
public record GroupHandle(int slot, Player owner) {

    public static final int NONE = 0;

    private static final int VALID_BIT = 1;
    private static final int OWNER_SHIFT = 1;
    private static final int SLOT_SHIFT = 2;

    public GroupHandle {
        Objects.requireNonNull(owner, "owner");
        if (slot < 0) {
            throw new IllegalArgumentException("slot must not be negative: " + slot);
        }
    }

    public int pack() {
        return (slot << SLOT_SHIFT) | (owner.bit() << OWNER_SHIFT) | VALID_BIT;
    }

    /**
     * Decodes a packed handle, returning {@code null} for {@link #NONE}.
     */
    public static GroupHandle unpack(int packed) {
        if ((packed & VALID_BIT) == 0) {
            return null;
        }
        return new GroupHandle(packed >>> SLOT_SHIFT, Player.fromBit(packed >>> OWNER_SHIFT));
    }

    @Override
    public String toString() {
        return owner + "#" + slot;
    }
}
