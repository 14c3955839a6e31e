package com.tessera.core.group;

import com.tessera.core.InvariantViolationException;
import com.tessera.core.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-capacity store of the groups controlled by one player. Slots are handed out by a
 * monotonically increasing cursor and are never reused; removing a group only marks its slot dead.
 * The capacity equals the player's hand size, since a slot is only allocated when a placed tile
 * starts a new group.
 */
public final class GroupArena {

    private final Player owner;
    private final Group[] slots;
    private final boolean[] live;
    private int cursor;
    private int liveCount;

    public GroupArena(Player owner, int capacity) {
        this.owner = Objects.requireNonNull(owner, "owner");
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1: " + capacity);
        }
        this.slots = new Group[capacity];
        this.live = new boolean[capacity];
    }

    private GroupArena(GroupArena source) {
        this.owner = source.owner;
        this.slots = new Group[source.slots.length];
        this.live = source.live.clone();
        this.cursor = source.cursor;
        this.liveCount = source.liveCount;
        for (int slot = 0; slot < cursor; slot++) {
            if (live[slot]) {
                slots[slot] = source.slots[slot].copy();
            }
        }
    }

    public Player owner() {
        return owner;
    }

    public int capacity() {
        return slots.length;
    }

    /**
     * Returns the number of slots allocated so far, dead ones included.
     */
    public int allocated() {
        return cursor;
    }

    public int liveCount() {
        return liveCount;
    }

    /**
     * Stores a new group in the next free slot.
     *
     * @throws InvariantViolationException if every slot has already been allocated
     */
    public GroupHandle insert(Group group) {
        Objects.requireNonNull(group, "group");
        if (cursor == slots.length) {
            throw new InvariantViolationException(InvariantViolationException.Kind.ARENA_EXHAUSTED,
                    "Group arena of " + owner + " exhausted after " + cursor + " allocations");
        }
        int slot = cursor++;
        slots[slot] = group;
        live[slot] = true;
        liveCount++;
        return new GroupHandle(slot, owner);
    }

    /**
     * Resolves a handle. Returns an empty result for {@code null}, for handles of the other player's
     * arena and for dead or never allocated slots.
     */
    public Optional<Group> get(GroupHandle handle) {
        if (!isLive(handle)) {
            return Optional.empty();
        }
        return Optional.of(slots[handle.slot()]);
    }

    /**
     * Marks the slot dead and returns the final state of its group.
     */
    public Optional<Group> remove(GroupHandle handle) {
        if (!isLive(handle)) {
            return Optional.empty();
        }
        int slot = handle.slot();
        Group group = slots[slot];
        slots[slot] = null;
        live[slot] = false;
        liveCount--;
        return Optional.of(group);
    }

    public boolean isLive(GroupHandle handle) {
        return handle != null
                && handle.owner() == owner
                && handle.slot() < cursor
                && live[handle.slot()];
    }

    /**
     * Returns the handles of all live groups in slot order.
     */
    public List<GroupHandle> liveHandles() {
        List<GroupHandle> handles = new ArrayList<>(liveCount);
        for (int slot = 0; slot < cursor; slot++) {
            if (live[slot]) {
                handles.add(new GroupHandle(slot, owner));
            }
        }
        return handles;
    }

    /**
     * Returns a deep copy; groups are copied, handles stay valid against the copy.
     */
    public GroupArena copy() {
        return new GroupArena(this);
    }
}
