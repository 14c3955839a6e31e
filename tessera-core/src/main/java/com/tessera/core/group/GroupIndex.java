package com.tessera.core.group;

import java.util.Arrays;

/**
 * Shared cell to group lookup. Stores packed {@link GroupHandle} values; empty cells hold
 * {@link GroupHandle#NONE}.
 */
public final class GroupIndex {

    private final int[] handles;

    public GroupIndex(int cellCount) {
        this.handles = new int[cellCount];
    }

    private GroupIndex(int[] handles) {
        this.handles = handles;
    }

    /**
     * Returns the handle of the group owning the cell, or {@code null} if none is recorded.
     */
    public GroupHandle handleAt(int cell) {
        return GroupHandle.unpack(handles[cell]);
    }

    public void assign(int cell, GroupHandle handle) {
        handles[cell] = handle.pack();
    }

    /**
     * Points every member cell of {@code group} at {@code handle}.
     */
    public void assignMembers(Group group, GroupHandle handle) {
        int packed = handle.pack();
        for (int cell : group.members()) {
            handles[cell] = packed;
        }
    }

    public void clear(int cell) {
        handles[cell] = GroupHandle.NONE;
    }

    public int cellCount() {
        return handles.length;
    }

    public GroupIndex copy() {
        return new GroupIndex(handles.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupIndex)) {
            return false;
        }
        return Arrays.equals(handles, ((GroupIndex) o).handles);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(handles);
    }
}
