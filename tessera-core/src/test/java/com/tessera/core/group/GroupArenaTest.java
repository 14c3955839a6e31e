package com.tessera.core.group;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tessera.core.InvariantViolationException;
import com.tessera.core.Player;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupArenaTest {

    @Test
    void slotsAreNeverReused() {
        GroupArena arena = new GroupArena(Player.FIRST, 3);
        GroupHandle first = arena.insert(new Group(4));
        GroupHandle second = arena.insert(new Group(4));

        assertTrue(arena.remove(first).isPresent());
        GroupHandle third = arena.insert(new Group(4));

        assertEquals(0, first.slot());
        assertEquals(1, second.slot());
        assertEquals(2, third.slot());
        assertEquals(3, arena.allocated());
        assertEquals(2, arena.liveCount());
        assertEquals(List.of(second, third), arena.liveHandles());
    }

    @Test
    void exhaustedArenaReportsInvariantViolation() {
        GroupArena arena = new GroupArena(Player.SECOND, 1);
        arena.remove(arena.insert(new Group(4)));

        InvariantViolationException ex = assertThrows(InvariantViolationException.class,
                () -> arena.insert(new Group(4)));
        assertSame(InvariantViolationException.Kind.ARENA_EXHAUSTED, ex.getKind());
    }

    @Test
    void staleAndForeignHandlesResolveToNothing() {
        GroupArena arena = new GroupArena(Player.FIRST, 4);
        GroupHandle handle = arena.insert(new Group(4));

        assertTrue(arena.get(handle).isPresent());
        assertFalse(arena.get(new GroupHandle(0, Player.SECOND)).isPresent());
        assertFalse(arena.get(new GroupHandle(3, Player.FIRST)).isPresent());
        assertFalse(arena.get(null).isPresent());

        arena.remove(handle);
        assertFalse(arena.isLive(handle));
        assertFalse(arena.get(handle).isPresent());
        assertFalse(arena.remove(handle).isPresent());
    }

    @Test
    void copyDuplicatesGroups() {
        GroupArena arena = new GroupArena(Player.FIRST, 2);
        Group group = new Group(4);
        group.markMember(0);
        GroupHandle handle = arena.insert(group);

        GroupArena copy = arena.copy();
        copy.get(handle).orElseThrow().markMember(1);
        copy.insert(new Group(4));

        assertEquals(1, arena.get(handle).orElseThrow().memberCount());
        assertEquals(2, copy.get(handle).orElseThrow().memberCount());
        assertEquals(1, arena.allocated());
        assertEquals(2, copy.allocated());
    }
}
