package com.liveclass.server.room;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomRegistryTest {

    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry();
    }

    @Test
    void joinCreatesRoomAndCountsMembers() {
        assertThat(registry.contains("R1")).isFalse();
        assertThat(registry.join("R1", "a")).isEqualTo(1);
        assertThat(registry.join("R1", "b")).isEqualTo(2);
        assertThat(registry.join("R1", "b")).isEqualTo(2);
        assertThat(registry.members("R1")).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void leavingLastMemberDeletesRoom() {
        registry.join("R1", "a");
        registry.join("R1", "b");

        assertThat(registry.leave("R1", "a")).isEqualTo(1);
        assertThat(registry.leave("R1", "b")).isZero();
        assertThat(registry.contains("R1")).isFalse();
        assertThat(registry.members("R1")).isEmpty();
    }

    @Test
    void leaveIsNeverNegative() {
        assertThat(registry.leave("missing", "a")).isZero();

        registry.join("R1", "a");
        assertThat(registry.leave("R1", "stranger")).isEqualTo(1);
        assertThat(registry.leave("R1", "a")).isZero();
        assertThat(registry.leave("R1", "a")).isZero();
    }

    @Test
    void membersIsSnapshot() {
        registry.join("R1", "a");
        Set<String> snapshot = registry.members("R1");
        registry.join("R1", "b");

        assertThat(snapshot).containsExactly("a");
        assertThatThrownBy(() -> snapshot.add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void forEachRoomContainingAllowsLeaveDuringIteration() {
        registry.join("R1", "a");
        registry.join("R2", "a");
        registry.join("R2", "b");
        registry.join("R3", "b");

        List<String> visited = new ArrayList<>();
        registry.forEachRoomContaining("a", roomId -> {
            visited.add(roomId);
            registry.leave(roomId, "a");
        });

        assertThat(visited).containsExactlyInAnyOrder("R1", "R2");
        assertThat(registry.contains("R1")).isFalse();
        assertThat(registry.members("R2")).containsExactly("b");
        assertThat(registry.members("R3")).containsExactly("b");
    }

    @Test
    void removeDropsRoomWithMembers() {
        registry.join("R1", "a");
        registry.remove("R1");
        assertThat(registry.contains("R1")).isFalse();
        assertThat(registry.size("R1")).isZero();
    }

    @Test
    void sizeTracksJoinsMinusLeavesOverRandomSequences() {
        Random random = new Random(42);
        Set<String> expected = new HashSet<>();

        for (int i = 0; i < 2_000; i++) {
            String handle = "s" + random.nextInt(20);
            int size;
            if (random.nextBoolean()) {
                size = registry.join("R", handle);
                expected.add(handle);
            } else {
                size = registry.leave("R", handle);
                expected.remove(handle);
            }
            assertThat(size).isEqualTo(expected.size()).isNotNegative();
            assertThat(registry.size("R")).isEqualTo(expected.size());
            assertThat(registry.contains("R")).isEqualTo(!expected.isEmpty());
        }
    }
}
