package com.liveclass.server.dao;

import com.liveclass.server.model.Role;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryPresenceStoreTest {

    @Test
    void rejoinEvictsPreviousHandle() {
        InMemoryPresenceStore store = new InMemoryPresenceStore();
        store.upsertParticipant("u1", "old", "Ann", "R1", Role.STUDENT);
        store.upsertParticipant("u2", "b", "Bob", "R1", Role.STUDENT);
        store.upsertParticipant("u1", "new", "Ann", "R1", Role.STUDENT);

        assertThat(store.getParticipant("old")).isEmpty();
        assertThat(store.listParticipants(List.of("old", "b", "new"))).hasSize(2);
        assertThat(store.renameParticipant("old", "x")).isFalse();
        assertThat(store.renameParticipant("new", "Annie")).isTrue();
    }
}
