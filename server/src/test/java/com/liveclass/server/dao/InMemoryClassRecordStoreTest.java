package com.liveclass.server.dao;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryClassRecordStoreTest {

    @Test
    void knownCodesRejectOthersEmptySetAcceptsAll() {
        InMemoryClassRecordStore classes = new InMemoryClassRecordStore(Set.of("ABC"));
        classes.markClassLive("ABC");
        assertThat(classes.statusOf("ABC")).isEqualTo("live");
        assertThatThrownBy(() -> classes.markClassEnded("XYZ")).isInstanceOf(ClassRecordNotFoundException.class);

        InMemoryClassRecordStore open = new InMemoryClassRecordStore(Set.of());
        open.markClassEnded("XYZ");
        assertThat(open.statusOf("XYZ")).isEqualTo("ended");
    }
}
