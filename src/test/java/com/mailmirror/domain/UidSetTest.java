package com.mailmirror.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UidSet unit tests
 */
class UidSetTest {

    @Test
    @DisplayName("Contiguous UIDs compress to ranges regardless of insertion order")
    void testToString_Ranges() {
        UidSet uids = new UidSet().add(9).add(2).add(1).add(10).add(3).add(7);

        assertThat(uids.toString()).isEqualTo("1:3,7,9:10");
        assertThat(uids.size()).isEqualTo(6);
    }

    @Test
    @DisplayName("Single UID and duplicates")
    void testToString_Single() {
        UidSet uids = new UidSet().add(42).add(42);

        assertThat(uids.toString()).isEqualTo("42");
        assertThat(uids.size()).isEqualTo(1);
        assertThat(uids.contains(42)).isTrue();
    }

    @Test
    @DisplayName("Empty set")
    void testEmpty() {
        UidSet uids = new UidSet();

        assertThat(uids.isEmpty()).isTrue();
        assertThat(uids.toString()).isEmpty();
    }

    @Test
    @DisplayName("UIDs are unsigned 32-bit, zero is not a UID")
    void testAdd_Range() {
        assertThat(new UidSet().add(UidSet.MAX_UID).toString()).isEqualTo("4294967295");
        assertThatThrownBy(() -> new UidSet().add(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UidSet().add(UidSet.MAX_UID + 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
