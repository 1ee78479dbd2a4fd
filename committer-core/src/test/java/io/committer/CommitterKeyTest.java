package io.committer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommitterKeyTest {

    @Test
    void toStringNamesTopicPartitionAndId() {
        assertEquals("orders-3#1", new CommitterKey("orders", 3, 1).toString());
    }

    @Test
    void rejectsBlankTopic() {
        assertThrows(IllegalArgumentException.class, () -> new CommitterKey(" ", 0, 0));
        assertThrows(NullPointerException.class, () -> new CommitterKey(null, 0, 0));
    }

    @Test
    void rejectsNegativePartitionOrId() {
        assertThrows(IllegalArgumentException.class, () -> new CommitterKey("t", -1, 0));
        assertThrows(IllegalArgumentException.class, () -> new CommitterKey("t", 0, -1));
    }
}
