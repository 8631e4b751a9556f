package io.github.cyfko.entityql.core.exception;

import io.github.cyfko.entityql.core.model.QueryOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StoreException Tests")
class StoreExceptionTest {

    @Test
    @DisplayName("Untagged until the executor tags it")
    void untagged() {
        assertNull(new StoreException("down").getOperation());
    }

    @Test
    @DisplayName("taggedWith keeps message, cause and stack trace")
    void tagging() {
        RuntimeException cause = new RuntimeException("socket closed");
        StoreException original = new StoreException("down", cause);

        StoreException tagged = original.taggedWith(QueryOperation.FIND_ONE);

        assertEquals(QueryOperation.FIND_ONE, tagged.getOperation());
        assertEquals("down", tagged.getMessage());
        assertSame(cause, tagged.getCause());
        assertArrayEquals(original.getStackTrace(), tagged.getStackTrace());
    }

    @Test
    @DisplayName("The first tag wins")
    void firstTagWins() {
        StoreException tagged = new StoreException("down").taggedWith(QueryOperation.COUNT_ALL);

        assertSame(tagged, tagged.taggedWith(QueryOperation.FIND_ALL));
        assertEquals(QueryOperation.COUNT_ALL, tagged.getOperation());
    }
}
