package com.ivamare.pgmq.client;

import com.ivamare.pgmq.exception.InvalidQueueNameException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class QueueNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"orders", "Orders_2024", "_q", "a", "123"})
    @DisplayName("should accept letters, digits and underscores")
    void shouldAcceptValidNames(String name) {
        assertEquals(name, QueueNames.validate(name));
        assertTrue(QueueNames.isValid(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"my-queue", "my queue", "q.name", "q;drop", "café", "q'"})
    @DisplayName("should reject names with other characters")
    void shouldRejectInvalidCharacters(String name) {
        InvalidQueueNameException ex = assertThrows(InvalidQueueNameException.class,
            () -> QueueNames.validate(name));
        assertEquals(name, ex.getQueueName());
        assertFalse(QueueNames.isValid(name));
    }

    @Test
    @DisplayName("should reject null and empty names")
    void shouldRejectEmpty() {
        assertThrows(InvalidQueueNameException.class, () -> QueueNames.validate(null));
        assertThrows(InvalidQueueNameException.class, () -> QueueNames.validate(""));
        assertFalse(QueueNames.isValid(null));
        assertFalse(QueueNames.isValid(""));
    }

    @Test
    @DisplayName("should enforce the maximum length")
    void shouldEnforceMaxLength() {
        String longest = "q".repeat(QueueNames.MAX_LENGTH);
        String tooLong = longest + "q";

        assertEquals(longest, QueueNames.validate(longest));
        InvalidQueueNameException ex = assertThrows(InvalidQueueNameException.class,
            () -> QueueNames.validate(tooLong));
        assertTrue(ex.getMessage().contains("at most 47"));
    }
}
