package com.vidnyan.semtree.domain.build;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeySanitizerTest {

    @Test
    void sanitize_ShouldKeepValidNames() {
        assertEquals("name", KeySanitizer.sanitize("name"));
        assertEquals("spring.datasource-url_2", KeySanitizer.sanitize("spring.datasource-url_2"));
        assertTrue(KeySanitizer.isValidName("_private"));
    }

    @Test
    void sanitize_ShouldReplaceCharactersThatCannotAppearInNames() {
        assertEquals("my_key", KeySanitizer.sanitize("my key"));
        assertEquals("a_b_", KeySanitizer.sanitize("a/b?"));
        assertFalse(KeySanitizer.isValidName("my key"));
    }

    @Test
    void sanitize_ShouldPrefixKeysThatDoNotStartWithALetter() {
        assertEquals("_8080", KeySanitizer.sanitize("8080"));
        assertEquals("_-x", KeySanitizer.sanitize("-x"));
        assertEquals("__", KeySanitizer.sanitize("$"));
    }

    @Test
    void sanitize_ShouldMapEmptyKeysToUnderscore() {
        assertEquals("_", KeySanitizer.sanitize(""));
        assertEquals("_", KeySanitizer.sanitize(null));
        assertFalse(KeySanitizer.isValidName(""));
    }
}
