package warden.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PasswordHash")
class PasswordHashTest {

    @Test
    @DisplayName("should produce a 50-byte hex digest")
    void shouldProduceFixedLength() {
        assertEquals(100, PasswordHash.encode("secret", "salt").length());
    }

    @Test
    @DisplayName("should depend on the salt")
    void shouldDependOnSalt() {
        assertNotEquals(PasswordHash.encode("secret", "a"), PasswordHash.encode("secret", "b"));
    }

    @Test
    @DisplayName("should match only the original password")
    void shouldMatchOriginal() {
        var encoded = PasswordHash.encode("secret", "salt");

        assertTrue(PasswordHash.matches("secret", "salt", encoded));
        assertFalse(PasswordHash.matches("Secret", "salt", encoded));
        assertFalse(PasswordHash.matches("secret", "salt", null));
    }

    @Test
    @DisplayName("should fail for an empty salt")
    void shouldFailForEmptySalt() {
        assertThrows(IllegalStateException.class, () -> PasswordHash.encode("secret", ""));
    }
}
