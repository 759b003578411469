package warden.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BasicAuthHeader")
class BasicAuthHeaderTest {

    @Test
    @DisplayName("should decode username and password")
    void shouldDecode() {
        var credentials = BasicAuthHeader.decode(BasicAuthHeader.encode("admin", "pa:ss")).orElseThrow();

        assertEquals("admin", credentials.username());
        assertEquals("pa:ss", credentials.password());
    }

    @Test
    @DisplayName("should reject other schemes")
    void shouldRejectOtherSchemes() {
        assertTrue(BasicAuthHeader.decode("Bearer abc").isEmpty());
        assertTrue(BasicAuthHeader.decode(null).isEmpty());
    }

    @Test
    @DisplayName("should reject malformed payloads")
    void shouldRejectMalformed() {
        assertTrue(BasicAuthHeader.decode("Basic !!!").isEmpty());
        // "nocolon"
        assertTrue(BasicAuthHeader.decode("Basic bm9jb2xvbg==").isEmpty());
    }
}
