package warden.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FormEncoding")
class FormEncodingTest {

    @Test
    @DisplayName("should encode parameters in insertion order")
    void encode() {
        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", "authorization_code");
        params.put("redirect_uri", "http://127.0.0.1/callback");
        params.put("scope", "read write");

        assertEquals(
                "grant_type=authorization_code&redirect_uri=http%3A%2F%2F127.0.0.1%2Fcallback&scope=read+write",
                FormEncoding.encode(params));
    }

    @Test
    @DisplayName("should decode a query string keeping the first value")
    void parseQuery() {
        final var params = FormEncoding.parseQuery("code=a%2Bb&state=xyz&flag&state=other");

        assertEquals(Map.of("code", "a+b", "state", "xyz", "flag", ""), params);
    }

    @Test
    @DisplayName("should return an empty map for a missing query")
    void emptyQuery() {
        assertTrue(FormEncoding.parseQuery(null).isEmpty());
        assertTrue(FormEncoding.parseQuery("").isEmpty());
    }
}
