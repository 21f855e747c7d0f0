package warden.core.util;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@code application/x-www-form-urlencoded} encoding and query-string parsing.
 */
public final class FormEncoding {

    private FormEncoding() {}

    public static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    public static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Parse a raw query string. The first occurrence of a repeated name wins;
     * a name without {@code =} maps to the empty string.
     */
    public static Map<String, String> parseQuery(String rawQuery) {
        final var result = new LinkedHashMap<String, String>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return result;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            final var idx = pair.indexOf('=');
            final var name = decode(idx >= 0 ? pair.substring(0, idx) : pair);
            final var value = idx >= 0 ? decode(pair.substring(idx + 1)) : "";
            result.putIfAbsent(name, value);
        }
        return result;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
