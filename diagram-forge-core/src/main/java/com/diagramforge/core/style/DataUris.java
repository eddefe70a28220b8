package com.diagramforge.core.style;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Converts {@code data:} URIs to and from the form draw.io stores in a style string.
 *
 * <p>A style value cannot contain {@code ;}, so an image URI such as
 * {@code data:image/png;base64,iVBOR...} is written as {@code data:image/png,iVBOR...}: media type
 * parameters are dropped and the payload is always base64. Reading restores the
 * {@code ;base64} marker. Any other value passes through unchanged.
 */
public final class DataUris {

    private static final String SCHEME = "data:";
    private static final String BASE64_PARAM = ";base64";

    private DataUris() {
    }

    /**
     * Rewrites a URI into its style-safe form.
     *
     * @param uri image source, may be {@code null}
     * @return value safe to store in a style string
     */
    public static String toStyleValue(String uri) {
        int comma = dataComma(uri);
        if (comma < 0) {
            return uri;
        }
        String header = uri.substring(SCHEME.length(), comma);
        String payload = uri.substring(comma + 1);
        int semicolon = header.indexOf(';');
        String mediaType = semicolon < 0 ? header : header.substring(0, semicolon);
        if (!header.endsWith(BASE64_PARAM)) {
            String decoded = URLDecoder.decode(payload.replace("+", "%2B"), StandardCharsets.UTF_8);
            payload = Base64.getEncoder().encodeToString(decoded.getBytes(StandardCharsets.UTF_8));
        }
        return SCHEME + mediaType + "," + payload;
    }

    /**
     * Restores a URI read back from a style string.
     *
     * @param value style value, may be {@code null}
     * @return full {@code data:} URI, or the value unchanged when it is not one
     */
    public static String fromStyleValue(String value) {
        int comma = dataComma(value);
        if (comma < 0 || value.substring(0, comma).contains(";")) {
            return value;
        }
        return value.substring(0, comma) + BASE64_PARAM + value.substring(comma);
    }

    private static int dataComma(String value) {
        if (value == null || !value.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            return -1;
        }
        return value.indexOf(',');
    }
}
