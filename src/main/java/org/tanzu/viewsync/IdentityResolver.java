package org.tanzu.viewsync;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.tanzu.viewsync.config.ViewSyncProperties;

/**
 * Resolves session and user identity for a request.
 * Precedence: explicit request field, then the {@code x-session-id} / {@code x-user-id} header,
 * then the configured default. Blank values count as absent.
 *
 * Identifiers are taken as supplied; nothing here proves the caller may use them.
 */
@Component
public class IdentityResolver {

    public static final String SESSION_HEADER = "x-session-id";
    public static final String USER_HEADER = "x-user-id";

    private final ViewSyncProperties properties;

    public IdentityResolver(ViewSyncProperties properties) {
        this.properties = properties;
    }

    public String resolveSessionId(String explicitValue, String headerValue) {
        return firstPresent(explicitValue, headerValue, properties.getDefaultSessionId());
    }

    public String resolveUserId(String explicitValue, String headerValue) {
        return firstPresent(explicitValue, headerValue, properties.getDefaultUserId());
    }

    /**
     * Reads an identifier field from a request body. Strings are taken as-is and numbers in their
     * JSON text form; anything else, or a missing body or field, yields null.
     */
    public static String textField(JsonNode body, String field) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode value = body.get(field);
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        return value.isNumber() ? value.asText() : null;
    }

    private static String firstPresent(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }
}
