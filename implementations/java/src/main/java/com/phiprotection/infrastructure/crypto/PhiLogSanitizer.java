package com.phiprotection.infrastructure.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phiprotection.domain.model.PhiField;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Redacts PHI-shaped content before it is written to operational (non-audit) logs.
 *
 * <p>Second line of defence behind {@link com.phiprotection.domain.model.SensitiveValue}:
 * it catches values that escaped typing, by shape and by key name.
 */
@Component
@RequiredArgsConstructor
public class PhiLogSanitizer {

    public static final String REDACTED = "[REDACTED]";
    public static final String ENCRYPTED_PLACEHOLDER = "[ENCRYPTED]";
    public static final String SSN_PLACEHOLDER = "[SSN-REDACTED]";
    public static final String PHONE_PLACEHOLDER = "[PHONE-REDACTED]";

    // 64 header bytes plus at least one ciphertext byte encode to 88+ characters
    private static final Pattern ENCRYPTED_BLOB = Pattern.compile("^[A-Za-z0-9+/]{86,}={0,2}$");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-?\\d{2}-?\\d{4}\\b");
    private static final Pattern PHONE = Pattern.compile(
        "(?:\\+?1[-.\\s]?)?\\(?\\b\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
    private static final List<String> SECRET_KEY_MARKERS = List.of("password", "secret", "token");

    private final ObjectMapper objectMapper;

    public String sanitizeForLogging(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 88 && ENCRYPTED_BLOB.matcher(trimmed).matches()) {
            return ENCRYPTED_PLACEHOLDER;
        }
        String redacted = SSN.matcher(value).replaceAll(SSN_PLACEHOLDER);
        return PHONE.matcher(redacted).replaceAll(PHONE_PLACEHOLDER);
    }

    public JsonNode sanitizeForLogging(JsonNode value) {
        if (value == null) {
            return null;
        }
        return sanitizeNode(value.deepCopy());
    }

    /**
     * Sanitize an arbitrary value for a log placeholder.
     */
    public String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return sanitizeForLogging((String) value);
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Enum) {
            return value.toString();
        }
        JsonNode tree = value instanceof JsonNode ? (JsonNode) value : objectMapper.valueToTree(value);
        return sanitizeForLogging(tree).toString();
    }

    private JsonNode sanitizeNode(JsonNode node) {
        if (node.isTextual()) {
            return JsonNodeFactory.instance.textNode(sanitizeForLogging(node.textValue()));
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, sanitizeNode(array.get(i)));
            }
            return array;
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (isRedactedKey(name)) {
                    object.put(name, REDACTED);
                } else {
                    object.set(name, sanitizeNode(object.get(name)));
                }
            }
            return object;
        }
        return node;
    }

    static boolean isRedactedKey(String name) {
        if (PhiField.isSensitiveKey(name)) {
            return true;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String marker : SECRET_KEY_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
