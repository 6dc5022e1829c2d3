package com.phiprotection.infrastructure.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phiprotection.domain.model.PhiField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Encrypts and decrypts the sensitive fields of nested JSON records.
 *
 * <p>Traversal rules, applied at every depth:
 * <ul>
 *   <li>a selected field holding a string is transformed</li>
 *   <li>a selected field holding an array has its string elements transformed and its
 *       object or array elements walked with the same field set</li>
 *   <li>a selected field holding an object is walked</li>
 *   <li>numbers, booleans and nulls are never transformed</li>
 *   <li>every other field passes through untouched</li>
 * </ul>
 *
 * <p>Inputs are never mutated; each operation works on a deep copy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PhiObjectCipher {

    public static final String ENCRYPTED_STAMP = "_encrypted";
    public static final String ENCRYPTED_AT_STAMP = "_encryptedAt";

    private final CryptoService cryptoService;
    private final Clock clock;

    public ObjectNode encryptObject(ObjectNode record) {
        return encryptObject(record, PhiField.all());
    }

    public ObjectNode encryptObject(ObjectNode record, Set<PhiField> fields) {
        Objects.requireNonNull(record, "Record cannot be null");
        ObjectNode copy = record.deepCopy();
        transformObject(copy, fields, cryptoService::encryptValue);
        copy.put(ENCRYPTED_STAMP, true);
        copy.put(ENCRYPTED_AT_STAMP, clock.instant().toString());
        return copy;
    }

    public ObjectNode decryptObject(ObjectNode record) {
        return decryptObject(record, PhiField.all());
    }

    public ObjectNode decryptObject(ObjectNode record, Set<PhiField> fields) {
        Objects.requireNonNull(record, "Record cannot be null");
        ObjectNode copy = record.deepCopy();
        transformObject(copy, fields, cryptoService::decryptValue);
        copy.remove(ENCRYPTED_STAMP);
        copy.remove(ENCRYPTED_AT_STAMP);
        return copy;
    }

    /**
     * Decrypt only the allow-listed fields. The stamps stay because the result is still
     * partly encrypted.
     */
    public ObjectNode partialDecrypt(ObjectNode record, Set<PhiField> allowList) {
        Objects.requireNonNull(record, "Record cannot be null");
        ObjectNode copy = record.deepCopy();
        transformObject(copy, allowList, cryptoService::decryptValue);
        return copy;
    }

    public boolean isEncrypted(JsonNode record) {
        if (record == null || !record.isObject()) {
            return false;
        }
        JsonNode stamp = record.get(ENCRYPTED_STAMP);
        return stamp != null && stamp.isBoolean() && stamp.booleanValue();
    }

    private void transformObject(ObjectNode node, Set<PhiField> fields, UnaryOperator<String> transform) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);

        for (String name : names) {
            JsonNode child = node.get(name);
            boolean selected = PhiField.fromJsonName(name).map(fields::contains).orElse(false);

            if (selected) {
                node.set(name, transformSelected(child, fields, transform));
            } else if (child.isObject()) {
                transformObject((ObjectNode) child, fields, transform);
            } else if (child.isArray()) {
                walkArray((ArrayNode) child, fields, transform);
            }
        }
    }

    private JsonNode transformSelected(JsonNode value, Set<PhiField> fields, UnaryOperator<String> transform) {
        if (value.isTextual()) {
            return textOrNull(transform.apply(value.textValue()));
        }
        if (value.isArray()) {
            ArrayNode array = (ArrayNode) value;
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                if (element.isTextual()) {
                    array.set(i, textOrNull(transform.apply(element.textValue())));
                } else if (element.isObject()) {
                    transformObject((ObjectNode) element, fields, transform);
                } else if (element.isArray()) {
                    array.set(i, transformSelected(element, fields, transform));
                }
            }
            return array;
        }
        if (value.isObject()) {
            transformObject((ObjectNode) value, fields, transform);
        }
        return value;
    }

    private void walkArray(ArrayNode array, Set<PhiField> fields, UnaryOperator<String> transform) {
        for (JsonNode element : array) {
            if (element.isObject()) {
                transformObject((ObjectNode) element, fields, transform);
            } else if (element.isArray()) {
                walkArray((ArrayNode) element, fields, transform);
            }
        }
    }

    private static JsonNode textOrNull(String value) {
        return value == null ? JsonNodeFactory.instance.nullNode() : JsonNodeFactory.instance.textNode(value);
    }
}
