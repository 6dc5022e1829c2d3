package com.phiprotection.domain.model;

import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.util.Objects;

/**
 * A plaintext string that came out of a sensitive field.
 *
 * <p>String conversion always yields {@code [REDACTED]}, so the value cannot reach a log line
 * through concatenation or a placeholder. {@link #reveal(String)} is the only way to read it.
 */
@Slf4j
public final class SensitiveValue {

    private static final String REDACTED = "[REDACTED]";

    private final PhiField field;
    private final String value;

    private SensitiveValue(PhiField field, String value) {
        this.field = Objects.requireNonNull(field, "Field cannot be null");
        this.value = value;
    }

    public static SensitiveValue of(PhiField field, String value) {
        return new SensitiveValue(field, value);
    }

    public String reveal(String purpose) {
        if (purpose == null || purpose.isBlank()) {
            throw new IllegalArgumentException("A purpose is required to reveal a sensitive value");
        }
        log.debug("Sensitive value revealed: field={}, purpose={}", field.getJsonName(), Encode.forJava(purpose));
        return value;
    }

    @Override
    public String toString() {
        return REDACTED;
    }
}
