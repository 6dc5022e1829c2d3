package com.phiprotection.application;

/**
 * Search hit: identifiers only, never decrypted content.
 */
public record RecordSummary(String id, String recordNumber) {
}
