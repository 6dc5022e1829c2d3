package com.phiprotection.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifier of a newly created patient record or visit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordCreatedResponse {

    private String id;
}
