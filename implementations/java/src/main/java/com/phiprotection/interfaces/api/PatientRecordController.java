package com.phiprotection.interfaces.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phiprotection.application.AuthorizationContextProvider;
import com.phiprotection.application.RecordSummary;
import com.phiprotection.application.SecurePatientService;
import com.phiprotection.config.OpenApiConfiguration;
import com.phiprotection.domain.model.PhiField;
import com.phiprotection.infrastructure.security.AccessKernel;
import com.phiprotection.infrastructure.security.AuthorizationContext;
import com.phiprotection.interfaces.api.dto.ErrorResponse;
import com.phiprotection.interfaces.api.dto.RecordCreatedResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * REST controller for patient records and their visits.
 *
 * Security:
 * - All endpoints require a valid session token
 * - Per-record routes run the ownership check before touching the record
 * - Responses carry decrypted PHI only for the owner or an admin
 */
@RestController
@RequestMapping("/api/patients")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Patients", description = "Encrypted patient record operations")
@SecurityRequirement(name = OpenApiConfiguration.SESSION_SCHEME)
public class PatientRecordController {

    private final SecurePatientService patientService;
    private final AccessKernel accessKernel;
    private final AuthorizationContextProvider contextProvider;

    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Create patient record",
        description = "Encrypts every sensitive field and stores the record owned by the caller"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Record created",
            content = @Content(schema = @Schema(implementation = RecordCreatedResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed request body",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Audit trail unavailable",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<RecordCreatedResponse> createRecord(@RequestBody ObjectNode payload) {
        AuthorizationContext context = contextProvider.getCurrentContext();

        String id = patientService.createRecord(payload, context.getSubjectId(), context.getSourceIp());

        if (log.isInfoEnabled()) {
            log.info("Patient record created: id={}, actor={}", id, context.getSubjectId());
        }

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(RecordCreatedResponse.builder().id(id).build());
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get patient record", description = "Returns the fully decrypted record")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Record retrieved"),
        @ApiResponse(
            responseCode = "403",
            description = "Caller does not own the record",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Record not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ObjectNode> getRecord(@PathVariable String id) {
        AuthorizationContext context = authorizeOwner(id);

        ObjectNode record = patientService.getRecord(id, context.getSubjectId(), context.getSourceIp());
        if (record == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(record);
    }

    @GetMapping(value = "/{id}/fields", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Get selected fields",
        description = "Decrypts only the named fields; all other sensitive fields stay encrypted"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Fields retrieved"),
        @ApiResponse(
            responseCode = "400",
            description = "Unknown field name",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Caller does not own the record",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Record not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ObjectNode> getRecordFields(
            @PathVariable String id,
            @RequestParam("names") @NotEmpty List<String> names) {

        Set<PhiField> fields = toFields(names);
        AuthorizationContext context = authorizeOwner(id);

        ObjectNode record = patientService.getRecordFields(id, fields, context.getSubjectId(), context.getSourceIp());
        if (record == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(record);
    }

    @PatchMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update patient record", description = "Encrypts and merges the given fields")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Record updated"),
        @ApiResponse(
            responseCode = "403",
            description = "Caller does not own the record",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Record not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Record was modified concurrently",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<Void> updateRecord(@PathVariable String id, @RequestBody ObjectNode updates) {
        AuthorizationContext context = authorizeOwner(id);

        boolean updated = patientService.updateRecord(id, updates, context.getSubjectId(), context.getSourceIp());
        if (!updated) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Search patient identifiers",
        description = "Substring match over record ids and record numbers; returns identifiers only"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Matching identifiers, at most ten"),
        @ApiResponse(
            responseCode = "400",
            description = "Blank search term",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<List<RecordSummary>> searchRecords(
            @RequestParam("term") @NotBlank @Size(max = 64) String term) {

        AuthorizationContext context = contextProvider.getCurrentContext();
        return ResponseEntity.ok(patientService.searchRecords(term, context.getSubjectId(), context.getSourceIp()));
    }

    @PostMapping(
        value = "/{id}/visits",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Record a visit", description = "Encrypts the clinical fields of the visit")
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Visit created",
            content = @Content(schema = @Schema(implementation = RecordCreatedResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Caller does not own the patient record",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Patient not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<RecordCreatedResponse> createVisit(
            @PathVariable String id,
            @RequestBody ObjectNode payload) {

        AuthorizationContext context = authorizeOwner(id);

        String visitId = patientService.createVisit(id, payload, context.getSubjectId(), context.getSourceIp());

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(RecordCreatedResponse.builder().id(visitId).build());
    }

    @GetMapping(value = "/{id}/visits", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List visits", description = "Decrypted visits of the patient, newest first")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Visits retrieved"),
        @ApiResponse(
            responseCode = "403",
            description = "Caller does not own the patient record",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<List<ObjectNode>> getVisits(@PathVariable String id) {
        AuthorizationContext context = authorizeOwner(id);
        return ResponseEntity.ok(patientService.getVisits(id, context.getSubjectId(), context.getSourceIp()));
    }

    /**
     * Ownership check for per-record routes. A record that does not exist has no owner to
     * check; the service reports it as not found.
     */
    private AuthorizationContext authorizeOwner(String recordId) {
        AuthorizationContext context = contextProvider.getCurrentContext();
        patientService.findOwnerId(recordId)
            .ifPresent(ownerId -> accessKernel.authorizeSubjectAccess(context, ownerId));
        return context;
    }

    private static Set<PhiField> toFields(List<String> names) {
        Set<PhiField> fields = EnumSet.noneOf(PhiField.class);
        for (String name : names) {
            fields.add(PhiField.fromJsonName(name.trim())
                .orElseThrow(() -> new IllegalArgumentException("Unknown field name")));
        }
        return fields;
    }
}
