package com.phiprotection.infrastructure.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "phi_audit_outbox")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, name = "actor_id", updatable = false)
    private String actorId;

    @Column(nullable = false, name = "subject_id", updatable = false)
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    private AuditAction action;

    @Column(name = "source_ip", updatable = false)
    private String sourceIp;

    @Column(nullable = false, updatable = false)
    private boolean success;

    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(nullable = false, name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private boolean processed;
}
