package com.caf.backend.modules.cases.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "case_assignment", uniqueConstraints = @UniqueConstraint(columnNames = {"case_id", "user_id"}))
public class CaseAssignment {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "case_id", nullable = false, columnDefinition = "uuid")
    private UUID caseId;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "assigned_at", nullable = false)
    private OffsetDateTime assignedAt;

    protected CaseAssignment() {
    }

    public CaseAssignment(UUID caseId, UUID userId, OffsetDateTime assignedAt) {
        this.caseId = caseId;
        this.userId = userId;
        this.assignedAt = assignedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getCaseId() {
        return caseId;
    }

    public UUID getUserId() {
        return userId;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }
}
