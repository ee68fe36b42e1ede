package com.caf.backend.modules.cases.domain;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.jpa.AbstractUuidEntity;
import com.caf.backend.modules.audit.domain.EntitySnapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;


@Entity
@Table(name = "case_record")
public class CaseRecord extends AbstractUuidEntity {

    @Column(name = "office_id", nullable = false, columnDefinition = "uuid")
    private UUID officeId;

    @Column(name = "client_id", columnDefinition = "uuid")
    private UUID clientId;

    @Column(name = "primary_staff_id", columnDefinition = "uuid")
    private UUID primaryStaffId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "category", length = 64)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CaseStatus status = CaseStatus.OPEN;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_before_delete", length = 16)
    private CaseStatus statusBeforeDelete;

    @Column(name = "current_stage", length = 64)
    private String currentStage;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "completed_by", columnDefinition = "uuid")
    private UUID completedBy;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @Column(name = "deleted_by", columnDefinition = "uuid")
    private UUID deletedBy;

    public UUID getOfficeId() {
        return officeId;
    }

    public void setOfficeId(UUID officeId) {
        this.officeId = officeId;
    }

    public UUID getClientId() {
        return clientId;
    }

    public void setClientId(UUID clientId) {
        this.clientId = clientId;
    }

    public UUID getPrimaryStaffId() {
        return primaryStaffId;
    }

    public void setPrimaryStaffId(UUID primaryStaffId) {
        this.primaryStaffId = primaryStaffId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public CaseStatus getStatus() {
        return status;
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(String currentStage) {
        this.currentStage = currentStage;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public UUID getCompletedBy() {
        return completedBy;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public UUID getDeletedBy() {
        return deletedBy;
    }

    public boolean isDeleted() {
        return status == CaseStatus.DELETED;
    }

    public void changeStatus(CaseStatus next, UUID actorId, OffsetDateTime now) {
        if (next == CaseStatus.DELETED) {
            throw new IllegalArgumentException("use markDeleted to delete a case");
        }
        if (next == CaseStatus.COMPLETED && status != CaseStatus.COMPLETED) {
            completedAt = now;
            completedBy = actorId;
        } else if (next != CaseStatus.COMPLETED) {
            completedAt = null;
            completedBy = null;
        }
        status = next;
    }

    public void markDeleted(UUID actorId, OffsetDateTime now) {
        statusBeforeDelete = status;
        status = CaseStatus.DELETED;
        deletedAt = now;
        deletedBy = actorId;
    }

    public void restore() {
        status = statusBeforeDelete != null ? statusBeforeDelete : CaseStatus.OPEN;
        statusBeforeDelete = null;
        deletedAt = null;
        deletedBy = null;
    }

    /**
     * Audited view of the case. Bookkeeping timestamps are left out; assigned staff are sorted so
     * that assignment order never shows up as a change.
     */
    public EntitySnapshot snapshot(Collection<UUID> assignedStaffIds) {
        List<String> staff = assignedStaffIds.stream()
                .map(UUID::toString)
                .sorted()
                .toList();
        return EntitySnapshot.builder(EntityType.CASE, getId(), officeId)
                .field("officeId", officeId)
                .field("clientId", clientId)
                .field("primaryStaffId", primaryStaffId)
                .field("title", title)
                .field("category", category)
                .field("status", status)
                .field("currentStage", currentStage)
                .field("completedAt", completedAt)
                .field("completedBy", completedBy)
                .field("deletedAt", deletedAt)
                .field("deletedBy", deletedBy)
                .field("assignedStaffIds", staff)
                .build();
    }
}
