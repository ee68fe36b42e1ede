package com.caf.backend.modules.cases.domain;

import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.jpa.AbstractUuidEntity;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.domain.EntitySnapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;


/**
 * Metadata of a document attached to a case. File contents live outside this service.
 */
@Entity
@Table(name = "case_document")
public class CaseDocument extends AbstractUuidEntity {

    @Column(name = "case_id", nullable = false, columnDefinition = "uuid")
    private UUID caseId;

    @Column(name = "uploaded_by", columnDefinition = "uuid")
    private UUID uploadedBy;

    @Column(name = "file_name", nullable = false, length = 255)
    private String fileName;

    @Column(name = "file_type", length = 100)
    private String fileType;

    @Enumerated(EnumType.STRING)
    @Column(name = "sensitivity", nullable = false, length = 32)
    private SensitivityCategory sensitivity;

    @Column(name = "visibility", nullable = false, length = 32)
    private String visibility = "internal";

    public UUID getCaseId() {
        return caseId;
    }

    public void setCaseId(UUID caseId) {
        this.caseId = caseId;
    }

    public UUID getUploadedBy() {
        return uploadedBy;
    }

    public void setUploadedBy(UUID uploadedBy) {
        this.uploadedBy = uploadedBy;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public String getFileType() {
        return fileType;
    }

    public void setFileType(String fileType) {
        this.fileType = fileType;
    }

    public SensitivityCategory getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(SensitivityCategory sensitivity) {
        this.sensitivity = sensitivity;
    }

    public String getVisibility() {
        return visibility;
    }

    public void setVisibility(String visibility) {
        this.visibility = visibility;
    }

    public EntitySnapshot snapshot(UUID officeId) {
        return EntitySnapshot.builder(EntityType.CASE_DOCUMENT, getId(), officeId)
                .field("caseId", caseId)
                .field("uploadedBy", uploadedBy)
                .field("fileName", fileName)
                .field("fileType", fileType)
                .field("sensitivity", sensitivity)
                .field("visibility", visibility)
                .build();
    }
}
