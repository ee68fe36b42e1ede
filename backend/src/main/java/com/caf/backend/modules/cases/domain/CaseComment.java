package com.caf.backend.modules.cases.domain;

import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.jpa.AbstractUuidEntity;
import com.caf.backend.modules.audit.domain.EntitySnapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;


@Entity
@Table(name = "case_comment")
public class CaseComment extends AbstractUuidEntity {

    @Column(name = "case_id", nullable = false, columnDefinition = "uuid")
    private UUID caseId;

    @Column(name = "author_id", nullable = false, columnDefinition = "uuid")
    private UUID authorId;

    @Column(name = "body", nullable = false)
    private String body;

    @Column(name = "visibility", nullable = false, length = 32)
    private String visibility = "internal";

    public UUID getCaseId() {
        return caseId;
    }

    public void setCaseId(UUID caseId) {
        this.caseId = caseId;
    }

    public UUID getAuthorId() {
        return authorId;
    }

    public void setAuthorId(UUID authorId) {
        this.authorId = authorId;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getVisibility() {
        return visibility;
    }

    public void setVisibility(String visibility) {
        this.visibility = visibility;
    }

    public EntitySnapshot snapshot(UUID officeId) {
        return EntitySnapshot.builder(EntityType.CASE_COMMENT, getId(), officeId)
                .field("caseId", caseId)
                .field("authorId", authorId)
                .field("body", body)
                .field("visibility", visibility)
                .build();
    }
}
