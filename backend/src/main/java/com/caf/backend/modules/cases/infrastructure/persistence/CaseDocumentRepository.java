package com.caf.backend.modules.cases.infrastructure.persistence;

import java.util.UUID;

import com.caf.backend.modules.cases.domain.CaseDocument;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CaseDocumentRepository extends JpaRepository<CaseDocument, UUID> {
}
