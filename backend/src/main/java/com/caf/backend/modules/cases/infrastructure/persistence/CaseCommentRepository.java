package com.caf.backend.modules.cases.infrastructure.persistence;

import java.util.UUID;

import com.caf.backend.modules.cases.domain.CaseComment;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CaseCommentRepository extends JpaRepository<CaseComment, UUID> {
}
