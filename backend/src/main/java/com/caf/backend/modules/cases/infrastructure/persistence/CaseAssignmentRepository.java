package com.caf.backend.modules.cases.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.caf.backend.modules.cases.domain.CaseAssignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CaseAssignmentRepository extends JpaRepository<CaseAssignment, UUID> {

    boolean existsByCaseIdAndUserId(UUID caseId, UUID userId);

    @Query("""
            select a.userId
              from CaseAssignment a
             where a.caseId = :caseId
             order by a.assignedAt asc
            """)
    List<UUID> findUserIdsByCaseId(@Param("caseId") UUID caseId);
}
