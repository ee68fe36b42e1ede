package com.caf.backend.modules.cases.infrastructure.persistence;

import java.util.UUID;

import com.caf.backend.modules.cases.domain.CaseRecord;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CaseRecordRepository extends JpaRepository<CaseRecord, UUID> {
}
