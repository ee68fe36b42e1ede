package com.caf.backend.modules.cases.infrastructure.persistence;

import java.util.UUID;

import com.caf.backend.modules.cases.domain.Office;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OfficeRepository extends JpaRepository<Office, UUID> {
}
