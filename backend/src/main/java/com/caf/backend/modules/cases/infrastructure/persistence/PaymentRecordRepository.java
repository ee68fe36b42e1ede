package com.caf.backend.modules.cases.infrastructure.persistence;

import java.util.UUID;

import com.caf.backend.modules.cases.domain.PaymentRecord;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, UUID> {
}
