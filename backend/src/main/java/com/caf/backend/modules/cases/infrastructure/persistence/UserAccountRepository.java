package com.caf.backend.modules.cases.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.caf.backend.modules.cases.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    List<UserAccount> findByOfficeIdAndRoleAndActiveTrue(UUID officeId, String role);

    List<UserAccount> findByIdInAndActiveTrue(Collection<UUID> ids);
}
