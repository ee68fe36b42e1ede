package com.caf.backend.modules.notification.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.caf.backend.modules.access.domain.Role;

/**
 * Relations the classifier needs to turn recipient slots into user ids. Missing relations resolve
 * to empty results.
 */
public interface RecipientDirectory {

    Optional<UUID> primaryStaff(UUID caseId);

    /**
     * Active staff assigned to the case, the primary staff member included.
     */
    List<CaseStaffMember> caseStaff(UUID caseId);

    List<UUID> officeMembers(UUID officeId, Role role);

    record CaseStaffMember(UUID userId, String roleCode) {
    }
}
