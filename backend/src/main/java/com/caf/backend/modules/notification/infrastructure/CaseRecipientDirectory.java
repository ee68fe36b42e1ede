package com.caf.backend.modules.notification.infrastructure;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.domain.UserAccount;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseAssignmentRepository;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseRecordRepository;
import com.caf.backend.modules.cases.infrastructure.persistence.UserAccountRepository;
import com.caf.backend.modules.notification.application.RecipientDirectory;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class CaseRecipientDirectory implements RecipientDirectory {

    private final CaseRecordRepository caseRecordRepository;
    private final CaseAssignmentRepository caseAssignmentRepository;
    private final UserAccountRepository userAccountRepository;

    public CaseRecipientDirectory(
            CaseRecordRepository caseRecordRepository,
            CaseAssignmentRepository caseAssignmentRepository,
            UserAccountRepository userAccountRepository
    ) {
        this.caseRecordRepository = caseRecordRepository;
        this.caseAssignmentRepository = caseAssignmentRepository;
        this.userAccountRepository = userAccountRepository;
    }

    @Override
    public Optional<UUID> primaryStaff(UUID caseId) {
        return caseRecordRepository.findById(caseId)
                .map(CaseRecord::getPrimaryStaffId);
    }

    @Override
    public List<CaseStaffMember> caseStaff(UUID caseId) {
        Set<UUID> ids = new LinkedHashSet<>();
        primaryStaff(caseId).ifPresent(ids::add);
        ids.addAll(caseAssignmentRepository.findUserIdsByCaseId(caseId));
        if (ids.isEmpty()) {
            return List.of();
        }

        Map<UUID, UserAccount> accounts = userAccountRepository.findByIdInAndActiveTrue(ids).stream()
                .collect(Collectors.toMap(UserAccount::getId, Function.identity()));
        List<CaseStaffMember> members = new ArrayList<>();
        for (UUID id : ids) {
            UserAccount account = accounts.get(id);
            if (account != null) {
                members.add(new CaseStaffMember(id, account.getRole()));
            }
        }
        return members;
    }

    @Override
    public List<UUID> officeMembers(UUID officeId, Role role) {
        return userAccountRepository.findByOfficeIdAndRoleAndActiveTrue(officeId, role.code()).stream()
                .map(UserAccount::getId)
                .toList();
    }
}
