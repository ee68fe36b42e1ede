package com.caf.backend.modules.cases.application;

import java.util.List;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.application.ForbiddenException;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.EntitySnapshot;
import com.caf.backend.modules.cases.domain.UserAccount;
import com.caf.backend.modules.cases.infrastructure.persistence.OfficeRepository;
import com.caf.backend.modules.cases.infrastructure.persistence.UserAccountRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserAccountService {

    static final String TAG_USER_DEACTIVATION = "user_deactivation";

    private final UserAccountRepository userAccountRepository;
    private final OfficeRepository officeRepository;
    private final AccessGuard accessGuard;
    private final AuditRecorder auditRecorder;

    public UserAccountService(
            UserAccountRepository userAccountRepository,
            OfficeRepository officeRepository,
            AccessGuard accessGuard,
            AuditRecorder auditRecorder
    ) {
        this.userAccountRepository = userAccountRepository;
        this.officeRepository = officeRepository;
        this.accessGuard = accessGuard;
        this.auditRecorder = auditRecorder;
    }

    public UserAccount updateRoleAndOffice(Actor actor, UUID userId, String roleCode, UUID officeId) {
        UserAccount user = loadForWrite(actor, userId, AccessAction.WRITE);
        Role role = Role.fromCode(roleCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ROLE"));
        if (officeId != null && !officeRepository.existsById(officeId)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_OFFICE");
        }
        EntitySnapshot before = user.snapshot();

        user.setRole(role.code());
        user.setDepartment(role.department());
        user.setOfficeId(officeId);

        EntitySnapshot after = user.snapshot();
        if (!before.equals(after)) {
            auditRecorder.record(AuditAction.UPDATE, before, after, actor);
        }
        return user;
    }

    public UserAccount deactivate(Actor actor, UUID userId, String reason) {
        UserAccount user = loadForWrite(actor, userId, AccessAction.DELETE);
        if (!user.isActive()) {
            return user;
        }
        EntitySnapshot before = user.snapshot();
        user.setActive(false);
        auditRecorder.record(AuditAction.DELETE, before, user.snapshot(), actor, reason, List.of(TAG_USER_DEACTIVATION));
        return user;
    }

    private UserAccount loadForWrite(Actor actor, UUID userId, AccessAction action) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(ForbiddenException::new);
        accessGuard.require(
                actor,
                Resource.of(EntityType.USER, userId, user.getOfficeId(), SensitivityCategory.ADMINISTRATIVE),
                action
        );
        return user;
    }
}
