package com.caf.backend.modules.cases.domain;

import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.jpa.AbstractUuidEntity;
import com.caf.backend.modules.audit.domain.EntitySnapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;


/**
 * Staff member or client. The role is kept as its code so the directory can hold roles the policy
 * engine does not know about.
 */
@Entity
@Table(name = "user_account")
public class UserAccount extends AbstractUuidEntity {

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "role", nullable = false, length = 32)
    private String role;

    @Column(name = "office_id", columnDefinition = "uuid")
    private UUID officeId;

    @Column(name = "department", length = 64)
    private String department;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public UUID getOfficeId() {
        return officeId;
    }

    public void setOfficeId(UUID officeId) {
        this.officeId = officeId;
    }

    public String getDepartment() {
        return department;
    }

    public void setDepartment(String department) {
        this.department = department;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public EntitySnapshot snapshot() {
        return EntitySnapshot.builder(EntityType.USER, getId(), officeId)
                .field("fullName", fullName)
                .field("email", email)
                .field("role", role)
                .field("officeId", officeId)
                .field("department", department)
                .field("active", active)
                .build();
    }
}
