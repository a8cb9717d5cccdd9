package com.roomkeeper.backend.modules.checkin.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Immutable
@Table(
        name = "security_code",
        uniqueConstraints = @UniqueConstraint(name = "uq_security_code_issue_date_code", columnNames = {"issue_date", "code"})
)
public class SecurityCode {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "issue_date", nullable = false, updatable = false)
    private LocalDate issueDate;

    @Column(name = "code", nullable = false, updatable = false, length = 8)
    private String code;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private OffsetDateTime issuedAt;

    protected SecurityCode() {
    }

    public SecurityCode(LocalDate issueDate, String code, OffsetDateTime issuedAt) {
        this.issueDate = issueDate;
        this.code = code;
        this.issuedAt = issuedAt;
    }

    public UUID getId() {
        return id;
    }

    public LocalDate getIssueDate() {
        return issueDate;
    }

    public String getCode() {
        return code;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }
}
