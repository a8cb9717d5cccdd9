package com.roomkeeper.backend.modules.checkin.infrastructure.persistence;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.roomkeeper.backend.modules.checkin.domain.SecurityCode;

public interface SecurityCodeRepository extends JpaRepository<SecurityCode, UUID> {

    long countByIssueDate(LocalDate issueDate);

    /**
     * Claims a code for the date unless it is already taken. Runs in the caller's transaction and never
     * raises on a duplicate, so a lost claim leaves the transaction usable.
     *
     * @return 1 when the code was claimed, 0 when (issue_date, code) already exists
     */
    @Modifying
    @Query(value = """
            INSERT INTO security_code (id, issue_date, code, issued_at)
            VALUES (:id, :issueDate, :code, :issuedAt)
            ON CONFLICT ON CONSTRAINT uq_security_code_issue_date_code DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("issueDate") LocalDate issueDate,
                       @Param("code") String code,
                       @Param("issuedAt") OffsetDateTime issuedAt);
}
