package com.roomkeeper.backend.modules.checkin.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.roomkeeper.backend.modules.checkin.domain.SecurityCode;
import com.roomkeeper.backend.modules.checkin.infrastructure.persistence.SecurityCodeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues 4-character pickup codes unique per issue date. Codes from earlier dates may come back.
 * The claim joins the caller's transaction: a check-in that rolls back releases its code.
 */
@Component
public class SecurityCodeIssuer {

    private static final Logger log = LoggerFactory.getLogger(SecurityCodeIssuer.class);

    /** No 0/O, 1/I/L. */
    public static final String ALPHABET = "23456789ABCDEFGHJKMNPQRSTUVWXYZ";
    public static final int CODE_LENGTH = 4;
    static final long KEYSPACE = (long) Math.pow(ALPHABET.length(), CODE_LENGTH);

    private final SecureRandom random = new SecureRandom();
    private final SecurityCodeRepository securityCodeRepository;
    private final int maxAttempts;
    private final Clock clock;

    public SecurityCodeIssuer(
            SecurityCodeRepository securityCodeRepository,
            CheckinProperties properties,
            Clock clock
    ) {
        this.securityCodeRepository = securityCodeRepository;
        this.maxAttempts = properties.securityCode().maxAttempts();
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public SecurityCode issue(LocalDate issueDate) {
        long alreadyIssued = securityCodeRepository.countByIssueDate(issueDate);
        if (alreadyIssued >= KEYSPACE) {
            log.error("Security code space exhausted for {}: {} codes issued", issueDate, alreadyIssued);
            throw new SecurityCodeExhaustedException(issueDate, "all " + KEYSPACE + " codes are in use");
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = nextCandidate();
            UUID id = UUID.randomUUID();
            if (securityCodeRepository.insertIfAbsent(id, issueDate, candidate, OffsetDateTime.now(clock)) == 1) {
                return securityCodeRepository.findById(id)
                        .orElseThrow(() -> new IllegalStateException("Claimed security code " + id + " not readable"));
            }
            log.debug("Security code collision on {} (attempt {})", issueDate, attempt);
        }

        log.error("Could not issue a security code for {} within {} attempts; alphabet too small for daily volume?",
                issueDate, maxAttempts);
        throw new SecurityCodeExhaustedException(issueDate, "no free code found in " + maxAttempts + " attempts");
    }

    String nextCandidate() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
