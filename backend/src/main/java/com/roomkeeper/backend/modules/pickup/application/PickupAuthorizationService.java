package com.roomkeeper.backend.modules.pickup.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.roomkeeper.backend.global.common.IdKeys;
import com.roomkeeper.backend.global.error.ProblemException;
import com.roomkeeper.backend.modules.audit.application.AuditLogService;
import com.roomkeeper.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.roomkeeper.backend.modules.checkin.domain.Attendance;
import com.roomkeeper.backend.modules.checkin.domain.SecurityCode;
import com.roomkeeper.backend.modules.checkin.infrastructure.persistence.AttendanceRepository;
import com.roomkeeper.backend.modules.directory.domain.Person;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.PersonRepository;
import com.roomkeeper.backend.modules.pickup.domain.AuthorizationLevel;
import com.roomkeeper.backend.modules.pickup.domain.AuthorizedPickup;
import com.roomkeeper.backend.modules.pickup.domain.PickupCandidate;
import com.roomkeeper.backend.modules.pickup.domain.PickupCandidate.KnownPerson;
import com.roomkeeper.backend.modules.pickup.domain.PickupCandidate.NamedPerson;
import com.roomkeeper.backend.modules.pickup.domain.PickupLog;
import com.roomkeeper.backend.modules.pickup.infrastructure.persistence.AuthorizedPickupRepository;
import com.roomkeeper.backend.modules.pickup.infrastructure.persistence.PickupLogRepository;
import com.roomkeeper.backend.modules.pickup.presentation.dto.PickupDtoMapper;
import com.roomkeeper.backend.modules.pickup.presentation.dto.PickupLogResponse;
import com.roomkeeper.backend.modules.pickup.presentation.dto.PickupVerificationResponse;
import com.roomkeeper.backend.modules.pickup.presentation.dto.RecordPickupRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Decides whether a person may take a checked-in child out, and records every actual release.
 * <p>
 * {@link #verify} has no side effects and may be called speculatively. {@link #recordPickup} is the commit step:
 * it appends exactly one {@link PickupLog} and closes the attendance. Contract violations on the commit step
 * are thrown as {@link PickupValidationException} or {@link BlockedPickupException}.
 */
@Service
@Transactional
public class PickupAuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(PickupAuthorizationService.class);

    static final String OVERRIDE_AUDIT_ACTION = "PICKUP_SUPERVISOR_OVERRIDE";
    private static final int DEFAULT_HISTORY_DAYS = 30;

    private final AttendanceRepository attendanceRepository;
    private final AuthorizedPickupRepository authorizedPickupRepository;
    private final PickupLogRepository pickupLogRepository;
    private final PersonRepository personRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public PickupAuthorizationService(
            AttendanceRepository attendanceRepository,
            AuthorizedPickupRepository authorizedPickupRepository,
            PickupLogRepository pickupLogRepository,
            PersonRepository personRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.attendanceRepository = attendanceRepository;
        this.authorizedPickupRepository = authorizedPickupRepository;
        this.pickupLogRepository = pickupLogRepository;
        this.personRepository = personRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * The presented code is checked before any relationship lookup, so a wrong code never reveals
     * whether the candidate is on the list.
     */
    @Transactional(readOnly = true)
    public PickupVerificationResponse verify(String attendanceId, PickupCandidate candidate, String presentedCode) {
        Objects.requireNonNull(candidate, "candidate is required");
        UUID id = requireAttendanceId(attendanceId);
        Attendance attendance = attendanceRepository.findDetailedById(id).orElse(null);
        if (attendance == null) {
            return PickupVerificationResponse.denied("Attendance record not found");
        }
        if (!codeMatches(attendance.getSecurityCode(), presentedCode)) {
            log.warn("Invalid security code presented for attendance {}", id);
            return PickupVerificationResponse.denied("Invalid security code");
        }

        Person child = attendance.getPerson();
        Optional<AuthorizedPickup> match = resolveRelationship(child.getId(), candidate);
        if (match.isEmpty()) {
            return new PickupVerificationResponse(false, null, null, true,
                    "Person not on authorized pickup list. Supervisor approval required.");
        }

        AuthorizedPickup pickup = match.get();
        return switch (pickup.getAuthorizationLevel()) {
            case ALWAYS -> new PickupVerificationResponse(true, AuthorizationLevel.ALWAYS, pickup.getId(), false,
                    pickup.getDisplayName() + " is authorized to pick up " + child.getFullName() + ".");
            case EMERGENCY_ONLY -> new PickupVerificationResponse(false, AuthorizationLevel.EMERGENCY_ONLY,
                    pickup.getId(), true, "Emergency-only authorization. Supervisor approval required.");
            case NEVER -> {
                log.warn("Blocked pickup person {} presented for attendance {}", pickup.getId(), id);
                yield new PickupVerificationResponse(false, AuthorizationLevel.NEVER, pickup.getId(), false,
                        "This person is blocked from picking up this child.");
            }
        };
    }

    public PickupLogResponse recordPickup(RecordPickupRequest request) {
        UUID attendanceId = requireAttendanceId(request.attendanceId());
        Attendance attendance = attendanceRepository.findByIdForUpdate(attendanceId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ATTENDANCE_NOT_FOUND",
                        "Attendance record not found"));
        Person child = attendance.getPerson();

        UUID pickupPersonId = optionalId(request.pickupPersonId(), "INVALID_PICKUP_PERSON_ID");
        String pickupPersonName = StringUtils.hasText(request.pickupPersonName())
                ? request.pickupPersonName().trim()
                : null;
        if (pickupPersonId == null && pickupPersonName == null) {
            throw new PickupValidationException("PICKUP_PERSON_REQUIRED",
                    "Either pickupPersonId or pickupPersonName is required");
        }

        AuthorizedPickup referenced = resolveReferencedAuthorization(request.authorizedPickupId(), child);
        Optional<AuthorizedPickup> resolved = resolveRelationship(child.getId(),
                PickupCandidate.of(pickupPersonId, pickupPersonName));
        if (isBlocked(referenced) || resolved.map(this::isBlocked).orElse(false)) {
            log.warn("Refused to record pickup of attendance {}: pickup person is blocked", attendanceId);
            throw new BlockedPickupException("This person is blocked from picking up this child");
        }

        validateOverride(request);

        Person pickupPerson = null;
        if (pickupPersonId != null) {
            pickupPerson = personRepository.findById(pickupPersonId)
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PERSON_NOT_FOUND",
                            "Pickup person not found"));
        }
        Person supervisor = null;
        if (request.supervisorOverride()) {
            UUID supervisorId = optionalId(request.supervisorPersonId(), "INVALID_SUPERVISOR_ID");
            supervisor = personRepository.findById(supervisorId)
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "SUPERVISOR_NOT_FOUND",
                            "Supervisor not found"));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        PickupLog pickupLog = new PickupLog(attendance, child, now);
        pickupLog.setPickupPerson(pickupPerson);
        pickupLog.setPickupPersonName(pickupPersonName != null ? pickupPersonName : pickupPerson.getFullName());
        pickupLog.setWasAuthorized(request.wasAuthorized());
        pickupLog.setAuthorizedPickup(referenced != null ? referenced : resolved.orElse(null));
        pickupLog.setSupervisorOverride(request.supervisorOverride());
        pickupLog.setSupervisor(supervisor);
        pickupLog.setNotes(StringUtils.hasText(request.notes()) ? request.notes().trim() : null);

        boolean closed = attendance.close(now);
        PickupLog saved = pickupLogRepository.save(pickupLog);

        if (request.supervisorOverride()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("childPersonId", IdKeys.format(child.getId()));
            detail.put("pickupPersonName", saved.getPickupPersonName());
            resolved.ifPresent(pickup -> detail.put("authorizationLevel", pickup.getAuthorizationLevel().name()));
            auditLogService.record(new AuditLogCommand(OVERRIDE_AUDIT_ACTION, "ATTENDANCE",
                    IdKeys.format(attendanceId), supervisor.getId(), detail));
        }

        log.info("Recorded pickup of attendance {} by {} (authorized={}, override={}, closed={})",
                attendanceId, saved.getPickupPersonName(), request.wasAuthorized(), request.supervisorOverride(),
                closed);
        return PickupDtoMapper.toPickupLog(saved);
    }

    /**
     * Newest first. {@code from} defaults to thirty days ago and {@code to} to today, both inclusive.
     */
    @Transactional(readOnly = true)
    public List<PickupLogResponse> pickupHistory(String childId, LocalDate from, LocalDate to) {
        Optional<UUID> id = IdKeys.parse(childId);
        if (id.isEmpty()) {
            return List.of();
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate end = to != null ? to : today;
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_HISTORY_DAYS);
        if (start.isAfter(end)) {
            throw new PickupValidationException("INVALID_DATE_RANGE", "from must not be after to");
        }
        return pickupLogRepository.findByChildBetween(id.get(),
                        start.atStartOfDay().atOffset(ZoneOffset.UTC),
                        end.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC))
                .stream()
                .map(PickupDtoMapper::toPickupLog)
                .toList();
    }

    private void validateOverride(RecordPickupRequest request) {
        if (request.wasAuthorized() && request.supervisorOverride()) {
            throw new PickupValidationException("OVERRIDE_CONFLICTS_WITH_AUTHORIZATION",
                    "A supervisor override cannot be recorded for an authorized pickup");
        }
        if (!request.wasAuthorized() && !request.supervisorOverride()) {
            throw new PickupValidationException("SUPERVISOR_OVERRIDE_REQUIRED",
                    "Supervisor override is required for unauthorized pickup");
        }
        if (request.supervisorOverride() && !StringUtils.hasText(request.supervisorPersonId())) {
            throw new PickupValidationException("SUPERVISOR_REQUIRED",
                    "Supervisor person id is required for an override");
        }
    }

    private AuthorizedPickup resolveReferencedAuthorization(String authorizedPickupId, Person child) {
        UUID id = optionalId(authorizedPickupId, "INVALID_AUTHORIZED_PICKUP_ID");
        if (id == null) {
            return null;
        }
        return authorizedPickupRepository.findById(id)
                .filter(pickup -> pickup.getChild().getId().equals(child.getId()))
                .orElseThrow(() -> new PickupValidationException("AUTHORIZED_PICKUP_MISMATCH",
                        "Authorized pickup does not belong to this child"));
    }

    /**
     * For a name-only candidate several rows can match; the most restrictive one wins.
     */
    private Optional<AuthorizedPickup> resolveRelationship(UUID childId, PickupCandidate candidate) {
        if (candidate instanceof KnownPerson known) {
            return authorizedPickupRepository.findActiveByChildAndPerson(childId, known.personId());
        }
        NamedPerson named = (NamedPerson) candidate;
        return authorizedPickupRepository.findActiveByChildAndName(childId, named.name()).stream()
                .reduce((a, b) -> AuthorizationLevel.mostRestrictive(a.getAuthorizationLevel(),
                        b.getAuthorizationLevel()) == a.getAuthorizationLevel() ? a : b);
    }

    private boolean isBlocked(AuthorizedPickup pickup) {
        return pickup != null && pickup.isActive() && pickup.getAuthorizationLevel() == AuthorizationLevel.NEVER;
    }

    private static boolean codeMatches(SecurityCode issued, String presented) {
        if (issued == null || !StringUtils.hasText(presented)) {
            return false;
        }
        byte[] expected = issued.getCode().getBytes(StandardCharsets.UTF_8);
        byte[] actual = presented.trim().toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, actual);
    }

    private static UUID requireAttendanceId(String attendanceId) {
        return IdKeys.parse(attendanceId)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ATTENDANCE_ID",
                        "Invalid attendance id"));
    }

    private static UUID optionalId(String raw, String code) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        return IdKeys.parse(raw)
                .orElseThrow(() -> new PickupValidationException(code, "Malformed identifier: " + raw.trim()));
    }
}
