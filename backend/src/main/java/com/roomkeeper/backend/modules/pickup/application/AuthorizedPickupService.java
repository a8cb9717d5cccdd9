package com.roomkeeper.backend.modules.pickup.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.roomkeeper.backend.global.common.IdKeys;
import com.roomkeeper.backend.global.error.ProblemException;
import com.roomkeeper.backend.global.security.SecurityUtils;
import com.roomkeeper.backend.modules.audit.application.AuditLogService;
import com.roomkeeper.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.roomkeeper.backend.modules.directory.domain.FamilyMember;
import com.roomkeeper.backend.modules.directory.domain.FamilyRole;
import com.roomkeeper.backend.modules.directory.domain.Person;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.FamilyMemberRepository;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.PersonRepository;
import com.roomkeeper.backend.modules.pickup.domain.AuthorizationLevel;
import com.roomkeeper.backend.modules.pickup.domain.AuthorizedPickup;
import com.roomkeeper.backend.modules.pickup.domain.PickupRelationship;
import com.roomkeeper.backend.modules.pickup.infrastructure.persistence.AuthorizedPickupRepository;
import com.roomkeeper.backend.modules.pickup.presentation.dto.AuthorizedPickupResponse;
import com.roomkeeper.backend.modules.pickup.presentation.dto.CreateAuthorizedPickupRequest;
import com.roomkeeper.backend.modules.pickup.presentation.dto.PickupDtoMapper;
import com.roomkeeper.backend.modules.pickup.presentation.dto.UpdateAuthorizedPickupRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Maintains the standing list of who may collect a child. Rows are deactivated, never deleted.
 */
@Service
@Transactional
public class AuthorizedPickupService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizedPickupService.class);

    static final String RESOURCE_TYPE = "AUTHORIZED_PICKUP";

    private final AuthorizedPickupRepository authorizedPickupRepository;
    private final PersonRepository personRepository;
    private final FamilyMemberRepository familyMemberRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AuthorizedPickupService(
            AuthorizedPickupRepository authorizedPickupRepository,
            PersonRepository personRepository,
            FamilyMemberRepository familyMemberRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.authorizedPickupRepository = authorizedPickupRepository;
        this.personRepository = personRepository;
        this.familyMemberRepository = familyMemberRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AuthorizedPickupResponse> list(String childId) {
        Person child = loadPerson(childId);
        return authorizedPickupRepository.findActiveByChildId(child.getId()).stream()
                .map(PickupDtoMapper::toAuthorizedPickup)
                .toList();
    }

    /**
     * Updates the active row for the same person (or the same free-text name) instead of adding a second one.
     */
    public AuthorizedPickupResponse create(String childId, CreateAuthorizedPickupRequest request) {
        Person child = loadPerson(childId);
        String name = StringUtils.hasText(request.name()) ? request.name().trim() : null;
        Person authorizedPerson = null;
        if (StringUtils.hasText(request.authorizedPersonId())) {
            authorizedPerson = loadPerson(request.authorizedPersonId());
            if (authorizedPerson.getId().equals(child.getId())) {
                throw new PickupValidationException("SELF_AUTHORIZATION_NOT_ALLOWED",
                        "A child cannot be authorized to pick up themselves");
            }
        } else if (name == null) {
            throw new PickupValidationException("PICKUP_PERSON_REQUIRED",
                    "Either authorizedPersonId or name is required");
        }

        AuthorizedPickup existing = authorizedPerson != null
                ? authorizedPickupRepository.findActiveByChildAndPerson(child.getId(), authorizedPerson.getId())
                        .orElse(null)
                : authorizedPickupRepository.findActiveNameOnlyByChild(child.getId(), name).orElse(null);
        boolean created = existing == null;
        AuthorizedPickup pickup = created ? new AuthorizedPickup(child, authorizedPerson, name) : existing;
        if (!created && name != null) {
            pickup.setName(name);
        }
        pickup.setRelationship(request.relationship());
        pickup.setAuthorizationLevel(request.authorizationLevel());
        pickup.setPhoneNumber(trimToNull(request.phoneNumber()));
        pickup.setCustodyNotes(trimToNull(request.custodyNotes()));

        AuthorizedPickup saved;
        try {
            saved = authorizedPickupRepository.saveAndFlush(pickup);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "AUTHORIZED_PICKUP_EXISTS",
                    "An active authorization already exists for this person", ex);
        }

        audit(created ? "AUTHORIZED_PICKUP_CREATED" : "AUTHORIZED_PICKUP_UPDATED", saved);
        log.info("{} authorized pickup {} for child {} ({})", created ? "Created" : "Updated",
                saved.getId(), child.getId(), saved.getAuthorizationLevel());
        return PickupDtoMapper.toAuthorizedPickup(saved);
    }

    public AuthorizedPickupResponse update(String pickupId, UpdateAuthorizedPickupRequest request) {
        AuthorizedPickup pickup = loadPickup(pickupId);
        if (request.relationship() != null) {
            pickup.setRelationship(request.relationship());
        }
        if (request.authorizationLevel() != null) {
            pickup.setAuthorizationLevel(request.authorizationLevel());
        }
        if (request.phoneNumber() != null) {
            pickup.setPhoneNumber(trimToNull(request.phoneNumber()));
        }
        if (request.custodyNotes() != null) {
            pickup.setCustodyNotes(trimToNull(request.custodyNotes()));
        }
        if (request.active() != null) {
            pickup.setActive(request.active());
        }

        AuthorizedPickup saved;
        try {
            saved = authorizedPickupRepository.saveAndFlush(pickup);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "AUTHORIZED_PICKUP_EXISTS",
                    "Another active authorization exists for this person", ex);
        }
        audit("AUTHORIZED_PICKUP_UPDATED", saved);
        return PickupDtoMapper.toAuthorizedPickup(saved);
    }

    /**
     * Soft delete. Deactivating an inactive row is a no-op.
     */
    public void deactivate(String pickupId) {
        AuthorizedPickup pickup = loadPickup(pickupId);
        if (!pickup.isActive()) {
            return;
        }
        pickup.setActive(false);
        authorizedPickupRepository.save(pickup);
        audit("AUTHORIZED_PICKUP_DEACTIVATED", pickup);
        log.info("Deactivated authorized pickup {} for child {}", pickup.getId(), pickup.getChild().getId());
    }

    /**
     * Gives every active adult of the child's primary family an ALWAYS/PARENT authorization
     * unless an active one already exists. Safe to repeat and to run concurrently.
     *
     * @return number of rows created by this call
     */
    public int autoPopulate(String childId) {
        Person child = loadPerson(childId);
        if (child.getPrimaryFamilyId() == null) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int created = 0;
        List<FamilyMember> adults = familyMemberRepository.findActiveByFamilyIdAndRole(child.getPrimaryFamilyId(),
                FamilyRole.ADULT);
        for (FamilyMember adult : adults) {
            Person person = adult.getPerson();
            if (person.getId().equals(child.getId())) {
                continue;
            }
            created += authorizedPickupRepository.insertIfAbsent(UUID.randomUUID(), child.getId(), person.getId(),
                    PickupRelationship.PARENT.name(), AuthorizationLevel.ALWAYS.name(), now);
        }

        if (created > 0) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("created", created);
            auditLogService.record(new AuditLogCommand("AUTHORIZED_PICKUP_AUTO_POPULATED", "PERSON",
                    IdKeys.format(child.getId()), SecurityUtils.findCurrentStaffId().orElse(null), detail));
        }
        log.info("Auto-populated {} authorized pickups for child {}", created, child.getId());
        return created;
    }

    private void audit(String action, AuthorizedPickup pickup) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("childPersonId", IdKeys.format(pickup.getChild().getId()));
        detail.put("displayName", pickup.getDisplayName());
        detail.put("authorizationLevel", pickup.getAuthorizationLevel() != null
                ? pickup.getAuthorizationLevel().name()
                : null);
        detail.put("active", pickup.isActive());
        auditLogService.record(new AuditLogCommand(action, RESOURCE_TYPE, IdKeys.format(pickup.getId()),
                SecurityUtils.findCurrentStaffId().orElse(null), detail));
    }

    private Person loadPerson(String personId) {
        UUID id = IdKeys.parse(personId)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_PERSON_ID",
                        "Invalid person id"));
        return personRepository.findById(id)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PERSON_NOT_FOUND",
                        "Person not found"));
    }

    private AuthorizedPickup loadPickup(String pickupId) {
        UUID id = IdKeys.parse(pickupId)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_AUTHORIZED_PICKUP_ID",
                        "Invalid authorized pickup id"));
        return authorizedPickupRepository.findById(id)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "AUTHORIZED_PICKUP_NOT_FOUND",
                        "Authorized pickup not found"));
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
