package com.roomkeeper.backend.modules.pickup.presentation;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.roomkeeper.backend.global.common.IdKeys;
import com.roomkeeper.backend.global.error.ProblemException;
import com.roomkeeper.backend.global.security.SecurityUtils;
import com.roomkeeper.backend.global.security.StaffRoles;
import com.roomkeeper.backend.global.web.RequestIdFilter;
import com.roomkeeper.backend.modules.pickup.application.PickupAttemptRateLimiter;
import com.roomkeeper.backend.modules.pickup.application.PickupAuthorizationService;
import com.roomkeeper.backend.modules.pickup.application.PickupRateLimitedException;
import com.roomkeeper.backend.modules.pickup.application.PickupValidationException;
import com.roomkeeper.backend.modules.pickup.domain.PickupCandidate;
import com.roomkeeper.backend.modules.pickup.presentation.dto.PickupLogResponse;
import com.roomkeeper.backend.modules.pickup.presentation.dto.PickupVerificationResponse;
import com.roomkeeper.backend.modules.pickup.presentation.dto.RecordPickupRequest;
import com.roomkeeper.backend.modules.pickup.presentation.dto.VerifyPickupRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/checkin")
@Tag(name = "Pickup", description = "Secure pickup verification and release log")
public class PickupController {

    private final PickupAuthorizationService pickupAuthorizationService;
    private final PickupAttemptRateLimiter rateLimiter;

    public PickupController(PickupAuthorizationService pickupAuthorizationService,
                            PickupAttemptRateLimiter rateLimiter) {
        this.pickupAuthorizationService = pickupAuthorizationService;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Rate limited per attendance and client address. Each attempt is counted before the code is checked;
     * authorized results clear the count and results that need a supervisor give their attempt back.
     */
    @PostMapping("/verify-pickup")
    @Operation(summary = "Check a security code and pickup person without releasing the child")
    public ResponseEntity<PickupVerificationResponse> verifyPickup(
            @Valid @RequestBody VerifyPickupRequest request,
            HttpServletRequest httpRequest
    ) {
        String attendanceKey = IdKeys.parse(request.attendanceId())
                .map(IdKeys::format)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ATTENDANCE_ID",
                        "Invalid attendance id"));
        PickupCandidate candidate = toCandidate(request.pickupPersonId(), request.pickupPersonName());
        String origin = RequestIdFilter.clientOrigin(httpRequest);
        if (!rateLimiter.tryReserveAttempt(attendanceKey, origin)) {
            long seconds = rateLimiter.getRetryAfter(attendanceKey, origin)
                    .map(Duration::toSeconds)
                    .map(value -> Math.max(1L, value))
                    .orElse(1L);
            throw new PickupRateLimitedException(seconds);
        }

        PickupVerificationResponse result;
        try {
            result = pickupAuthorizationService.verify(attendanceKey, candidate, request.securityCode());
        } catch (RuntimeException ex) {
            rateLimiter.releaseAttempt(attendanceKey, origin);
            throw ex;
        }
        if (result.authorized()) {
            rateLimiter.resetAttempts(attendanceKey, origin);
        } else if (result.requiresSupervisorOverride()) {
            rateLimiter.releaseAttempt(attendanceKey, origin);
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/record-pickup")
    @Operation(summary = "Release a child and append the pickup log entry")
    public ResponseEntity<PickupLogResponse> recordPickup(@Valid @RequestBody RecordPickupRequest request) {
        if (request.supervisorOverride()
                && !SecurityUtils.hasRole(StaffRoles.SUPERVISOR)
                && !SecurityUtils.hasRole(StaffRoles.ADMIN)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "SUPERVISOR_ROLE_REQUIRED",
                    "Only supervisors can record an override");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(pickupAuthorizationService.recordPickup(request));
    }

    @GetMapping("/people/{childId}/pickup-history")
    public ResponseEntity<List<PickupLogResponse>> pickupHistory(
            @PathVariable("childId") String childId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(pickupAuthorizationService.pickupHistory(childId, from, to));
    }

    private static PickupCandidate toCandidate(String personId, String name) {
        UUID id = null;
        if (StringUtils.hasText(personId)) {
            id = IdKeys.parse(personId)
                    .orElseThrow(() -> new PickupValidationException("INVALID_PICKUP_PERSON_ID",
                            "Invalid pickup person id"));
        }
        if (id == null && !StringUtils.hasText(name)) {
            throw new PickupValidationException("PICKUP_PERSON_REQUIRED",
                    "Either pickupPersonId or pickupPersonName is required");
        }
        return PickupCandidate.of(id, name);
    }
}
