package com.roomkeeper.backend.modules.checkin.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.roomkeeper.backend.global.common.IdKeys;
import com.roomkeeper.backend.modules.checkin.domain.Attendance;
import com.roomkeeper.backend.modules.checkin.domain.AttendanceOccurrence;
import com.roomkeeper.backend.modules.checkin.domain.CheckinFailureReason;
import com.roomkeeper.backend.modules.checkin.domain.ScheduleWindow;
import com.roomkeeper.backend.modules.checkin.domain.SecurityCode;
import com.roomkeeper.backend.modules.checkin.infrastructure.persistence.AttendanceOccurrenceRepository;
import com.roomkeeper.backend.modules.checkin.infrastructure.persistence.AttendanceRepository;
import com.roomkeeper.backend.modules.checkin.presentation.dto.AttendanceSummaryResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.BatchCheckinResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckinDtoMapper;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckinRequest;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckinResultResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckinValidationResponse;
import com.roomkeeper.backend.modules.directory.domain.CheckinLocation;
import com.roomkeeper.backend.modules.directory.domain.CheckinSchedule;
import com.roomkeeper.backend.modules.directory.domain.Person;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.CheckinLocationRepository;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.CheckinScheduleRepository;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.PersonRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.util.StringUtils;

/**
 * Admits people into locations and releases them. The only writer of attendance rows.
 * Refusals are returned as {@link CheckinResultResponse} values. Lock timeouts, an exhausted code space
 * and storage errors are thrown.
 */
@Service
@Transactional
public class CheckinService {

    private static final Logger log = LoggerFactory.getLogger(CheckinService.class);

    static final String OPEN_ATTENDANCE_CONSTRAINT = "uq_attendance_open_person_occurrence";

    private final PersonRepository personRepository;
    private final CheckinLocationRepository checkinLocationRepository;
    private final CheckinScheduleRepository checkinScheduleRepository;
    private final AttendanceOccurrenceRepository attendanceOccurrenceRepository;
    private final AttendanceRepository attendanceRepository;
    private final LocationLockManager locationLockManager;
    private final SecurityCodeIssuer securityCodeIssuer;
    private final TransactionOperations requiresNewTransaction;
    private final CheckinProperties properties;
    private final Clock clock;

    public CheckinService(
            PersonRepository personRepository,
            CheckinLocationRepository checkinLocationRepository,
            CheckinScheduleRepository checkinScheduleRepository,
            AttendanceOccurrenceRepository attendanceOccurrenceRepository,
            AttendanceRepository attendanceRepository,
            LocationLockManager locationLockManager,
            SecurityCodeIssuer securityCodeIssuer,
            TransactionOperations requiresNewTransaction,
            CheckinProperties properties,
            Clock clock
    ) {
        this.personRepository = personRepository;
        this.checkinLocationRepository = checkinLocationRepository;
        this.checkinScheduleRepository = checkinScheduleRepository;
        this.attendanceOccurrenceRepository = attendanceOccurrenceRepository;
        this.attendanceRepository = attendanceRepository;
        this.locationLockManager = locationLockManager;
        this.securityCodeIssuer = securityCodeIssuer;
        this.requiresNewTransaction = requiresNewTransaction;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs outside any caller transaction: the guarded section opens and commits its own
     * transaction while the location lock is held.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public CheckinResultResponse checkIn(CheckinRequest request) {
        Optional<UUID> personId = IdKeys.parse(request.personId());
        if (personId.isEmpty()) {
            return CheckinResultResponse.refused(CheckinFailureReason.INVALID_PERSON_ID, "Invalid person id");
        }
        Optional<UUID> locationId = IdKeys.parse(request.locationId());
        Optional<UUID> scheduleId = IdKeys.parse(request.scheduleId());
        if (locationId.isEmpty() || scheduleId.isEmpty()) {
            return CheckinResultResponse.refused(CheckinFailureReason.INVALID_LOCATION_OR_SCHEDULE_ID,
                    "Invalid location or schedule id");
        }

        CheckinResultResponse result = locationLockManager.executeWithLocationLock(locationId.get(),
                () -> requiresNewTransaction.execute(status ->
                        admit(status, personId.get(), locationId.get(), scheduleId.get(), request)));

        if (result.success()) {
            log.info("Checked in person {} to location {} (attendance {})",
                    personId.get(), locationId.get(), result.attendanceId());
        } else {
            log.info("Check-in of person {} to location {} refused: {}",
                    personId.get(), locationId.get(), result.failureReason());
        }
        return result;
    }

    /**
     * Items are processed one after another, each in its own transaction; a refused item never undoes another.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public BatchCheckinResponse batchCheckIn(List<CheckinRequest> requests) {
        List<CheckinResultResponse> results = new ArrayList<>(requests.size());
        for (CheckinRequest request : requests) {
            results.add(checkIn(request));
        }
        BatchCheckinResponse response = BatchCheckinResponse.of(results);
        log.info("Batch check-in finished: {} succeeded, {} refused", response.successCount(), response.failureCount());
        return response;
    }

    /**
     * @return {@code true} only for the call that actually closed the attendance
     */
    public boolean checkOut(String attendanceId) {
        Optional<UUID> id = IdKeys.parse(attendanceId);
        if (id.isEmpty()) {
            return false;
        }
        return attendanceRepository.findByIdForUpdate(id.get())
                .map(attendance -> {
                    boolean closed = attendance.close(OffsetDateTime.now(clock));
                    if (closed) {
                        log.info("Checked out attendance {}", attendance.getId());
                    } else {
                        log.debug("Attendance {} was already closed", attendance.getId());
                    }
                    return closed;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<AttendanceSummaryResponse> currentOccupants(String locationId) {
        Optional<UUID> id = IdKeys.parse(locationId);
        if (id.isEmpty()) {
            return List.of();
        }
        LocalDate today = LocalDate.now(clock);
        return attendanceRepository.findOpenByLocationAndDate(id.get(), today).stream()
                .map(attendance -> CheckinDtoMapper.toAttendanceSummary(attendance, today))
                .toList();
    }

    /**
     * A window of zero (or less) days means no window at all and yields an empty list.
     */
    @Transactional(readOnly = true)
    public List<AttendanceSummaryResponse> personHistory(String personId, int windowDays) {
        Optional<UUID> id = IdKeys.parse(personId);
        if (id.isEmpty() || windowDays <= 0) {
            return List.of();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        return attendanceRepository.findByPersonStartedSince(id.get(), now.minusDays(windowDays)).stream()
                .map(attendance -> CheckinDtoMapper.toAttendanceSummary(attendance, today))
                .toList();
    }

    /**
     * Evaluates today's check-in rules without locking or writing anything.
     */
    @Transactional(readOnly = true)
    public CheckinValidationResponse validateCheckin(String personId, String locationId, String scheduleId) {
        Optional<UUID> person = IdKeys.parse(personId);
        if (person.isEmpty()) {
            return new CheckinValidationResponse(false, CheckinFailureReason.INVALID_PERSON_ID, "Invalid person id");
        }
        Optional<UUID> location = IdKeys.parse(locationId);
        Optional<UUID> schedule = IdKeys.parse(scheduleId);
        if (location.isEmpty() || schedule.isEmpty()) {
            return new CheckinValidationResponse(false, CheckinFailureReason.INVALID_LOCATION_OR_SCHEDULE_ID,
                    "Invalid location or schedule id");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        Eligibility eligibility = evaluate(
                personRepository.findById(person.get()).orElse(null),
                checkinLocationRepository.findById(location.get()).orElse(null),
                checkinScheduleRepository.findById(schedule.get()).orElse(null),
                attendanceOccurrenceRepository.findByLocationScheduleAndDate(location.get(), schedule.get(), today)
                        .orElse(null),
                today,
                now
        );
        if (!eligibility.allowed()) {
            return new CheckinValidationResponse(false, eligibility.reason(), eligibility.message());
        }
        return new CheckinValidationResponse(true, null, "Check-in allowed");
    }

    private CheckinResultResponse admit(TransactionStatus status, UUID personId, UUID locationId, UUID scheduleId,
                                        CheckinRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        LocalDate occurrenceDate = request.occurrenceDate() != null ? request.occurrenceDate() : today;

        Person person = personRepository.findById(personId).orElse(null);
        CheckinLocation location = checkinLocationRepository.findByIdForUpdate(locationId).orElse(null);
        CheckinSchedule schedule = checkinScheduleRepository.findById(scheduleId).orElse(null);
        AttendanceOccurrence existingOccurrence = attendanceOccurrenceRepository
                .findByLocationScheduleAndDate(locationId, scheduleId, occurrenceDate)
                .orElse(null);

        Eligibility eligibility = evaluate(person, location, schedule, existingOccurrence, occurrenceDate, now);
        if (!eligibility.allowed()) {
            return CheckinResultResponse.refused(eligibility.reason(), eligibility.message());
        }

        AttendanceOccurrence occurrence = existingOccurrence != null
                ? existingOccurrence
                : attendanceOccurrenceRepository.save(new AttendanceOccurrence(location, schedule, occurrenceDate));

        boolean firstTime = !attendanceRepository.existsByPersonAndLocation(personId, locationId);
        Attendance attendance = new Attendance(occurrence, person, now);
        attendance.setFirstTime(firstTime);
        if (StringUtils.hasText(request.note())) {
            attendance.setNote(request.note().trim());
        }

        SecurityCode securityCode = null;
        if (request.generateSecurityCode()) {
            securityCode = securityCodeIssuer.issue(today);
            attendance.setSecurityCode(securityCode);
        }

        Attendance saved;
        try {
            saved = attendanceRepository.saveAndFlush(attendance);
        } catch (DataIntegrityViolationException ex) {
            if (isOpenAttendanceViolation(ex)) {
                status.setRollbackOnly();
                return CheckinResultResponse.refused(CheckinFailureReason.ALREADY_CHECKED_IN,
                        "Person is already checked in");
            }
            throw ex;
        }

        long occupancy = eligibility.currentCount() + 1;
        return new CheckinResultResponse(
                true,
                null,
                "Checked in to " + location.getName(),
                saved.getId(),
                securityCode != null ? securityCode.getCode() : null,
                now,
                CheckinDtoMapper.toPersonSummary(person, today),
                CheckinDtoMapper.toLocationSummary(location, occupancy),
                firstTime,
                isNearCapacity(location, occupancy)
        );
    }

    private Eligibility evaluate(Person person, CheckinLocation location, CheckinSchedule schedule,
                                 AttendanceOccurrence occurrence, LocalDate occurrenceDate, OffsetDateTime now) {
        if (person == null) {
            return Eligibility.refused(CheckinFailureReason.INVALID_PERSON_ID, "Person not found");
        }
        if (person.isDeceased()) {
            return Eligibility.refused(CheckinFailureReason.PERSON_DECEASED, "Person is marked as deceased");
        }
        if (!person.isActive()) {
            return Eligibility.refused(CheckinFailureReason.PERSON_INACTIVE, "Person is inactive");
        }
        if (location == null || schedule == null) {
            return Eligibility.refused(CheckinFailureReason.INVALID_LOCATION_OR_SCHEDULE_ID,
                    "Location or schedule not found");
        }
        if (!location.isActive()) {
            return Eligibility.refused(CheckinFailureReason.LOCATION_INACTIVE, "Location is inactive");
        }
        if (!schedule.isActive()) {
            return Eligibility.refused(CheckinFailureReason.OUTSIDE_SCHEDULE_WINDOW, "Schedule is not active");
        }
        if (properties.enforceScheduleWindow()
                && occurrenceDate.equals(now.toLocalDate())
                && !ScheduleWindow.isOpen(schedule, now.toLocalDateTime())) {
            return Eligibility.refused(CheckinFailureReason.OUTSIDE_SCHEDULE_WINDOW,
                    "Check-in is not open for " + schedule.getName());
        }
        if (occurrence != null && attendanceRepository.existsOpenByPersonAndOccurrence(person.getId(), occurrence.getId())) {
            return Eligibility.refused(CheckinFailureReason.ALREADY_CHECKED_IN, "Person is already checked in");
        }

        long currentCount = attendanceRepository.countOpenByLocationAndDate(location.getId(), occurrenceDate);
        Integer limit = location.getEffectiveLimit();
        if (limit != null && currentCount >= limit) {
            return Eligibility.refused(CheckinFailureReason.AT_CAPACITY, "Location is at capacity");
        }
        return Eligibility.admitted(currentCount);
    }

    private boolean isNearCapacity(CheckinLocation location, long occupancy) {
        Integer base = location.getSoftCapacity() != null ? location.getSoftCapacity() : location.getHardCapacity();
        if (base == null || base <= 0) {
            return false;
        }
        return occupancy * 100 >= (long) base * properties.capacity().warningThresholdPercent();
    }

    private boolean isOpenAttendanceViolation(DataIntegrityViolationException ex) {
        Throwable mostSpecificCause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = mostSpecificCause != null ? mostSpecificCause.getMessage() : ex.getMessage();
        return message != null && message.contains(OPEN_ATTENDANCE_CONSTRAINT);
    }

    private record Eligibility(CheckinFailureReason reason, String message, long currentCount) {

        static Eligibility refused(CheckinFailureReason reason, String message) {
            return new Eligibility(reason, message, 0);
        }

        static Eligibility admitted(long currentCount) {
            return new Eligibility(null, null, currentCount);
        }

        boolean allowed() {
            return reason == null;
        }
    }
}
