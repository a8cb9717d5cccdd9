package com.roomkeeper.backend.modules.checkin.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

import com.roomkeeper.backend.global.common.IdKeys;
import com.roomkeeper.backend.global.error.ProblemException;
import com.roomkeeper.backend.modules.checkin.domain.CapacityStatus;
import com.roomkeeper.backend.modules.checkin.infrastructure.persistence.AttendanceRepository;
import com.roomkeeper.backend.modules.checkin.presentation.dto.RoomCapacityResponse;
import com.roomkeeper.backend.modules.directory.domain.CheckinLocation;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.CheckinLocationRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only occupancy view for room displays. Takes no lock, so it may lag in-flight check-ins.
 */
@Service
@Transactional(readOnly = true)
public class CapacityService {

    private final CheckinLocationRepository checkinLocationRepository;
    private final AttendanceRepository attendanceRepository;
    private final CheckinProperties properties;
    private final Clock clock;

    public CapacityService(
            CheckinLocationRepository checkinLocationRepository,
            AttendanceRepository attendanceRepository,
            CheckinProperties properties,
            Clock clock
    ) {
        this.checkinLocationRepository = checkinLocationRepository;
        this.attendanceRepository = attendanceRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public RoomCapacityResponse getCapacity(String locationId, LocalDate date) {
        CheckinLocation location = IdKeys.parse(locationId)
                .flatMap(checkinLocationRepository::findById)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "LOCATION_NOT_FOUND"));
        LocalDate occurrenceDate = date != null ? date : LocalDate.now(clock);
        long currentCount = attendanceRepository.countOpenByLocationAndDate(location.getId(), occurrenceDate);

        Integer limit = location.getEffectiveLimit();
        boolean canAccept = location.isActive() && (limit == null || currentCount < limit);
        CheckinLocation overflow = location.getOverflowLocation();

        return new RoomCapacityResponse(
                location.getId(),
                location.getName(),
                occurrenceDate,
                currentCount,
                location.getSoftCapacity(),
                location.getHardCapacity(),
                statusOf(location, currentCount),
                percentageFull(location, currentCount),
                canAccept,
                overflow != null ? overflow.getId() : null,
                overflow != null ? overflow.getName() : null
        );
    }

    /**
     * False only when the location is missing, inactive or full. The limit is the hard capacity, or the soft
     * capacity when no hard one is set.
     */
    public boolean canAcceptCheckin(UUID locationId, LocalDate date) {
        return checkinLocationRepository.findById(locationId)
                .map(location -> {
                    Integer limit = location.getEffectiveLimit();
                    if (!location.isActive()) {
                        return false;
                    }
                    if (limit == null) {
                        return true;
                    }
                    LocalDate occurrenceDate = date != null ? date : LocalDate.now(clock);
                    return attendanceRepository.countOpenByLocationAndDate(locationId, occurrenceDate) < limit;
                })
                .orElse(false);
    }

    CapacityStatus statusOf(CheckinLocation location, long currentCount) {
        Integer limit = location.getEffectiveLimit();
        if (limit == null) {
            return CapacityStatus.AVAILABLE;
        }
        if (currentCount >= limit) {
            return CapacityStatus.FULL;
        }
        Integer soft = location.getSoftCapacity();
        if (soft != null && currentCount >= soft) {
            return CapacityStatus.AT_SOFT_CAPACITY;
        }
        int base = soft != null ? soft : limit;
        if (base > 0 && currentCount * 100 >= (long) base * properties.capacity().warningThresholdPercent()) {
            return CapacityStatus.NEAR_CAPACITY;
        }
        return CapacityStatus.AVAILABLE;
    }

    private static int percentageFull(CheckinLocation location, long currentCount) {
        Integer base = location.getSoftCapacity() != null ? location.getSoftCapacity() : location.getHardCapacity();
        if (base == null || base <= 0) {
            return 0;
        }
        return (int) (currentCount * 100 / base);
    }
}
