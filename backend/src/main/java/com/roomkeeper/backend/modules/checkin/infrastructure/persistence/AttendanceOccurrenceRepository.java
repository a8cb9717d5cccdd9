package com.roomkeeper.backend.modules.checkin.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.roomkeeper.backend.modules.checkin.domain.AttendanceOccurrence;

public interface AttendanceOccurrenceRepository extends JpaRepository<AttendanceOccurrence, UUID> {

    @Query("""
            select o from AttendanceOccurrence o
             where o.location.id = :locationId
               and o.schedule.id = :scheduleId
               and o.occurrenceDate = :occurrenceDate
            """)
    Optional<AttendanceOccurrence> findByLocationScheduleAndDate(
            @Param("locationId") UUID locationId,
            @Param("scheduleId") UUID scheduleId,
            @Param("occurrenceDate") LocalDate occurrenceDate
    );
}
