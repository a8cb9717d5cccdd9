package com.roomkeeper.backend.modules.checkin.infrastructure.persistence;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.roomkeeper.backend.modules.checkin.domain.Attendance;

public interface AttendanceRepository extends JpaRepository<Attendance, UUID> {

    @Query("""
            select count(a) from Attendance a
             where a.occurrence.location.id = :locationId
               and a.occurrence.occurrenceDate = :occurrenceDate
               and a.endTime is null
            """)
    long countOpenByLocationAndDate(@Param("locationId") UUID locationId,
                                    @Param("occurrenceDate") LocalDate occurrenceDate);

    @Query("""
            select count(a) > 0 from Attendance a
             where a.person.id = :personId
               and a.occurrence.id = :occurrenceId
               and a.endTime is null
            """)
    boolean existsOpenByPersonAndOccurrence(@Param("personId") UUID personId,
                                            @Param("occurrenceId") UUID occurrenceId);

    @Query("""
            select count(a) > 0 from Attendance a
             where a.person.id = :personId
               and a.occurrence.location.id = :locationId
            """)
    boolean existsByPersonAndLocation(@Param("personId") UUID personId, @Param("locationId") UUID locationId);

    @Query("""
            select a from Attendance a
              join fetch a.person p
              join fetch a.occurrence o
              join fetch o.location l
              left join fetch a.securityCode sc
             where l.id = :locationId
               and o.occurrenceDate = :occurrenceDate
               and a.endTime is null
             order by p.lastName asc, p.firstName asc
            """)
    List<Attendance> findOpenByLocationAndDate(@Param("locationId") UUID locationId,
                                               @Param("occurrenceDate") LocalDate occurrenceDate);

    @Query("""
            select a from Attendance a
              join fetch a.person p
              join fetch a.occurrence o
              join fetch o.location l
              left join fetch a.securityCode sc
             where p.id = :personId
               and a.startTime >= :cutoff
             order by a.startTime desc
            """)
    List<Attendance> findByPersonStartedSince(@Param("personId") UUID personId,
                                              @Param("cutoff") OffsetDateTime cutoff);

    @Query("""
            select a from Attendance a
              join fetch a.person p
              join fetch a.occurrence o
              left join fetch a.securityCode sc
             where a.id = :id
            """)
    Optional<Attendance> findDetailedById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Attendance a where a.id = :id")
    Optional<Attendance> findByIdForUpdate(@Param("id") UUID id);
}
