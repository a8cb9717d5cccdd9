package com.roomkeeper.backend.modules.directory.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.roomkeeper.backend.modules.directory.domain.CheckinLocation;

public interface CheckinLocationRepository extends JpaRepository<CheckinLocation, UUID> {

    /**
     * Row lock that serializes check-ins to one location across service instances sharing the database.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from CheckinLocation l where l.id = :id")
    Optional<CheckinLocation> findByIdForUpdate(@Param("id") UUID id);
}
