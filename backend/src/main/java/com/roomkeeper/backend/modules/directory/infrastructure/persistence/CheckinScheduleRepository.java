package com.roomkeeper.backend.modules.directory.infrastructure.persistence;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.roomkeeper.backend.modules.directory.domain.CheckinSchedule;

public interface CheckinScheduleRepository extends JpaRepository<CheckinSchedule, UUID> {
}
