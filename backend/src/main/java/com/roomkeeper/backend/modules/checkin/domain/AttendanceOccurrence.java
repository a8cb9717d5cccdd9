package com.roomkeeper.backend.modules.checkin.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.UUID;

import com.roomkeeper.backend.global.jpa.AbstractTimestampedEntity;
import com.roomkeeper.backend.modules.directory.domain.CheckinLocation;
import com.roomkeeper.backend.modules.directory.domain.CheckinSchedule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * One (location, schedule, date) instance. Created on the first check-in of the day and not changed afterwards.
 */
@Entity
@Table(
        name = "attendance_occurrence",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_attendance_occurrence_location_schedule_date",
                columnNames = {"location_id", "schedule_id", "occurrence_date"}
        )
)
public class AttendanceOccurrence extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "location_id", nullable = false, updatable = false)
    private CheckinLocation location;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "schedule_id", nullable = false, updatable = false)
    private CheckinSchedule schedule;

    @Column(name = "occurrence_date", nullable = false, updatable = false)
    private LocalDate occurrenceDate;

    @Column(name = "sunday_date", nullable = false, updatable = false)
    private LocalDate sundayDate;

    protected AttendanceOccurrence() {
    }

    public AttendanceOccurrence(CheckinLocation location, CheckinSchedule schedule, LocalDate occurrenceDate) {
        this.location = location;
        this.schedule = schedule;
        this.occurrenceDate = occurrenceDate;
        this.sundayDate = sundayDateOf(occurrenceDate);
    }

    /**
     * Week-ending Sunday used to group occurrences in weekly reports.
     */
    public static LocalDate sundayDateOf(LocalDate date) {
        return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
    }

    public UUID getId() {
        return id;
    }

    public CheckinLocation getLocation() {
        return location;
    }

    public CheckinSchedule getSchedule() {
        return schedule;
    }

    public LocalDate getOccurrenceDate() {
        return occurrenceDate;
    }

    public LocalDate getSundayDate() {
        return sundayDate;
    }
}
