package com.roomkeeper.backend.modules.directory.domain;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.UUID;

import com.roomkeeper.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "checkin_schedule")
public class CheckinSchedule extends AbstractTimestampedEntity {

    public static final int DEFAULT_START_OFFSET_MINUTES = 60;
    public static final int DEFAULT_END_OFFSET_MINUTES = 30;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "weekly_day_of_week", length = 16)
    private DayOfWeek weeklyDayOfWeek;

    @Column(name = "weekly_time_of_day")
    private LocalTime weeklyTimeOfDay;

    @Column(name = "checkin_start_offset_minutes", nullable = false)
    private int checkinStartOffsetMinutes = DEFAULT_START_OFFSET_MINUTES;

    @Column(name = "checkin_end_offset_minutes", nullable = false)
    private int checkinEndOffsetMinutes = DEFAULT_END_OFFSET_MINUTES;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public DayOfWeek getWeeklyDayOfWeek() {
        return weeklyDayOfWeek;
    }

    public void setWeeklyDayOfWeek(DayOfWeek weeklyDayOfWeek) {
        this.weeklyDayOfWeek = weeklyDayOfWeek;
    }

    public LocalTime getWeeklyTimeOfDay() {
        return weeklyTimeOfDay;
    }

    public void setWeeklyTimeOfDay(LocalTime weeklyTimeOfDay) {
        this.weeklyTimeOfDay = weeklyTimeOfDay;
    }

    public boolean isWeekly() {
        return weeklyDayOfWeek != null && weeklyTimeOfDay != null;
    }

    public int getCheckinStartOffsetMinutes() {
        return checkinStartOffsetMinutes;
    }

    public void setCheckinStartOffsetMinutes(int checkinStartOffsetMinutes) {
        this.checkinStartOffsetMinutes = checkinStartOffsetMinutes;
    }

    public int getCheckinEndOffsetMinutes() {
        return checkinEndOffsetMinutes;
    }

    public void setCheckinEndOffsetMinutes(int checkinEndOffsetMinutes) {
        this.checkinEndOffsetMinutes = checkinEndOffsetMinutes;
    }
}
