package com.roomkeeper.backend.support;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.roomkeeper.backend.modules.checkin.domain.Attendance;
import com.roomkeeper.backend.modules.checkin.domain.AttendanceOccurrence;
import com.roomkeeper.backend.modules.directory.domain.CheckinLocation;
import com.roomkeeper.backend.modules.directory.domain.CheckinSchedule;
import com.roomkeeper.backend.modules.directory.domain.Person;
import com.roomkeeper.backend.modules.directory.domain.PersonStatus;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Detached entities with fixed ids for Mockito-based tests.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, UUID id) {
        ReflectionTestUtils.setField(entity, "id", id);
        return entity;
    }

    public static Person person(UUID id, String firstName, String lastName) {
        Person person = new Person();
        person.setFirstName(firstName);
        person.setLastName(lastName);
        person.setFullName(firstName + " " + lastName);
        person.setStatus(PersonStatus.ACTIVE);
        return withId(person, id);
    }

    public static CheckinLocation location(UUID id, String name, Integer softCapacity, Integer hardCapacity) {
        CheckinLocation location = new CheckinLocation();
        location.setName(name);
        location.setActive(true);
        location.setSoftCapacity(softCapacity);
        location.setHardCapacity(hardCapacity);
        return withId(location, id);
    }

    /**
     * Active schedule without a weekly time, so its window is always open.
     */
    public static CheckinSchedule anytimeSchedule(UUID id) {
        CheckinSchedule schedule = new CheckinSchedule();
        schedule.setName("Any time");
        schedule.setActive(true);
        return withId(schedule, id);
    }

    public static CheckinSchedule weeklySchedule(UUID id, DayOfWeek day, LocalTime time) {
        CheckinSchedule schedule = anytimeSchedule(id);
        schedule.setName(day + " " + time);
        schedule.setWeeklyDayOfWeek(day);
        schedule.setWeeklyTimeOfDay(time);
        return schedule;
    }

    public static Attendance attendance(UUID id, AttendanceOccurrence occurrence, Person person,
                                        OffsetDateTime startTime) {
        return withId(new Attendance(occurrence, person, startTime), id);
    }
}
