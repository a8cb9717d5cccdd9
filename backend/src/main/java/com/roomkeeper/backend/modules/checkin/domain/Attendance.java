package com.roomkeeper.backend.modules.checkin.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.roomkeeper.backend.global.jpa.AbstractTimestampedEntity;
import com.roomkeeper.backend.modules.directory.domain.Person;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A person's presence interval at an occurrence. Rows are closed by setting the end time, never deleted.
 */
@Entity
@Table(name = "attendance")
public class Attendance extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "occurrence_id", nullable = false, updatable = false)
    private AttendanceOccurrence occurrence;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "person_id", nullable = false, updatable = false)
    private Person person;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "security_code_id", updatable = false)
    private SecurityCode securityCode;

    @Column(name = "start_time", nullable = false, updatable = false)
    private OffsetDateTime startTime;

    @Column(name = "end_time")
    private OffsetDateTime endTime;

    @Column(name = "did_attend", nullable = false)
    private boolean didAttend = true;

    @Column(name = "is_first_time", nullable = false, updatable = false)
    private boolean firstTime;

    @Column(name = "note", length = 500)
    private String note;

    protected Attendance() {
    }

    public Attendance(AttendanceOccurrence occurrence, Person person, OffsetDateTime startTime) {
        this.occurrence = occurrence;
        this.person = person;
        this.startTime = startTime;
    }

    public UUID getId() {
        return id;
    }

    public AttendanceOccurrence getOccurrence() {
        return occurrence;
    }

    public Person getPerson() {
        return person;
    }

    public SecurityCode getSecurityCode() {
        return securityCode;
    }

    public void setSecurityCode(SecurityCode securityCode) {
        this.securityCode = securityCode;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public OffsetDateTime getEndTime() {
        return endTime;
    }

    public boolean isOpen() {
        return endTime == null;
    }

    /**
     * @return {@code false} when the attendance was already closed
     */
    public boolean close(OffsetDateTime closedAt) {
        if (!isOpen()) {
            return false;
        }
        this.endTime = closedAt;
        return true;
    }

    public boolean isDidAttend() {
        return didAttend;
    }

    public boolean isFirstTime() {
        return firstTime;
    }

    public void setFirstTime(boolean firstTime) {
        this.firstTime = firstTime;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }
}
