package com.roomkeeper.backend.modules.pickup.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.roomkeeper.backend.modules.checkin.domain.Attendance;
import com.roomkeeper.backend.modules.directory.domain.Person;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * One completed release of a child. Written once, never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "pickup_log")
public class PickupLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "attendance_id", nullable = false, updatable = false)
    private Attendance attendance;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "child_person_id", nullable = false, updatable = false)
    private Person child;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pickup_person_id", updatable = false)
    private Person pickupPerson;

    @Column(name = "pickup_person_name", length = 200, updatable = false)
    private String pickupPersonName;

    @Column(name = "was_authorized", nullable = false, updatable = false)
    private boolean wasAuthorized;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "authorized_pickup_id", updatable = false)
    private AuthorizedPickup authorizedPickup;

    @Column(name = "supervisor_override", nullable = false, updatable = false)
    private boolean supervisorOverride;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "supervisor_person_id", updatable = false)
    private Person supervisor;

    @Column(name = "checkout_time", nullable = false, updatable = false)
    private OffsetDateTime checkoutTime;

    @Column(name = "notes", length = 1000, updatable = false)
    private String notes;

    protected PickupLog() {
    }

    public PickupLog(Attendance attendance, Person child, OffsetDateTime checkoutTime) {
        this.attendance = attendance;
        this.child = child;
        this.checkoutTime = checkoutTime;
    }

    public UUID getId() {
        return id;
    }

    public Attendance getAttendance() {
        return attendance;
    }

    public Person getChild() {
        return child;
    }

    public Person getPickupPerson() {
        return pickupPerson;
    }

    public void setPickupPerson(Person pickupPerson) {
        this.pickupPerson = pickupPerson;
    }

    public String getPickupPersonName() {
        return pickupPersonName;
    }

    public void setPickupPersonName(String pickupPersonName) {
        this.pickupPersonName = pickupPersonName;
    }

    public boolean isWasAuthorized() {
        return wasAuthorized;
    }

    public void setWasAuthorized(boolean wasAuthorized) {
        this.wasAuthorized = wasAuthorized;
    }

    public AuthorizedPickup getAuthorizedPickup() {
        return authorizedPickup;
    }

    public void setAuthorizedPickup(AuthorizedPickup authorizedPickup) {
        this.authorizedPickup = authorizedPickup;
    }

    public boolean isSupervisorOverride() {
        return supervisorOverride;
    }

    public void setSupervisorOverride(boolean supervisorOverride) {
        this.supervisorOverride = supervisorOverride;
    }

    public Person getSupervisor() {
        return supervisor;
    }

    public void setSupervisor(Person supervisor) {
        this.supervisor = supervisor;
    }

    public OffsetDateTime getCheckoutTime() {
        return checkoutTime;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
