package com.roomkeeper.backend.modules.directory.domain;

import java.util.UUID;

import com.roomkeeper.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A room children are checked into. Capacities are optional; a location with neither is unlimited.
 */
@Entity
@Table(name = "checkin_location")
public class CheckinLocation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "soft_capacity")
    private Integer softCapacity;

    @Column(name = "hard_capacity")
    private Integer hardCapacity;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "overflow_location_id")
    private CheckinLocation overflowLocation;

    @Column(name = "staff_to_child_ratio")
    private Integer staffToChildRatio;

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

    public Integer getSoftCapacity() {
        return softCapacity;
    }

    public void setSoftCapacity(Integer softCapacity) {
        this.softCapacity = softCapacity;
    }

    public Integer getHardCapacity() {
        return hardCapacity;
    }

    public void setHardCapacity(Integer hardCapacity) {
        this.hardCapacity = hardCapacity;
    }

    /**
     * The number of open attendances at which check-in is refused: the hard capacity, or the soft capacity
     * when only that one is configured. {@code null} means unlimited.
     */
    public Integer getEffectiveLimit() {
        return hardCapacity != null ? hardCapacity : softCapacity;
    }

    public CheckinLocation getOverflowLocation() {
        return overflowLocation;
    }

    public void setOverflowLocation(CheckinLocation overflowLocation) {
        this.overflowLocation = overflowLocation;
    }

    public Integer getStaffToChildRatio() {
        return staffToChildRatio;
    }

    public void setStaffToChildRatio(Integer staffToChildRatio) {
        this.staffToChildRatio = staffToChildRatio;
    }
}
