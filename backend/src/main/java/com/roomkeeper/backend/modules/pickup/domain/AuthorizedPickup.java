package com.roomkeeper.backend.modules.pickup.domain;

import java.util.UUID;

import com.roomkeeper.backend.global.jpa.AbstractTimestampedEntity;
import com.roomkeeper.backend.modules.directory.domain.Person;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Standing authorization for someone to collect a child. Deactivated rather than deleted.
 */
@Entity
@Table(name = "authorized_pickup")
public class AuthorizedPickup extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "child_person_id", nullable = false, updatable = false)
    private Person child;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "authorized_person_id", updatable = false)
    private Person authorizedPerson;

    @Column(name = "name", length = 200)
    private String name;

    @Column(name = "phone_number", length = 40)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "relationship", nullable = false, length = 32)
    private PickupRelationship relationship;

    @Enumerated(EnumType.STRING)
    @Column(name = "authorization_level", nullable = false, length = 32)
    private AuthorizationLevel authorizationLevel;

    @Column(name = "custody_notes", length = 1000)
    private String custodyNotes;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    protected AuthorizedPickup() {
    }

    public AuthorizedPickup(Person child, Person authorizedPerson, String name) {
        this.child = child;
        this.authorizedPerson = authorizedPerson;
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public Person getChild() {
        return child;
    }

    public Person getAuthorizedPerson() {
        return authorizedPerson;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDisplayName() {
        return authorizedPerson != null ? authorizedPerson.getFullName() : name;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public PickupRelationship getRelationship() {
        return relationship;
    }

    public void setRelationship(PickupRelationship relationship) {
        this.relationship = relationship;
    }

    public AuthorizationLevel getAuthorizationLevel() {
        return authorizationLevel;
    }

    public void setAuthorizationLevel(AuthorizationLevel authorizationLevel) {
        this.authorizationLevel = authorizationLevel;
    }

    public String getCustodyNotes() {
        return custodyNotes;
    }

    public void setCustodyNotes(String custodyNotes) {
        this.custodyNotes = custodyNotes;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
