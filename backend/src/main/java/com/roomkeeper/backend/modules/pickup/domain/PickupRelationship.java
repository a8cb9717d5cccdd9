package com.roomkeeper.backend.modules.pickup.domain;

public enum PickupRelationship {
    PARENT,
    GUARDIAN,
    GRANDPARENT,
    SIBLING,
    OTHER_RELATIVE,
    FRIEND,
    OTHER
}
