package com.roomkeeper.backend.modules.directory.domain;

public enum FamilyRole {
    ADULT,
    CHILD
}
