package com.roomkeeper.backend.modules.directory.domain;

public enum PersonStatus {
    ACTIVE,
    INACTIVE
}
