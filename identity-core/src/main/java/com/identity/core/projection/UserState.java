package com.identity.core.projection;

public enum UserState {
    UNSPECIFIED,
    ACTIVE,
    INACTIVE,
    DELETED,
    LOCKED,
    INITIAL
}
