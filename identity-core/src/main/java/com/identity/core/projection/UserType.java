package com.identity.core.projection;

public enum UserType {
    UNSPECIFIED,
    HUMAN,
    MACHINE
}
