package com.gocomet.tripsafety.sos.model;

public enum TriggeredByRole {
    PASSENGER,
    DRIVER
}
