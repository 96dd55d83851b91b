package com.gocomet.tripsafety.admission.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
