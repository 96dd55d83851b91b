package com.gocomet.tripsafety.common.exception;

import java.util.UUID;

public class TripNotActiveException extends RuntimeException {

    public TripNotActiveException(UUID tripId, String operation) {
        super(String.format("Trip %s is not active; %s rejected", tripId, operation));
    }
}
