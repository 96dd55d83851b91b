package com.gocomet.tripsafety.common.exception;

import java.util.UUID;

/**
 * The SOS record could not be stored after every retry. Callers must fall back
 * to a direct emergency channel.
 */
public class SosPersistenceException extends RuntimeException {

    public SosPersistenceException(UUID tripId, int attempts, Throwable cause) {
        super(String.format("Could not persist SOS alert for trip %s after %d attempts", tripId, attempts), cause);
    }
}
