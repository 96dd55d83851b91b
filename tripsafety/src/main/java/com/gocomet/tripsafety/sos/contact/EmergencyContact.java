package com.gocomet.tripsafety.sos.contact;

/**
 * Someone to notify when a user raises an SOS. Any of the addresses may be null.
 */
public record EmergencyContact(String name, String phone, String email, String pushToken) {
}
