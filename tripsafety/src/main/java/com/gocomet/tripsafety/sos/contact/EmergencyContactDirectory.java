package com.gocomet.tripsafety.sos.contact;

import java.util.List;

/**
 * Lookup of a user's emergency contacts, owned by the profile service.
 */
public interface EmergencyContactDirectory {

    List<EmergencyContact> contactsOf(String userId);
}
