package com.gocomet.tripsafety.sos.contact;

import com.gocomet.tripsafety.sos.config.SosProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Serves the contacts configured under app.sos.default-contacts for every user.
 * Stands in until the profile service exposes a lookup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredEmergencyContactDirectory implements EmergencyContactDirectory {

    private final SosProperties properties;

    @Override
    public List<EmergencyContact> contactsOf(String userId) {
        List<EmergencyContact> contacts = properties.getDefaultContacts().stream()
                .map(c -> new EmergencyContact(c.getName(), c.getPhone(), c.getEmail(), c.getPushToken()))
                .toList();
        if (contacts.isEmpty()) {
            log.warn("No emergency contacts known for user {}", userId);
        }
        return contacts;
    }
}
