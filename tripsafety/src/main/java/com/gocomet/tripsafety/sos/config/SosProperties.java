package com.gocomet.tripsafety.sos.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.sos")
public class SosProperties {

    // time operators have to acknowledge before the alert escalates
    private Duration acknowledgeWindow = Duration.ofSeconds(30);

    private int persistMaxAttempts = 4;
    private Duration persistInitialBackoff = Duration.ofMillis(100);
    private Duration persistMaxBackoff = Duration.ofSeconds(2);

    // on-call line dialled when an alert escalates
    private String onCallNumber = "+910000000000";

    private String operatorDashboardRecipient = "operators";

    // base of the live-location page linked from every SOS message
    private String trackingLinkBaseUrl = "https://safety.gocomet.example";

    // newest continuous-tracking points kept per alert
    private int locationTrailLimit = 100;

    // used when the profile service has no contacts for a user
    private List<Contact> defaultContacts = new ArrayList<>();

    @Getter
    @Setter
    public static class Contact {
        private String name;
        private String phone;
        private String email;
        private String pushToken;
    }
}
