package com.gocomet.tripsafety.admission.model;

/**
 * Quota tiers. CRITICAL covers SOS trigger, live-tracking subscribe and
 * location ingest and is allotted a materially higher quota than STANDARD.
 */
public enum EndpointClass {
    CRITICAL,
    STANDARD
}
