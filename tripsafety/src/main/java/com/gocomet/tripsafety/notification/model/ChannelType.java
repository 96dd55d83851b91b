package com.gocomet.tripsafety.notification.model;

public enum ChannelType {
    PUSH,
    SMS,
    EMAIL,
    DASHBOARD,
    VOICE,
    SOS_ESCALATION_TIMER  // internal: fires the acknowledge-window check of an SOS alert
}
