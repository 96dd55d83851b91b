package com.gocomet.tripsafety.sos.model;

public enum ChannelResultStatus {
    SUCCESS,
    FAILURE
}
