package com.piscanner.agent;

public enum TransportStatus {
    SUCCESS,
    HTTP_ERROR,
    TIMEOUT,
    ERROR
}
