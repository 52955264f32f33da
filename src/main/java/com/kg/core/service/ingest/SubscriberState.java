package com.kg.core.service.ingest;

public enum SubscriberState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
