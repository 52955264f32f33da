package com.kg.core.service.ingest;

public enum CommitterState {
    IDLE,
    ACCUMULATING,
    FLUSHING
}
