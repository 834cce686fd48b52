package com.my.memory.domain.model;

public enum SyncState {
    IDLE,
    SCANNING,
    APPLYING,
    WATCHING,
    ERROR
}
