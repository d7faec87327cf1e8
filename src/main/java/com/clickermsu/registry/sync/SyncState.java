package com.clickermsu.registry.sync;

public enum SyncState {
    IDLE,
    PUSHING
}
