package com.clickermsu.registry.sync;

public enum SyncErrorKind {
    CHANNEL_ERROR,
    DECODE_ERROR
}
