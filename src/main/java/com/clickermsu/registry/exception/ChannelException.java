package com.clickermsu.registry.exception;

import com.clickermsu.registry.sync.SyncErrorKind;

/**
 * The external channel could not be reached or refused a store, replace or fetch.
 */
public class ChannelException extends RegistryException {
    public ChannelException(String message) {
        this(message, null);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, "CHANNEL_ERROR", SyncErrorKind.CHANNEL_ERROR, cause);
    }
}
