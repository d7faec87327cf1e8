package com.clickermsu.registry.model;

/**
 * The parts of an inbound bot message the registry reads. Adapters for the messaging
 * framework implement this instead of handing over the framework's own message type.
 */
public interface InboundMessage {

    Long getChatId();

    Long getMessageId();

    /**
     * File id of the attached document, or {@code null} when the message carries none.
     */
    String getDocumentFileId();
}
