package com.clickermsu.registry.model;

import lombok.Value;

/**
 * Blob reference of a document sent to the bot, echoed back so an operator can use it
 * as the default snapshot pointer.
 */
@Value
public class UploadReceipt {
    Long chatId;
    Long messageId;
    String blobId;
}
