package com.clickermsu.registry.dto;

import com.clickermsu.registry.model.InboundMessage;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bot message with an attached document, as forwarded by the bot adapter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadRequest implements InboundMessage {
    @NotNull(message = "ChatId cannot be null")
    private Long chatId;

    private Long messageId;

    @NotNull(message = "DocumentFileId cannot be null")
    private String documentFileId;
}
