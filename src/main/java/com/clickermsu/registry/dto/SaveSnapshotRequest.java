package com.clickermsu.registry.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SaveSnapshotRequest {
    @NotNull(message = "ChatId cannot be null")
    private Long chatId;
}
