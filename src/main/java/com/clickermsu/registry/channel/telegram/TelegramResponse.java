package com.clickermsu.registry.channel.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bot API envelope: {@code {"ok": true, "result": ...}} or
 * {@code {"ok": false, "error_code": 400, "description": "..."}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramResponse<T> {
    private boolean ok;

    @JsonProperty("error_code")
    private Integer errorCode;

    private String description;
    private T result;
}
