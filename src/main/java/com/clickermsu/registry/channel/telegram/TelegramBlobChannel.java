package com.clickermsu.registry.channel.telegram;

import com.clickermsu.registry.channel.BlobChannel;
import com.clickermsu.registry.channel.StoredBlob;
import com.clickermsu.registry.exception.ChannelException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * {@link BlobChannel} over the Telegram Bot API. Blobs are documents: {@code sendDocument}
 * stores, {@code editMessageMedia} replaces and {@code getFile} plus the file endpoint fetch.
 */
@Component
public class TelegramBlobChannel implements BlobChannel {

    private static final Logger logger = LoggerFactory.getLogger(TelegramBlobChannel.class);

    private static final String ATTACHMENT_NAME = "snapshot";
    private static final ParameterizedTypeReference<TelegramResponse<TelegramMessage>> MESSAGE_RESPONSE =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<TelegramResponse<TelegramFile>> FILE_RESPONSE =
        new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String botToken;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public TelegramBlobChannel(
            RestTemplateBuilder restTemplateBuilder,
            @Value("${telegram.api.base-url:https://api.telegram.org}") String baseUrl,
            @Value("${telegram.bot.token:}") String botToken,
            @Value("${telegram.api.timeout-ms:10000}") long timeoutMs) {
        this(restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build(),
            baseUrl,
            botToken);
    }

    TelegramBlobChannel(RestTemplate restTemplate, String baseUrl, String botToken) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.botToken = botToken;
    }

    @Override
    public StoredBlob store(long channelId, String fileName, byte[] content) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(channelId));
        body.add("document", documentPart(fileName, content));

        TelegramMessage message = postMultipart("sendDocument", body);
        return toStoredBlob("sendDocument", message, channelId);
    }

    @Override
    public StoredBlob replace(long channelId, long messageId, String fileName, byte[] content) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(channelId));
        body.add("message_id", String.valueOf(messageId));
        body.add("media", mediaDescriptor());
        body.add(ATTACHMENT_NAME, documentPart(fileName, content));

        TelegramMessage message = postMultipart("editMessageMedia", body);
        StoredBlob stored = toStoredBlob("editMessageMedia", message, channelId);
        return new StoredBlob(channelId, messageId, stored.getBlobId());
    }

    @Override
    public byte[] fetch(String blobId) {
        if (blobId == null || blobId.isBlank()) {
            throw new ChannelException("Blob id cannot be null or empty");
        }

        TelegramFile file = getFile(blobId);
        if (file.getFilePath() == null || file.getFilePath().isBlank()) {
            throw new ChannelException("Telegram getFile returned no file path for blob " + blobId);
        }

        try {
            byte[] content = restTemplate.getForObject(
                baseUrl + "/file/bot" + botToken + "/" + file.getFilePath(), byte[].class);
            if (content == null) {
                throw new ChannelException("Telegram returned an empty body for blob " + blobId);
            }
            logger.debug("Fetched {} byte(s) for blob {}", content.length, blobId);
            return content;
        } catch (RestClientException e) {
            throw new ChannelException("Failed to download blob " + blobId + ": " + redact(e.getMessage()), e);
        }
    }

    private TelegramFile getFile(String blobId) {
        TelegramResponse<TelegramFile> response;
        try {
            ResponseEntity<TelegramResponse<TelegramFile>> entity = restTemplate.exchange(
                methodUrl("getFile") + "?file_id={fileId}", HttpMethod.GET, null, FILE_RESPONSE, blobId);
            response = entity.getBody();
        } catch (RestClientException e) {
            throw new ChannelException("Telegram getFile failed: " + redact(e.getMessage()), e);
        }
        return unwrap("getFile", response);
    }

    private TelegramMessage postMultipart(String method, MultiValueMap<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        TelegramResponse<TelegramMessage> response;
        try {
            ResponseEntity<TelegramResponse<TelegramMessage>> entity = restTemplate.exchange(
                methodUrl(method), HttpMethod.POST, new HttpEntity<>(body, headers), MESSAGE_RESPONSE);
            response = entity.getBody();
        } catch (RestClientException e) {
            throw new ChannelException("Telegram " + method + " failed: " + redact(e.getMessage()), e);
        }
        return unwrap(method, response);
    }

    private <T> T unwrap(String method, TelegramResponse<T> response) {
        if (response == null) {
            throw new ChannelException("Telegram " + method + " returned an empty response");
        }
        if (!response.isOk()) {
            throw new ChannelException("Telegram " + method + " rejected the request: "
                + response.getErrorCode() + " " + response.getDescription());
        }
        if (response.getResult() == null) {
            throw new ChannelException("Telegram " + method + " returned no result");
        }
        return response.getResult();
    }

    private StoredBlob toStoredBlob(String method, TelegramMessage message, long channelId) {
        if (message.getDocument() == null || message.getDocument().getFileId() == null) {
            throw new ChannelException("Telegram " + method + " acknowledged a message without a document");
        }
        if (message.getMessageId() == null) {
            throw new ChannelException("Telegram " + method + " acknowledged a message without an id");
        }

        long chatId = message.getChat() != null && message.getChat().getId() != null
            ? message.getChat().getId()
            : channelId;
        return new StoredBlob(chatId, message.getMessageId(), message.getDocument().getFileId());
    }

    private ByteArrayResource documentPart(String fileName, byte[] content) {
        return new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return fileName;
            }
        };
    }

    private String mediaDescriptor() {
        try {
            return objectMapper.writeValueAsString(Map.of(
                "type", "document",
                "media", "attach://" + ATTACHMENT_NAME));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build media descriptor", e);
        }
    }

    private String methodUrl(String method) {
        return baseUrl + "/bot" + botToken + "/" + method;
    }

    private String redact(String message) {
        if (message == null || botToken == null || botToken.isEmpty()) {
            return message;
        }
        return message.replace(botToken, "***");
    }
}
