package com.clickermsu.registry.channel.telegram;

import com.clickermsu.registry.channel.StoredBlob;
import com.clickermsu.registry.exception.ChannelException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.RequestMatcher;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class TelegramBlobChannelTest {

    private static final String BASE_URL = "https://api.telegram.test";
    private static final String TOKEN = "123456-secret-token";
    private static final byte[] CONTENT = "[[1,\"alice\",\"pw1\"]]".getBytes(StandardCharsets.UTF_8);

    private MockRestServiceServer server;
    private TelegramBlobChannel channel;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        channel = new TelegramBlobChannel(restTemplate, BASE_URL + "/", TOKEN);
    }

    @Test
    void testStore_SendsDocumentAndReadsAcknowledgment() {
        // Arrange
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/sendDocument"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(bodyContains("name=\"chat_id\""))
            .andExpect(bodyContains("filename=\"registry.json\""))
            .andRespond(withSuccess("{\"ok\":true,\"result\":{\"message_id\":431,\"chat\":{\"id\":721641425},\"document\":{\"file_id\":\"BQAC-new\",\"file_name\":\"registry.json\"}}}", MediaType.APPLICATION_JSON));

        // Act
        StoredBlob stored = channel.store(721641425L, "registry.json", CONTENT);

        // Assert
        assertEquals(721641425L, stored.getChannelId());
        assertEquals(431L, stored.getMessageId());
        assertEquals("BQAC-new", stored.getBlobId());
        server.verify();
    }

    @Test
    void testReplace_EditsMediaAtAnchor() {
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/editMessageMedia"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(bodyContains("attach://snapshot"))
            .andExpect(bodyContains("name=\"message_id\""))
            .andExpect(bodyContains("name=\"snapshot\""))
            .andRespond(withSuccess("{\"ok\":true,\"result\":{\"message_id\":430,\"chat\":{\"id\":721641425},\"document\":{\"file_id\":\"BQAC-edited\"}}}", MediaType.APPLICATION_JSON));

        StoredBlob stored = channel.replace(721641425L, 430L, "registry.json", CONTENT);

        assertEquals(430L, stored.getMessageId());
        assertEquals("BQAC-edited", stored.getBlobId());
        server.verify();
    }

    @Test
    void testFetch_ResolvesPathThenDownloads() {
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/getFile?file_id=BQAC-file"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"ok\":true,\"result\":{\"file_id\":\"BQAC-file\",\"file_path\":\"documents/file_7.json\"}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/file/bot" + TOKEN + "/documents/file_7.json"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess(CONTENT, MediaType.APPLICATION_OCTET_STREAM));

        byte[] fetched = channel.fetch("BQAC-file");

        assertArrayEquals(CONTENT, fetched);
        server.verify();
    }

    @Test
    void testRejectedRequest() {
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/editMessageMedia"))
            .andRespond(withSuccess("{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: message to edit not found\"}", MediaType.APPLICATION_JSON));

        ChannelException ex = assertThrows(ChannelException.class,
            () -> channel.replace(721641425L, 999L, "registry.json", CONTENT));

        assertTrue(ex.getMessage().contains("message to edit not found"));
    }

    @Test
    void testHttpError() {
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/sendDocument"))
            .andRespond(withServerError());

        assertThrows(ChannelException.class, () -> channel.store(721641425L, "registry.json", CONTENT));
    }

    @Test
    void testTransportErrorDoesNotLeakToken() {
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/sendDocument"))
            .andRespond(withException(new IOException("Connection refused")));

        ChannelException ex = assertThrows(ChannelException.class,
            () -> channel.store(721641425L, "registry.json", CONTENT));

        assertFalse(ex.getMessage().contains(TOKEN));
    }

    @Test
    void testAcknowledgmentWithoutDocument() {
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/sendDocument"))
            .andRespond(withSuccess("{\"ok\":true,\"result\":{\"message_id\":431,\"chat\":{\"id\":721641425}}}", MediaType.APPLICATION_JSON));

        assertThrows(ChannelException.class, () -> channel.store(721641425L, "registry.json", CONTENT));
    }

    @Test
    void testFetch_BlankBlobId() {
        assertThrows(ChannelException.class, () -> channel.fetch(" "));
        server.verify();
    }

    @Test
    void testFetch_NoFilePath() {
        server.expect(requestTo(BASE_URL + "/bot" + TOKEN + "/getFile?file_id=BQAC-big"))
            .andRespond(withSuccess("{\"ok\":true,\"result\":{\"file_id\":\"BQAC-big\"}}", MediaType.APPLICATION_JSON));

        assertThrows(ChannelException.class, () -> channel.fetch("BQAC-big"));
    }

    private static RequestMatcher bodyContains(String fragment) {
        return request -> {
            String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
            assertTrue(body.contains(fragment), "Expected request body to contain " + fragment);
        };
    }
}
