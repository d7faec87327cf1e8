package com.clickermsu.registry.controller;

import com.clickermsu.registry.channel.BlobChannel;
import com.clickermsu.registry.channel.StoredBlob;
import com.clickermsu.registry.exception.ChannelException;
import com.clickermsu.registry.repository.UserRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:registry-it;DB_CLOSE_DELAY=-1",
    "telegram.bot.token=test-token"
})
@AutoConfigureMockMvc
class RegistryControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UserRecordRepository userRecordRepository;

    @Autowired
    private InMemoryBlobChannel blobChannel;

    @BeforeEach
    void setUp() throws Exception {
        blobChannel.reset();
        userRecordRepository.replaceAll(List.of());

        // Every test starts from a fresh, empty backup in chat 500
        mockMvc.perform(post("/api/v1/registry/snapshots")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":500}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.recordCount").value(0))
            .andExpect(jsonPath("$.pointer.channelId").value(500));
    }

    @Test
    void testRegisterSignInRankAndDelete() throws Exception {
        register(3, "alice", "pw1")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.registered").value(true))
            .andExpect(jsonPath("$.backedUp").value(true))
            .andExpect(jsonPath("$.userRanks[0].rank").value(1));

        register(7, "alice", "other")
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.registered").value(false));

        register(9, "bob", "pw2")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.topUsers[0].username").value("bob"))
            .andExpect(jsonPath("$.topUsers[1].username").value("alice"))
            .andExpect(jsonPath("$.userRanks[0].rank").value(1));

        mockMvc.perform(post("/api/v1/registry/users/sign-in")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"alice\",\"password\":\"pw1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.registered").value(true))
            .andExpect(jsonPath("$.passwordMatches").value(true));

        mockMvc.perform(post("/api/v1/registry/users/sign-in")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"alice\",\"password\":\"wrong\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.passwordMatches").value(false));

        mockMvc.perform(get("/api/v1/registry/top").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.users.length()").value(1))
            .andExpect(jsonPath("$.users[0].username").value("bob"))
            .andExpect(jsonPath("$.totalUsers").value(2));

        mockMvc.perform(get("/api/v1/registry/users/alice/rank"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].rank").value(2));

        mockMvc.perform(delete("/api/v1/registry/users/9"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deletedCount").value(1));

        mockMvc.perform(delete("/api/v1/registry/users/9"))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/v1/registry/users/bob/rank"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testRestoreBringsBackTheBackup() throws Exception {
        register(4, "carol", "pw4").andExpect(status().isOk());
        userRecordRepository.replaceAll(List.of());

        mockMvc.perform(post("/api/v1/registry/snapshots/current/restore"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recordCount").value(1));

        mockMvc.perform(get("/api/v1/registry/users/carol/rank"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].userId").value(4));
    }

    @Test
    void testUnreachableChannel() throws Exception {
        blobChannel.setUnreachable(true);

        mockMvc.perform(put("/api/v1/registry/snapshots/current"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.errorKind").value("CHANNEL_ERROR"))
            .andExpect(jsonPath("$.pointer.channelId").value(500));

        register(1, "dave", "pw")
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.errorCode").value("SYNC_FAILED"))
            .andExpect(jsonPath("$.errorKind").value("CHANNEL_ERROR"));

        blobChannel.setUnreachable(false);
        mockMvc.perform(get("/api/v1/registry/users/dave/rank"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testInvalidRequests() throws Exception {
        mockMvc.perform(post("/api/v1/registry/users")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":1,\"username\":\"\",\"password\":\"pw\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"))
            .andExpect(jsonPath("$.errorKind").doesNotExist());

        mockMvc.perform(get("/api/v1/registry/top").param("limit", "0"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/registry/uploads")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":500,\"messageId\":12}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testUploadEchoesBlobId() throws Exception {
        mockMvc.perform(post("/api/v1/registry/uploads")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":500,\"messageId\":12,\"documentFileId\":\"BQAC-upload\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.blobId").value("BQAC-upload"))
            .andExpect(jsonPath("$.messageId").value(12));
    }

    private ResultActions register(long id, String username, String password)
            throws Exception {
        return mockMvc.perform(post("/api/v1/registry/users")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"id\":" + id + ",\"username\":\"" + username + "\",\"password\":\"" + password + "\"}"));
    }

    @TestConfiguration
    static class ChannelConfig {
        @Bean
        @Primary
        InMemoryBlobChannel inMemoryBlobChannel() {
            return new InMemoryBlobChannel();
        }
    }

    static class InMemoryBlobChannel implements BlobChannel {
        private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
        private final AtomicLong sequence = new AtomicLong();
        private volatile boolean unreachable;

        @Override
        public StoredBlob store(long channelId, String fileName, byte[] content) {
            checkReachable();
            long id = sequence.incrementAndGet();
            blobs.put("blob-" + id, content.clone());
            return new StoredBlob(channelId, id, "blob-" + id);
        }

        @Override
        public StoredBlob replace(long channelId, long messageId, String fileName, byte[] content) {
            checkReachable();
            String blobId = "blob-" + sequence.incrementAndGet();
            blobs.put(blobId, content.clone());
            return new StoredBlob(channelId, messageId, blobId);
        }

        @Override
        public byte[] fetch(String blobId) {
            checkReachable();
            byte[] content = blobs.get(blobId);
            if (content == null) {
                throw new ChannelException("Bad Request: invalid file_id");
            }
            return content.clone();
        }

        void setUnreachable(boolean unreachable) {
            this.unreachable = unreachable;
        }

        void reset() {
            blobs.clear();
            unreachable = false;
        }

        private void checkReachable() {
            if (unreachable) {
                throw new ChannelException("Connection refused");
            }
        }
    }
}
