package com.clickermsu.registry.controller;

import com.clickermsu.registry.dto.RegisterRequest;
import com.clickermsu.registry.dto.RegisterResponse;
import com.clickermsu.registry.dto.SignInRequest;
import com.clickermsu.registry.dto.TopUsersResponse;
import com.clickermsu.registry.dto.UploadRequest;
import com.clickermsu.registry.model.DeleteOutcome;
import com.clickermsu.registry.model.RankedUser;
import com.clickermsu.registry.model.RegistrationResult;
import com.clickermsu.registry.model.SignInResult;
import com.clickermsu.registry.model.TopUsers;
import com.clickermsu.registry.model.UploadReceipt;
import com.clickermsu.registry.service.RegistryService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/registry")
public class RegistryController {

    private static final Logger logger = LoggerFactory.getLogger(RegistryController.class);

    private final RegistryService registryService;

    @Autowired
    public RegistryController(RegistryService registryService) {
        this.registryService = registryService;
    }

    /**
     * Register a user.
     * POST /api/v1/registry/users
     */
    @PostMapping("/users")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        logger.info("Received register request - username: {}, id: {}", request.getUsername(), request.getId());

        RegistrationResult result = registryService.register(request.getId(), request.getUsername(), request.getPassword());

        RegisterResponse.RegisterResponseBuilder response = RegisterResponse.builder()
            .registered(result.isRegistered())
            .username(request.getUsername())
            .topUsers(result.getTopUsers())
            .userRanks(result.getUserRanks())
            .processedAt(Instant.now());

        if (!result.isRegistered()) {
            logger.info("Username already taken - username: {}", request.getUsername());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response.build());
        }

        response.backedUp(result.getBackup().isSuccess())
            .backupError(result.getBackup().getErrorMessage());

        logger.info("Successfully registered user - username: {}, ranks: {}", request.getUsername(), result.getUserRanks());
        return ResponseEntity.ok(response.build());
    }

    /**
     * Sign in.
     * POST /api/v1/registry/users/sign-in
     */
    @PostMapping("/users/sign-in")
    public ResponseEntity<SignInResult> signIn(@Valid @RequestBody SignInRequest request) {
        logger.info("Received sign-in request - username: {}", request.getUsername());

        SignInResult result = registryService.signIn(request.getUsername(), request.getPassword());

        logger.info("Sign-in processed - username: {}, registered: {}, passwordMatches: {}",
            request.getUsername(), result.isRegistered(), result.isPasswordMatches());
        return ResponseEntity.ok(result);
    }

    /**
     * Delete every record of a requester id.
     * DELETE /api/v1/registry/users/{id}
     */
    @DeleteMapping("/users/{id}")
    public ResponseEntity<DeleteOutcome> delete(@PathVariable long id) {
        logger.info("Received delete request - id: {}", id);

        DeleteOutcome outcome = registryService.delete(id);
        if (!outcome.isDeleted()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(outcome);
        }

        logger.info("Successfully deleted user - id: {}, records: {}", id, outcome.getDeletedCount());
        return ResponseEntity.ok(outcome);
    }

    /**
     * Top N users by descending id.
     * GET /api/v1/registry/top?limit=N
     */
    @GetMapping("/top")
    public ResponseEntity<TopUsersResponse> getTopN(@RequestParam(defaultValue = "10") int limit) {
        logger.info("Received GET request for top N users - limit: {}", limit);

        TopUsers topUsers = registryService.getTopUsers(limit);

        TopUsersResponse response = TopUsersResponse.builder()
            .users(topUsers.getUsers())
            .totalUsers(topUsers.getTotalUsers())
            .retrievedAt(Instant.now())
            .build();

        logger.info("Successfully retrieved top {} users - totalUsers: {}, returnedUsers: {}",
            limit, topUsers.getTotalUsers(), topUsers.getUsers().size());
        return ResponseEntity.ok(response);
    }

    /**
     * Rank of a username.
     * GET /api/v1/registry/users/{username}/rank
     */
    @GetMapping("/users/{username}/rank")
    public ResponseEntity<List<RankedUser>> getRank(@PathVariable String username) {
        List<RankedUser> ranks = registryService.getRank(username);
        if (ranks.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ranks);
        }
        return ResponseEntity.ok(ranks);
    }

    /**
     * Echo the blob id of a document sent to the bot.
     * POST /api/v1/registry/uploads
     */
    @PostMapping("/uploads")
    public ResponseEntity<UploadReceipt> receiveUpload(@Valid @RequestBody UploadRequest request) {
        logger.info("Received upload - chatId: {}, messageId: {}", request.getChatId(), request.getMessageId());
        return ResponseEntity.ok(registryService.receiveUpload(request));
    }
}
