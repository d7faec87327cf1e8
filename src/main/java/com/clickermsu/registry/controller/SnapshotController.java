package com.clickermsu.registry.controller;

import com.clickermsu.registry.dto.SaveSnapshotRequest;
import com.clickermsu.registry.dto.SnapshotResponse;
import com.clickermsu.registry.service.RegistryService;
import com.clickermsu.registry.sync.PullResult;
import com.clickermsu.registry.sync.PushResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Backup commands: save a new snapshot, update the current one, restore from it.
 * Channel and decode failures answer 502 with the pointer that stayed live.
 */
@RestController
@RequestMapping("/api/v1/registry/snapshots")
public class SnapshotController {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotController.class);

    private final RegistryService registryService;

    @Autowired
    public SnapshotController(RegistryService registryService) {
        this.registryService = registryService;
    }

    /**
     * Push the registry as a new snapshot.
     * POST /api/v1/registry/snapshots
     */
    @PostMapping
    public ResponseEntity<SnapshotResponse> save(@Valid @RequestBody SaveSnapshotRequest request) {
        logger.info("Received save request - chatId: {}", request.getChatId());

        PushResult result = registryService.save(request.getChatId());
        return respond("save", SnapshotResponse.from(result));
    }

    /**
     * Push the registry over the current snapshot.
     * PUT /api/v1/registry/snapshots/current
     */
    @PutMapping("/current")
    public ResponseEntity<SnapshotResponse> update() {
        logger.info("Received update request");

        PushResult result = registryService.update();
        return respond("update", SnapshotResponse.from(result));
    }

    /**
     * Replace the registry with the current snapshot.
     * POST /api/v1/registry/snapshots/current/restore
     */
    @PostMapping("/current/restore")
    public ResponseEntity<SnapshotResponse> restore() {
        logger.info("Received restore request");

        PullResult result = registryService.restore();
        return respond("restore", SnapshotResponse.from(result));
    }

    /**
     * GET /api/v1/registry/snapshots/current
     */
    @GetMapping("/current")
    public ResponseEntity<SnapshotResponse> currentPointer() {
        return ResponseEntity.ok(SnapshotResponse.of(registryService.currentPointer()));
    }

    private ResponseEntity<SnapshotResponse> respond(String command, SnapshotResponse response) {
        if (!response.isSuccess()) {
            logger.warn("Snapshot {} failed - {}: {}", command, response.getErrorKind(), response.getErrorMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
        }

        logger.info("Snapshot {} succeeded - chatId: {}, messageId: {}, blobId: {}, records: {}", command,
            response.getPointer().getChannelId(), response.getPointer().getAnchorMessageId(),
            response.getPointer().getBlobId(), response.getRecordCount());
        return ResponseEntity.ok(response);
    }
}
