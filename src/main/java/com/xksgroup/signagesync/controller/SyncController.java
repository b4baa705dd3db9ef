package com.xksgroup.signagesync.controller;

import com.xksgroup.signagesync.model.Video;
import com.xksgroup.signagesync.model.dto.SyncStatusDto;
import com.xksgroup.signagesync.store.CatalogStore;
import com.xksgroup.signagesync.store.ChangelogMarkerStore;
import com.xksgroup.signagesync.sync.ChangePoller;
import com.xksgroup.signagesync.sync.SyncService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("signage-sync/api/v1/sync")
@RequiredArgsConstructor
@Tag(name = "Synchronisation", description = "Suivi et déclenchement de la synchronisation du contenu")
public class SyncController {

    private final ChangePoller changePoller;
    private final SyncService syncService;
    private final ChangelogMarkerStore markerStore;
    private final CatalogStore catalogStore;

    @GetMapping("/status")
    @Operation(
        summary = "Obtenir l'état de la synchronisation",
        description = "Retourne l'état du poller, le dernier résultat, le marqueur du changelog et un résumé du catalogue local"
    )
    @ApiResponse(
        responseCode = "200",
        description = "État récupéré avec succès",
        content = @Content(mediaType = "application/json", schema = @Schema(implementation = SyncStatusDto.class))
    )
    public ResponseEntity<SyncStatusDto> getStatus() {
        List<Video> videos = catalogStore.getVideos();
        SyncStatusDto status = SyncStatusDto.builder()
                .state(changePoller.getState())
                .lastOutcome(changePoller.getLastOutcome().orElse(null))
                .lastPollAt(changePoller.getLastPollAt().orElse(null))
                .marker(markerStore.load().orElse(null))
                .lastReport(syncService.getLastReport().orElse(null))
                .playlistCount(catalogStore.getPlaylists().size())
                .videoCount(videos.size())
                .downloadedCount(videos.stream().filter(Video::isDownloaded).count())
                .build();
        return ResponseEntity.ok(status);
    }

    @PostMapping
    @Operation(
        summary = "Déclencher une synchronisation manuelle",
        description = "Force une synchronisation complète, même si le changelog n'a pas changé. La synchronisation s'exécute en arrière-plan."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "202",
            description = "Synchronisation acceptée",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(value = """
                    {
                        "accepted": true,
                        "message": "Synchronisation démarrée"
                    }
                    """)
            )
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Une synchronisation est déjà en cours"
        )
    })
    public ResponseEntity<Object> triggerSync() {
        if (!changePoller.requestManualSync()) {
            log.info("Manual sync refused, poller busy");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "timestamp", LocalDateTime.now(),
                    "status", HttpStatus.CONFLICT.value(),
                    "error", HttpStatus.CONFLICT.getReasonPhrase(),
                    "message", "A synchronization is already in progress"
            ));
        }
        log.info("Manual sync accepted");
        return ResponseEntity.accepted().body(Map.of(
                "accepted", true,
                "message", "Synchronization started"
        ));
    }
}
