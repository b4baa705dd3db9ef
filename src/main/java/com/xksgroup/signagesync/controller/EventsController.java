package com.xksgroup.signagesync.controller;

import java.util.Set;
import java.util.UUID;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.xksgroup.signagesync.service.EventService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@Tag(
        name = "Événements de synchronisation",
        description = "Diffuse en temps réel la progression de la synchronisation en utilisant Server-Sent Events (SSE)."
)
@RestController
@RequestMapping("signage-sync/api/v1")
@RequiredArgsConstructor
public class EventsController {

    private final EventService eventService;

    @Operation(
            summary = "Suivre la synchronisation en temps réel",
            description = """
                Cet endpoint utilise **Server-Sent Events (SSE)** pour diffuser les événements de synchronisation.

                Noms d'événements possibles :
                - `sync-started`
                - `download-progress` (limité à un envoi toutes les deux secondes, la dernière valeur est toujours transmise)
                - `download-failed`
                - `catalog-ready`
                - `sync-failed`

                Le paramètre `types` permet de ne recevoir que certains événements.
                """,
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Flux SSE démarré avec succès (Content-Type: text/event-stream)",
                            content = @Content(
                                    mediaType = "text/event-stream",
                                    schema = @Schema(implementation = String.class)
                            )
                    )
            }
    )
    @GetMapping(value = "/events", produces = "text/event-stream")
    public SseEmitter streamEvents(@RequestParam(required = false) String clientId,
                                   @RequestParam(required = false) Set<String> types) {
        String id = (clientId == null || clientId.isBlank()) ? UUID.randomUUID().toString() : clientId;
        return eventService.subscribe(id, types);
    }
}
