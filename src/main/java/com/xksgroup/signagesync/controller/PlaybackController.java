package com.xksgroup.signagesync.controller;

import com.xksgroup.signagesync.model.PlaybackSelection;
import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;
import com.xksgroup.signagesync.schedule.PlaybackService;
import com.xksgroup.signagesync.store.CatalogStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("signage-sync/api/v1")
@RequiredArgsConstructor
@Tag(name = "Lecture", description = "Playlist active et catalogue local de l'écran")
public class PlaybackController {

    private final PlaybackService playbackService;
    private final CatalogStore catalogStore;

    @GetMapping("/playback/current")
    @Operation(
        summary = "Obtenir la playlist à diffuser maintenant",
        description = "Retourne la playlist active pour l'heure locale et la liste ordonnée des fichiers déjà téléchargés"
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Playlist active trouvée"),
        @ApiResponse(responseCode = "204", description = "Aucune playlist active pour le moment")
    })
    public ResponseEntity<PlaybackSelection> getCurrent() {
        return playbackService.current()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/catalog/playlists")
    @Operation(summary = "Lister les playlists du catalogue local")
    public List<Playlist> getPlaylists() {
        return catalogStore.getPlaylists();
    }

    @GetMapping("/catalog/videos")
    @Operation(summary = "Lister les vidéos du catalogue local avec leur état de téléchargement")
    public List<Video> getVideos() {
        return catalogStore.getVideos();
    }

    @GetMapping("/catalog/videos/{videoId}")
    @Operation(summary = "Obtenir une vidéo du catalogue local")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Vidéo trouvée"),
        @ApiResponse(responseCode = "404", description = "Vidéo inconnue")
    })
    public ResponseEntity<Object> getVideo(
            @Parameter(description = "Identifiant de la vidéo", required = true, example = "42")
            @PathVariable String videoId) {
        return catalogStore.findVideo(videoId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "error", "Video not found",
                        "message", "No video in the local catalog with id: " + videoId
                )));
    }
}
