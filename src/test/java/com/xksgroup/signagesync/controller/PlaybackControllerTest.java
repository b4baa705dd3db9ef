package com.xksgroup.signagesync.controller;

import com.xksgroup.signagesync.model.PlaybackSelection;
import com.xksgroup.signagesync.model.Playlist;
import com.xksgroup.signagesync.model.Video;
import com.xksgroup.signagesync.schedule.PlaybackService;
import com.xksgroup.signagesync.store.CatalogStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlaybackController.class)
class PlaybackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlaybackService playbackService;

    @MockBean
    private CatalogStore catalogStore;

    @Test
    void currentSelectionIsReturned() throws Exception {
        when(playbackService.current()).thenReturn(Optional.of(
                new PlaybackSelection("7", true, List.of("/media/video_a.mp4", "/media/video_b.mp4"))));

        mockMvc.perform(get("/signage-sync/api/v1/playback/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playlistId").value("7"))
                .andExpect(jsonPath("$.portrait").value(true))
                .andExpect(jsonPath("$.files.length()").value(2))
                .andExpect(jsonPath("$.files[0]").value("/media/video_a.mp4"));
    }

    @Test
    void nothingScheduledIsNoContent() throws Exception {
        when(playbackService.current()).thenReturn(Optional.empty());

        mockMvc.perform(get("/signage-sync/api/v1/playback/current"))
                .andExpect(status().isNoContent());
    }

    @Test
    void playlistsAreListedWithHourMinuteTimes() throws Exception {
        when(catalogStore.getPlaylists()).thenReturn(List.of(Playlist.builder()
                .id("night").startTime(LocalTime.of(22, 0)).endTime(LocalTime.of(8, 0))
                .videoIds(List.of("a")).build()));

        mockMvc.perform(get("/signage-sync/api/v1/catalog/playlists"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("night"))
                .andExpect(jsonPath("$[0].startTime").value("22:00"))
                .andExpect(jsonPath("$[0].endTime").value("08:00"))
                .andExpect(jsonPath("$[0].videoIds[0]").value("a"));
    }

    @Test
    void unknownVideoIsNotFound() throws Exception {
        when(catalogStore.findVideo("missing")).thenReturn(Optional.empty());
        when(catalogStore.findVideo("a")).thenReturn(Optional.of(Video.builder().id("a").url("http://x/a.mp4").build()));

        mockMvc.perform(get("/signage-sync/api/v1/catalog/videos/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Video not found"));
        mockMvc.perform(get("/signage-sync/api/v1/catalog/videos/a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.downloaded").value(false));
    }
}
