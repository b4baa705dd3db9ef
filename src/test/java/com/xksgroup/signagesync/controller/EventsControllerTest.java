package com.xksgroup.signagesync.controller;

import com.xksgroup.signagesync.service.EventService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;

@WebMvcTest(EventsController.class)
class EventsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EventService eventService;

    @Test
    void subscribesNamedClientWithTypeFilter() throws Exception {
        when(eventService.subscribe(anyString(), any())).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/signage-sync/api/v1/events")
                        .param("clientId", "screen-1")
                        .param("types", "catalog-ready"))
                .andExpect(request().asyncStarted());

        verify(eventService).subscribe("screen-1", Set.of("catalog-ready"));
    }

    @Test
    void anonymousClientGetsGeneratedId() throws Exception {
        when(eventService.subscribe(anyString(), any())).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/signage-sync/api/v1/events"))
                .andExpect(request().asyncStarted());

        verify(eventService).subscribe(anyString(), isNull());
    }
}
