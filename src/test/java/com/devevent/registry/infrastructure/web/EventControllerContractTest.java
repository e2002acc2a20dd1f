package com.devevent.registry.infrastructure.web;

import com.devevent.registry.application.SubmitEvent;
import com.devevent.registry.domain.model.Booking;
import com.devevent.registry.domain.model.ErrorKind;
import com.devevent.registry.domain.model.Event;
import com.devevent.registry.domain.model.EventCandidate;
import com.devevent.registry.domain.model.WriteResult;
import com.devevent.registry.domain.port.out.BookingRepository;
import com.devevent.registry.domain.port.out.EventRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EventController.class)
class EventControllerContractTest {

    private static final String EVENT_JSON = """
            {
              "title": "React Summit 2025",
              "description": "Conference about React",
              "overview": "Two days of talks",
              "image": "/images/react-summit.png",
              "venue": "RAI",
              "location": "Amsterdam, NL",
              "date": "March 7, 2025",
              "time": "9:5",
              "mode": "offline",
              "audience": "Frontend developers",
              "agenda": ["Keynote", "Workshops"],
              "organizer": "GitNation",
              "tags": ["react", "frontend"]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SubmitEvent submitEvent;

    @MockBean
    private EventRepository eventRepository;

    @MockBean
    private BookingRepository bookingRepository;

    @Test
    void shouldCreateEvent() throws Exception {
        // Given
        Event stored = createEvent("React Summit 2025", "react-summit-2025");
        when(submitEvent.submitEvent(any())).thenReturn(WriteResult.success(stored));

        // When & Then
        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is(stored.id().toString())))
                .andExpect(jsonPath("$.slug", is("react-summit-2025")))
                .andExpect(jsonPath("$.date", is("2025-03-07")))
                .andExpect(jsonPath("$.time", is("09:05")))
                .andExpect(jsonPath("$.agenda", hasSize(2)));

        ArgumentCaptor<EventCandidate> candidate = ArgumentCaptor.forClass(EventCandidate.class);
        verify(submitEvent).submitEvent(candidate.capture());
        assertThat(candidate.getValue().isNew()).isTrue();
        assertThat(candidate.getValue().time()).isEqualTo("9:5");
    }

    @Test
    void shouldReturnConflictOnSlugConflict() throws Exception {
        when(submitEvent.submitEvent(any()))
                .thenReturn(WriteResult.failure(ErrorKind.SLUG_CONFLICT, "slug", "Slug already in use: react-summit-2025"));

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("SLUG_CONFLICT")))
                .andExpect(jsonPath("$.field", is("slug")));
    }

    @Test
    void shouldReturnBadRequestOnValidationFailure() throws Exception {
        when(submitEvent.submitEvent(any()))
                .thenReturn(WriteResult.failure(ErrorKind.EMPTY_AGENDA, "agenda",
                        "Agenda must contain at least one non-empty item."));

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("EMPTY_AGENDA")))
                .andExpect(jsonPath("$.message", containsString("Agenda")));
    }

    @Test
    void shouldReturnServiceUnavailableWhenStorageIsDown() throws Exception {
        when(submitEvent.submitEvent(any()))
                .thenReturn(WriteResult.failure(ErrorKind.STORAGE_UNAVAILABLE, null, "connection refused"));

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void shouldReturnInternalServerErrorWhenPipelineThrows() throws Exception {
        when(submitEvent.submitEvent(any())).thenThrow(new RuntimeException("boom"));

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("INTERNAL_ERROR")));
    }

    @Test
    void shouldUpdateUsingStoredEventAsBaseline() throws Exception {
        // Given
        Event stored = createEvent("React Summit 2025", "react-summit-2025");
        when(eventRepository.findById(stored.id())).thenReturn(Optional.of(stored));
        when(submitEvent.submitEvent(any())).thenReturn(WriteResult.success(stored));

        // When & Then
        mockMvc.perform(put("/api/events/{id}", stored.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"venue\": \"Beurs van Berlage\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug", is("react-summit-2025")));

        ArgumentCaptor<EventCandidate> candidate = ArgumentCaptor.forClass(EventCandidate.class);
        verify(submitEvent).submitEvent(candidate.capture());
        assertThat(candidate.getValue().baseline()).isEqualTo(stored);
        assertThat(candidate.getValue().id()).isEqualTo(stored.id());
        assertThat(candidate.getValue().venue()).isEqualTo("Beurs van Berlage");
        assertThat(candidate.getValue().title()).isEqualTo(stored.title());
        assertThat(candidate.getValue().titleChanged()).isFalse();
    }

    @Test
    void shouldReturnNotFoundWhenUpdatingUnknownEvent() throws Exception {
        UUID id = UUID.randomUUID();
        when(eventRepository.findById(id)).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/events/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"venue\": \"Elsewhere\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("NOT_FOUND")));

        verifyNoInteractions(submitEvent);
    }

    @Test
    void shouldFindEventBySlug() throws Exception {
        Event stored = createEvent("React Summit 2025", "react-summit-2025");
        when(eventRepository.findBySlug("react-summit-2025")).thenReturn(Optional.of(stored));

        mockMvc.perform(get("/api/events/{slug}", "react-summit-2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title", is("React Summit 2025")))
                .andExpect(jsonPath("$.tags", contains("react", "frontend")));
    }

    @Test
    void shouldReturnNotFoundForUnknownSlug() throws Exception {
        when(eventRepository.findBySlug("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/events/{slug}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldListBookingsOfEvent() throws Exception {
        // Given
        UUID eventId = UUID.randomUUID();
        Instant now = Instant.now();
        when(bookingRepository.findByEventId(eventId)).thenReturn(List.of(
                new Booking(UUID.randomUUID(), eventId, "ada@example.com", now, now),
                new Booking(UUID.randomUUID(), eventId, "linus@example.com", now, now)));

        // When & Then
        mockMvc.perform(get("/api/events/{id}/bookings", eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].email", is("ada@example.com")))
                .andExpect(jsonPath("$[0].eventId", is(eventId.toString())));
    }

    private static Event createEvent(String title, String slug) {
        Instant now = Instant.parse("2025-01-15T10:00:00Z");
        return new Event(UUID.randomUUID(), title, slug, "Conference about React", "Two days of talks",
                "/images/react-summit.png", "RAI", "Amsterdam, NL", "2025-03-07", "09:05", "offline",
                "Frontend developers", List.of("Keynote", "Workshops"), "GitNation", List.of("react", "frontend"),
                now, now);
    }
}
