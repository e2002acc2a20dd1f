package com.devevent.registry.infrastructure.web;

import com.devevent.registry.application.SubmitEvent;
import com.devevent.registry.domain.model.Event;
import com.devevent.registry.domain.model.WriteResult;
import com.devevent.registry.domain.port.out.BookingRepository;
import com.devevent.registry.domain.port.out.EventRepository;
import com.devevent.registry.infrastructure.web.dto.BookingResponse;
import com.devevent.registry.infrastructure.web.dto.ErrorResponse;
import com.devevent.registry.infrastructure.web.dto.EventRequest;
import com.devevent.registry.infrastructure.web.dto.EventResponse;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final SubmitEvent submitEvent;
    private final EventRepository eventRepository;
    private final BookingRepository bookingRepository;

    public EventController(SubmitEvent submitEvent,
                           EventRepository eventRepository,
                           BookingRepository bookingRepository) {
        this.submitEvent = submitEvent;
        this.eventRepository = eventRepository;
        this.bookingRepository = bookingRepository;
    }

    @PostMapping
    public ResponseEntity<?> createEvent(@RequestBody EventRequest request) {
        logger.info("Creating event '{}'", request.title());

        try {
            return respond(submitEvent.submitEvent(request.toCandidate()), HttpStatus.CREATED);
        } catch (Exception e) {
            logger.error("Error creating event", e);
            return ResponseEntity.internalServerError().body(ErrorResponse.internal());
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updateEvent(@PathVariable("id") UUID id, @RequestBody EventRequest request) {
        logger.info("Updating event {}", id);

        try {
            Optional<Event> stored = eventRepository.findById(id);
            if (stored.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.notFound("Event not found: " + id));
            }
            return respond(submitEvent.submitEvent(request.applyTo(stored.get())), HttpStatus.OK);
        } catch (Exception e) {
            logger.error("Error updating event {}", id, e);
            return ResponseEntity.internalServerError().body(ErrorResponse.internal());
        }
    }

    @GetMapping("/{slug}")
    public ResponseEntity<?> getEvent(@PathVariable("slug") String slug) {
        logger.debug("Looking up event by slug {}", slug);

        try {
            return eventRepository.findBySlug(slug)
                            .<ResponseEntity<?>>map(event -> ResponseEntity.ok(EventResponse.fromEvent(event)))
                            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                                    .body(ErrorResponse.notFound("Event not found: " + slug)));
        } catch (Exception e) {
            logger.error("Error looking up event {}", slug, e);
            return ResponseEntity.internalServerError().body(ErrorResponse.internal());
        }
    }

    @GetMapping("/{id}/bookings")
    public ResponseEntity<?> listBookings(@PathVariable("id") UUID id) {
        try {
            var bookings = bookingRepository.findByEventId(id);
            logger.debug("Found {} bookings for event {}", bookings.size(), id);
            return ResponseEntity.ok(BookingResponse.fromBookings(bookings));
        } catch (Exception e) {
            logger.error("Error listing bookings for event {}", id, e);
            return ResponseEntity.internalServerError().body(ErrorResponse.internal());
        }
    }

    private static ResponseEntity<?> respond(WriteResult<Event> result, HttpStatus successStatus) {
        if (!result.isSuccess()) {
            return ErrorStatusMapper.toResponse(result.error());
        }
        return ResponseEntity.status(successStatus).body(EventResponse.fromEvent(result.value()));
    }
}
