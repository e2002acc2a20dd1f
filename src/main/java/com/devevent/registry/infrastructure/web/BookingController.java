package com.devevent.registry.infrastructure.web;

import com.devevent.registry.application.SubmitBooking;
import com.devevent.registry.domain.model.Booking;
import com.devevent.registry.domain.model.WriteResult;
import com.devevent.registry.infrastructure.web.dto.BookingRequest;
import com.devevent.registry.infrastructure.web.dto.BookingResponse;
import com.devevent.registry.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/bookings")
public class BookingController {

    private static final Logger logger = LoggerFactory.getLogger(BookingController.class);

    private final SubmitBooking submitBooking;

    public BookingController(SubmitBooking submitBooking) {
        this.submitBooking = submitBooking;
    }

    @PostMapping
    public ResponseEntity<?> createBooking(@RequestBody BookingRequest request) {
        logger.info("Booking requested for event {}", request.eventId());

        try {
            WriteResult<Booking> result = submitBooking.submitBooking(request.toCandidate());
            if (!result.isSuccess()) {
                return ErrorStatusMapper.toResponse(result.error());
            }
            return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.fromBooking(result.value()));
        } catch (Exception e) {
            logger.error("Error creating booking", e);
            return ResponseEntity.internalServerError().body(ErrorResponse.internal());
        }
    }
}
