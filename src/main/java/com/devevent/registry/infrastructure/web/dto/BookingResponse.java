package com.devevent.registry.infrastructure.web.dto;

import com.devevent.registry.domain.model.Booking;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BookingResponse(
        UUID id,
        UUID eventId,
        String email,
        Instant createdAt,
        Instant updatedAt
) {
    public static BookingResponse fromBooking(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.eventId(),
                booking.email(),
                booking.createdAt(),
                booking.updatedAt()
        );
    }

    public static List<BookingResponse> fromBookings(List<Booking> bookings) {
        return bookings.stream()
                .map(BookingResponse::fromBooking)
                .toList();
    }
}
