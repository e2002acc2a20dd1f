package com.devevent.registry.domain.port.out;

import com.devevent.registry.domain.model.Booking;
import java.util.List;
import java.util.UUID;

/**
 * Repository port for bookings.
 */
public interface BookingRepository {

    /**
     * Atomically create (no id) or update (id present) a booking.
     *
     * @throws DanglingEventReferenceException when the store rejects the event reference
     * @throws StorageUnavailableException     when the store cannot be reached
     */
    Booking save(Booking booking);

    List<Booking> findByEventId(UUID eventId);
}
