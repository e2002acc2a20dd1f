package com.devevent.registry.application;

import com.devevent.registry.domain.model.Booking;
import com.devevent.registry.domain.model.BookingCandidate;
import com.devevent.registry.domain.model.WriteResult;

/**
 * Entry point for creating a booking against an existing event.
 */
public interface SubmitBooking {

    /**
     * @param candidate raw booking input
     * @return the stored booking, or the most specific error that stopped the write
     */
    WriteResult<Booking> submitBooking(BookingCandidate candidate);
}
