package com.devevent.registry.application;

import static com.devevent.registry.domain.validation.FieldValidator.isNonEmptyText;
import static com.devevent.registry.domain.validation.FieldValidator.isValidEmailShape;
import static com.devevent.registry.domain.validation.FieldValidator.trimWhitespace;

import com.devevent.registry.domain.model.Booking;
import com.devevent.registry.domain.model.BookingCandidate;
import com.devevent.registry.domain.model.ErrorKind;
import com.devevent.registry.domain.model.ValidationError;
import com.devevent.registry.domain.model.WriteResult;
import com.devevent.registry.domain.port.out.BookingRepository;
import com.devevent.registry.domain.port.out.DanglingEventReferenceException;
import com.devevent.registry.domain.port.out.StorageUnavailableException;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates a booking and writes it.
 *
 * <p>The existence check and the insert are two separate calls, so the event can disappear in between.
 * The foreign key on {@code bookings.event_id} catches that case and it is reported like any other
 * dangling reference.
 */
@Service
public class BookingWritePipeline implements SubmitBooking {

    private static final Logger logger = LoggerFactory.getLogger(BookingWritePipeline.class);

    private final EventReferenceChecker referenceChecker;
    private final BookingRepository bookingRepository;

    public BookingWritePipeline(EventReferenceChecker referenceChecker, BookingRepository bookingRepository) {
        this.referenceChecker = referenceChecker;
        this.bookingRepository = bookingRepository;
    }

    @Override
    public WriteResult<Booking> submitBooking(BookingCandidate candidate) {
        if (!isNonEmptyText(candidate.eventId())) {
            return reject(ValidationError.of(ErrorKind.MISSING_EVENT_ID, "eventId", "eventId is required."));
        }

        UUID eventId;
        try {
            eventId = UUID.fromString(trimWhitespace(candidate.eventId()));
        } catch (IllegalArgumentException e) {
            return reject(danglingReference(candidate.eventId()));
        }

        try {
            if (!referenceChecker.eventExists(eventId)) {
                return reject(danglingReference(eventId.toString()));
            }
        } catch (StorageUnavailableException e) {
            logger.error("Could not verify event {} before booking", eventId, e);
            return WriteResult.failure(ErrorKind.STORAGE_UNAVAILABLE, null, e.getMessage());
        }

        String email = candidate.email() == null ? null : trimWhitespace(candidate.email()).toLowerCase(Locale.ROOT);
        if (!isNonEmptyText(email) || !isValidEmailShape(email)) {
            return reject(ValidationError.of(ErrorKind.INVALID_EMAIL, "email",
                    "Email must be a valid email address."));
        }

        try {
            Booking stored = bookingRepository.save(new Booking(candidate.id(), eventId, email, null, null));
            logger.info("Stored booking {} for event {}", stored.id(), eventId);
            return WriteResult.success(stored);
        } catch (DanglingEventReferenceException e) {
            logger.warn("Event {} vanished before booking could be stored", eventId);
            return WriteResult.failure(danglingReference(eventId.toString()));
        } catch (StorageUnavailableException e) {
            logger.error("Storage unavailable while saving booking for event {}", eventId, e);
            return WriteResult.failure(ErrorKind.STORAGE_UNAVAILABLE, null, e.getMessage());
        }
    }

    private static ValidationError danglingReference(String eventId) {
        return ValidationError.of(ErrorKind.DANGLING_EVENT_REFERENCE, "eventId",
                "Referenced event does not exist: " + eventId);
    }

    private static WriteResult<Booking> reject(ValidationError error) {
        logger.warn("Rejected booking candidate: {} ({})", error.kind(), error.message());
        return WriteResult.failure(error);
    }
}
