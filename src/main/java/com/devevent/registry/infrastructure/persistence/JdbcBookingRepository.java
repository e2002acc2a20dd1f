package com.devevent.registry.infrastructure.persistence;

import com.devevent.registry.domain.model.Booking;
import com.devevent.registry.domain.port.out.BookingRepository;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcBookingRepository implements BookingRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcBookingRepository.class);

    private static final RowMapper<Booking> BOOKING_ROW_MAPPER = (rs, rowNum) -> new Booking(
            rs.getObject("id", UUID.class),
            rs.getObject("event_id", UUID.class),
            rs.getString("email"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getObject("updated_at", OffsetDateTime.class).toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcBookingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Booking save(Booking booking) {
        boolean isNew = booking.id() == null;
        String sql = isNew
                ? """
                  INSERT INTO bookings (event_id, email, id) VALUES (?, ?, ?)
                  RETURNING id, event_id, email, created_at, updated_at"""
                : """
                  UPDATE bookings SET event_id = ?, email = ?, updated_at = now() WHERE id = ?
                  RETURNING id, event_id, email, created_at, updated_at""";
        UUID id = isNew ? UUID.randomUUID() : booking.id();

        try {
            List<Booking> rows = jdbcTemplate.query(sql, BOOKING_ROW_MAPPER, booking.eventId(), booking.email(), id);
            Booking stored = DataAccessUtils.requiredSingleResult(rows);
            logger.debug("{} booking {} for event {}", isNew ? "Inserted" : "Updated", stored.id(), stored.eventId());
            return stored;
        } catch (DataAccessException e) {
            throw StorageExceptionTranslator.translateBookingWrite(e, booking.eventId());
        }
    }

    @Override
    public List<Booking> findByEventId(UUID eventId) {
        try {
            return jdbcTemplate.query("""
                    SELECT id, event_id, email, created_at, updated_at
                    FROM bookings
                    WHERE event_id = ?
                    ORDER BY created_at DESC
                    """, BOOKING_ROW_MAPPER, eventId);
        } catch (DataAccessException e) {
            throw StorageExceptionTranslator.translate(e);
        }
    }
}
