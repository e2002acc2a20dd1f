package com.devevent.registry.infrastructure.persistence;

import com.devevent.registry.domain.model.Event;
import com.devevent.registry.domain.port.out.EventRepository;
import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Database implementation of EventRepository.
 * Pure database operations without caching concerns; slug uniqueness is enforced by the
 * {@code uk_events_slug} constraint.
 */
@Repository("jdbcEventRepository")
public class JdbcEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEventRepository.class);

    private static final String COLUMNS = """
            id, title, slug, description, overview, image, venue, location, event_date, event_time,
            mode, audience, agenda, organizer, tags, created_at, updated_at""";

    private static final String INSERT_SQL = """
            INSERT INTO events (
                title, slug, description, overview, image, venue, location, event_date, event_time,
                mode, audience, agenda, organizer, tags, id
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING\s""" + COLUMNS;

    private static final String UPDATE_SQL = """
            UPDATE events SET
                title = ?, slug = ?, description = ?, overview = ?, image = ?, venue = ?, location = ?,
                event_date = ?, event_time = ?, mode = ?, audience = ?, agenda = ?, organizer = ?, tags = ?,
                updated_at = now()
            WHERE id = ?
            RETURNING\s""" + COLUMNS;

    static final RowMapper<Event> EVENT_ROW_MAPPER = (rs, rowNum) -> new Event(
            rs.getObject("id", UUID.class),
            rs.getString("title"),
            rs.getString("slug"),
            rs.getString("description"),
            rs.getString("overview"),
            rs.getString("image"),
            rs.getString("venue"),
            rs.getString("location"),
            rs.getString("event_date"),
            rs.getString("event_time"),
            rs.getString("mode"),
            rs.getString("audience"),
            textArray(rs, "agenda"),
            rs.getString("organizer"),
            textArray(rs, "tags"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getObject("updated_at", OffsetDateTime.class).toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Event save(Event event) {
        boolean isNew = event.id() == null;
        UUID id = isNew ? UUID.randomUUID() : event.id();
        String sql = isNew ? INSERT_SQL : UPDATE_SQL;

        try {
            List<Event> rows = jdbcTemplate.query(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql);
                ps.setString(1, event.title());
                ps.setString(2, event.slug());
                ps.setString(3, event.description());
                ps.setString(4, event.overview());
                ps.setString(5, event.image());
                ps.setString(6, event.venue());
                ps.setString(7, event.location());
                ps.setString(8, event.date());
                ps.setString(9, event.time());
                ps.setString(10, event.mode());
                ps.setString(11, event.audience());
                ps.setArray(12, connection.createArrayOf("text", event.agenda().toArray()));
                ps.setString(13, event.organizer());
                ps.setArray(14, connection.createArrayOf("text", event.tags().toArray()));
                ps.setObject(15, id);
                return ps;
            }, EVENT_ROW_MAPPER);

            Event stored = DataAccessUtils.requiredSingleResult(rows);
            logger.debug("{} event {} ({})", isNew ? "Inserted" : "Updated", stored.id(), stored.slug());
            return stored;

        } catch (DataAccessException e) {
            throw StorageExceptionTranslator.translateEventWrite(e, event.slug());
        }
    }

    @Override
    public boolean existsById(UUID id) {
        try {
            Boolean exists = jdbcTemplate.queryForObject(
                    "SELECT EXISTS (SELECT 1 FROM events WHERE id = ?)", Boolean.class, id);
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw StorageExceptionTranslator.translate(e);
        }
    }

    @Override
    public Optional<Event> findById(UUID id) {
        return findOne("SELECT " + COLUMNS + " FROM events WHERE id = ?", id);
    }

    @Override
    public Optional<Event> findBySlug(String slug) {
        return findOne("SELECT " + COLUMNS + " FROM events WHERE slug = ?", slug);
    }

    private Optional<Event> findOne(String sql, Object key) {
        try {
            return jdbcTemplate.query(sql, EVENT_ROW_MAPPER, key).stream().findFirst();
        } catch (DataAccessException e) {
            throw StorageExceptionTranslator.translate(e);
        }
    }

    private static List<String> textArray(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return List.of();
        }
        return List.of((String[]) array.getArray());
    }
}
