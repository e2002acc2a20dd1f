package com.devevent.registry.application;

import static com.devevent.registry.domain.validation.FieldValidator.isNonEmptySequence;
import static com.devevent.registry.domain.validation.FieldValidator.isNonEmptyText;

import com.devevent.registry.domain.model.ErrorKind;
import com.devevent.registry.domain.model.Event;
import com.devevent.registry.domain.model.EventCandidate;
import com.devevent.registry.domain.model.ValidationError;
import com.devevent.registry.domain.model.WriteResult;
import com.devevent.registry.domain.port.out.EventRepository;
import com.devevent.registry.domain.port.out.SlugConflictException;
import com.devevent.registry.domain.port.out.StorageUnavailableException;
import com.devevent.registry.domain.validation.FieldValidator;
import com.devevent.registry.domain.validation.SlugGenerator;
import com.devevent.registry.domain.validation.TemporalNormalizationException;
import com.devevent.registry.domain.validation.TemporalNormalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ordered validation pass in front of every event write.
 * Steps short-circuit on the first failure; the repository is only reached when all of them pass.
 */
@Service
public class EventWritePipeline implements SubmitEvent {

    private static final Logger logger = LoggerFactory.getLogger(EventWritePipeline.class);

    private final EventRepository eventRepository;

    public EventWritePipeline(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    @Override
    public WriteResult<Event> submitEvent(EventCandidate candidate) {
        logger.debug("Validating event candidate '{}' (new: {})", candidate.title(), candidate.isNew());

        String title = trim(candidate.title());
        String slug = trim(candidate.slug());
        String date = trim(candidate.date());
        String time = trim(candidate.time());

        // 1. slug follows the title
        if (candidate.titleChanged() || !isNonEmptyText(slug)) {
            if (!isNonEmptyText(title)) {
                return reject(ValidationError.of(ErrorKind.MISSING_TITLE, "title", "Event title is required."));
            }
            slug = SlugGenerator.slugify(title);
            if (slug.isEmpty()) {
                return reject(ValidationError.of(ErrorKind.INVALID_TITLE, "title",
                        "Event title must contain at least one letter or digit."));
            }
        }

        // 2. date
        if (candidate.dateChanged()) {
            if (!isNonEmptyText(date)) {
                return reject(ValidationError.of(ErrorKind.MISSING_DATE, "date", "Event date is required."));
            }
            try {
                date = TemporalNormalizer.normalizeDate(date);
            } catch (TemporalNormalizationException e) {
                return reject(ValidationError.of(e.getKind(), "date", e.getMessage()));
            }
        }

        // 3. time
        if (candidate.timeChanged()) {
            if (!isNonEmptyText(time)) {
                return reject(ValidationError.of(ErrorKind.MISSING_TIME, "time", "Event time is required."));
            }
            try {
                time = TemporalNormalizer.normalizeTime(time);
            } catch (TemporalNormalizationException e) {
                return reject(ValidationError.of(e.getKind(), "time", e.getMessage()));
            }
        }

        Event normalized = new Event(
                candidate.id(),
                title,
                slug,
                trim(candidate.description()),
                trim(candidate.overview()),
                trim(candidate.image()),
                trim(candidate.venue()),
                trim(candidate.location()),
                date,
                time,
                trim(candidate.mode()),
                trim(candidate.audience()),
                candidate.agenda(),
                trim(candidate.organizer()),
                candidate.tags(),
                null,
                null
        );

        // 4. required text fields, in declaration order
        for (Map.Entry<String, String> field : requiredTextFields(normalized).entrySet()) {
            if (!isNonEmptyText(field.getValue())) {
                return reject(ValidationError.missingField(field.getKey()));
            }
        }

        // 5. sequences
        if (!isNonEmptySequence(normalized.agenda())) {
            return reject(ValidationError.of(ErrorKind.EMPTY_AGENDA, "agenda",
                    "Agenda must contain at least one non-empty item."));
        }
        if (!isNonEmptySequence(normalized.tags())) {
            return reject(ValidationError.of(ErrorKind.EMPTY_TAGS, "tags",
                    "Tags must contain at least one non-empty item."));
        }

        // 6. delegated write
        return persist(withImmutableLists(normalized));
    }

    private WriteResult<Event> persist(Event event) {
        try {
            Event stored = eventRepository.save(event);
            logger.info("Stored event {} with slug '{}'", stored.id(), stored.slug());
            return WriteResult.success(stored);
        } catch (SlugConflictException e) {
            logger.warn("Rejected event '{}': slug '{}' already taken", event.title(), e.getSlug());
            return WriteResult.failure(ErrorKind.SLUG_CONFLICT, "slug", e.getMessage());
        } catch (StorageUnavailableException e) {
            logger.error("Storage unavailable while saving event '{}'", event.slug(), e);
            return WriteResult.failure(ErrorKind.STORAGE_UNAVAILABLE, null, e.getMessage());
        }
    }

    private static Map<String, String> requiredTextFields(Event event) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("title", event.title());
        fields.put("description", event.description());
        fields.put("overview", event.overview());
        fields.put("image", event.image());
        fields.put("venue", event.venue());
        fields.put("location", event.location());
        fields.put("date", event.date());
        fields.put("time", event.time());
        fields.put("mode", event.mode());
        fields.put("audience", event.audience());
        fields.put("organizer", event.organizer());
        return fields;
    }

    private static Event withImmutableLists(Event event) {
        return new Event(event.id(), event.title(), event.slug(), event.description(), event.overview(),
                event.image(), event.venue(), event.location(), event.date(), event.time(), event.mode(),
                event.audience(), List.copyOf(event.agenda()), event.organizer(), List.copyOf(event.tags()),
                null, null);
    }

    private static WriteResult<Event> reject(ValidationError error) {
        logger.warn("Rejected event candidate: {} ({})", error.kind(), error.message());
        return WriteResult.failure(error);
    }

    private static String trim(String value) {
        return FieldValidator.trimWhitespace(value);
    }
}
