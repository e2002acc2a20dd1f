package com.devevent.registry.application;

import com.devevent.registry.domain.model.Event;
import com.devevent.registry.domain.model.EventCandidate;
import com.devevent.registry.domain.model.WriteResult;

/**
 * Entry point for creating or updating an event.
 */
public interface SubmitEvent {

    /**
     * Normalizes and validates the candidate, then persists it.
     * Nothing is written unless every check passes.
     *
     * @param candidate raw event input, with the stored event as baseline when updating
     * @return the stored event, or the first validation or storage error encountered
     */
    WriteResult<Event> submitEvent(EventCandidate candidate);
}
