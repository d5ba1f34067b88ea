package com.fiftyalert.dispatcher.domain.event;

import com.fiftyalert.common.event.ScoringEvent;
import com.fiftyalert.dispatcher.domain.exceptions.EventSourceException;

import java.util.List;

public interface ScoringEventSource {

    /**
     * @throws EventSourceException when the candidate list cannot be obtained at all
     */
    List<ScoringEvent> fetchCandidates();
}
