package com.koni.homeenergy.application.port;

import com.koni.homeenergy.domain.event.SampleRecorded;

/**
 * Port interface for announcing stored samples to real-time observers.
 * The application layer depends on this abstraction, not on the transport.
 *
 * Implementations hand the event off and return immediately; delivery problems are
 * theirs to log and must never reach the ingestion caller.
 */
public interface SamplePublisher {

    /**
     * Publishes a SampleRecorded event to every currently connected subscriber.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     */
    void publish(SampleRecorded event);
}
