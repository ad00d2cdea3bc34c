package io.swarmmesh.events;

import io.swarmmesh.observability.EventJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Appends every event to an {@link EventJournal}. Write failures are logged, not propagated.
 */
public final class JournalEventPublisher implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(JournalEventPublisher.class);

    private final EventJournal journal;

    public JournalEventPublisher(EventJournal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    @Override
    public void publish(NetworkEvent event) {
        try {
            journal.append(event);
        } catch (RuntimeException e) {
            log.warn("Failed to journal {} event from {}: {}", event.type(), event.source(), e.getMessage());
        }
    }
}
