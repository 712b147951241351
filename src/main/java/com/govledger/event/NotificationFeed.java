package com.govledger.event;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory feed of the most recent committed notifications.
 *
 * Presentation clients poll this feed (GET /events) to refresh their view
 * instead of re-reading every proposal. Oldest entries are dropped once the
 * capacity is reached; the feed is not persisted across restarts.
 */
@Component
public class NotificationFeed {

    private final int capacity;
    private final Deque<GovernanceEvent> events;

    public NotificationFeed(@Value("${govledger.events.feed-capacity:100}") int capacity) {
        if (capacity < 1) {
            throw new IllegalStateException("govledger.events.feed-capacity must be at least 1");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEvent(GovernanceEvent event) {
        synchronized (events) {
            if (events.size() == capacity) {
                events.removeFirst();
            }
            events.addLast(event);
        }
    }

    /** All retained notifications, oldest first. */
    public List<GovernanceEvent> recent() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    /** At most {@code limit} newest notifications, oldest first. */
    public List<GovernanceEvent> recent(int limit) {
        List<GovernanceEvent> all = recent();
        if (limit <= 0) {
            return List.of();
        }
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    public int getCapacity() {
        return capacity;
    }
}
