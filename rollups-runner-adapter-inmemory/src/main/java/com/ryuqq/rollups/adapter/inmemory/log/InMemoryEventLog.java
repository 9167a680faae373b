package com.ryuqq.rollups.adapter.inmemory.log;

import com.ryuqq.rollups.core.model.AdvanceStateInput;
import com.ryuqq.rollups.core.model.EpochClaim;
import com.ryuqq.rollups.core.model.Event;
import com.ryuqq.rollups.core.model.EventData;
import com.ryuqq.rollups.core.model.EventId;
import com.ryuqq.rollups.core.model.EventPayload;
import com.ryuqq.rollups.core.model.FinishEpoch;
import com.ryuqq.rollups.core.model.InputMetadata;
import com.ryuqq.rollups.core.spi.EventLog;
import com.ryuqq.rollups.core.spi.EventLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link EventLog} for testing and reference purposes.
 *
 * <p>The log keeps an append-only list of input events and an ordered claim stream.
 * Besides the SPI it exposes the producer side, so tests can play the upstream role.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Well-formed chain building: {@link #appendAdvance(byte[])} and {@link #appendFinishEpoch()}</li>
 *   <li>Arbitrary appends for corruption scenarios: {@link #appendRaw(Event)}</li>
 *   <li>Blocking {@link #consumeInput(EventId)} woken up by appends</li>
 * </ul>
 *
 * <p><strong>Stream Ids:</strong> built events get sequential offsets {@code "1-0"}, {@code "2-0"}, ...</p>
 *
 * <p><strong>Claim Stream:</strong> claims are appended in epoch order. As with a real
 * stream, only the last entry is inspected: an epoch counts as claimed when the last
 * claim's epoch is greater than or equal to it.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart (the instance can be shared between runner instances
 *       to simulate a durable log)</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLog.class);
    private static final String DEFAULT_SENDER = "0x0000000000000000000000000000000000000000";

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();

    private final List<Event> events = new ArrayList<>();
    private final Map<EventId, Integer> positions = new HashMap<>();
    private final List<EpochClaim> claims = new ArrayList<>();

    private long sequence;
    private long currentEpoch;
    private long inputsSentInEpoch;

    /**
     * Appends an advance-state input to the current epoch with generated metadata.
     *
     * @param payload input bytes
     * @return the appended event
     * @throws IllegalArgumentException if payload is null
     */
    public Event appendAdvance(byte[] payload) {
        lock.lock();
        try {
            InputMetadata metadata = new InputMetadata(
                DEFAULT_SENDER,
                sequence + 1,
                System.currentTimeMillis() / 1000,
                currentEpoch,
                inputsSentInEpoch
            );
            return appendAdvance(metadata, payload);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends an advance-state input to the current epoch.
     *
     * @param metadata input metadata
     * @param payload input bytes
     * @return the appended event
     * @throws IllegalArgumentException if metadata or payload is null
     */
    public Event appendAdvance(InputMetadata metadata, byte[] payload) {
        lock.lock();
        try {
            inputsSentInEpoch++;
            return appendBuilt(AdvanceStateInput.of(metadata, payload));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a finish-epoch event closing the current epoch.
     *
     * @return the appended event
     */
    public Event appendFinishEpoch() {
        lock.lock();
        try {
            Event event = appendBuilt(FinishEpoch.instance());
            currentEpoch++;
            inputsSentInEpoch = 0;
            return event;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends an arbitrary event, without any chain validation.
     *
     * @param event the event to append
     * @throws IllegalArgumentException if event is null or its id is already in the log
     */
    public void appendRaw(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        lock.lock();
        try {
            if (positions.containsKey(event.id())) {
                throw new IllegalArgumentException("event id already in log: " + event.id());
            }
            append(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public EventId findPreviousFinishEpoch(long epoch) {
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must be non-negative (current: " + epoch + ")");
        }
        if (epoch == 0) {
            return EventId.INITIAL;
        }

        lock.lock();
        try {
            for (int i = events.size() - 1; i >= 0; i--) {
                EventPayload payload = events.get(i).payload();
                if (payload.data().kind() == EventData.Kind.FINISH_EPOCH && payload.epochIndex() == epoch - 1) {
                    return events.get(i).id();
                }
            }
        } finally {
            lock.unlock();
        }
        throw new EventLogException(EventLogException.Reason.NOT_FOUND,
            "finish epoch event for epoch " + (epoch - 1) + " not found");
    }

    /**
     * {@inheritDoc}
     *
     * <p>Blocks until an event is appended after {@code after}. Interruption of the
     * waiting thread is reported as {@code LOG_UNAVAILABLE} with the interrupt flag restored.</p>
     */
    @Override
    public Event consumeInput(EventId after) {
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }

        lock.lock();
        try {
            int index;
            if (after.isInitial()) {
                index = 0;
            } else {
                Integer position = positions.get(after);
                if (position == null) {
                    throw new EventLogException(EventLogException.Reason.LOG_UNAVAILABLE,
                        "unknown event id: " + after);
                }
                index = position + 1;
            }

            while (events.size() <= index) {
                log.trace("waiting for event after {}", after);
                appended.await();
            }
            return events.get(index);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventLogException(EventLogException.Reason.LOG_UNAVAILABLE,
                "interrupted while waiting for event after " + after, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean wasClaimProduced(long epoch) {
        lock.lock();
        try {
            EpochClaim last = lastClaim();
            return last != null && last.epochIndex() >= epoch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void produceRollupsClaim(long epoch, EpochClaim claim) {
        if (claim == null) {
            throw new IllegalArgumentException("claim cannot be null");
        }
        if (claim.epochIndex() != epoch) {
            throw new IllegalArgumentException(
                "claim epoch " + claim.epochIndex() + " does not match epoch " + epoch);
        }

        lock.lock();
        try {
            EpochClaim last = lastClaim();
            if (last != null && epoch <= last.epochIndex()) {
                throw new EventLogException(EventLogException.Reason.DUPLICATE_CLAIM,
                    "claim for epoch " + epoch + " already produced (last claimed epoch: " + last.epochIndex() + ")");
            }
            claims.add(claim);
            log.debug("claim for epoch {} appended to claim stream", epoch);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of all input events in append order.
     *
     * @return input events
     */
    public List<Event> getEvents() {
        lock.lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of all published claims in publication order.
     *
     * @return claims
     */
    public List<EpochClaim> getClaims() {
        lock.lock();
        try {
            return List.copyOf(claims);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the epoch that the next built event belongs to.
     *
     * @return current epoch index
     */
    public long getCurrentEpoch() {
        lock.lock();
        try {
            return currentEpoch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears all events and claims (for test cleanup).
     */
    public void clear() {
        lock.lock();
        try {
            events.clear();
            positions.clear();
            claims.clear();
            sequence = 0;
            currentEpoch = 0;
            inputsSentInEpoch = 0;
        } finally {
            lock.unlock();
        }
    }

    private Event appendBuilt(EventData data) {
        EventId parentId = events.isEmpty() ? EventId.INITIAL : events.get(events.size() - 1).id();
        Event event = Event.of(nextId(), new EventPayload(currentEpoch, inputsSentInEpoch, parentId, data));
        append(event);
        return event;
    }

    private void append(Event event) {
        positions.put(event.id(), events.size());
        events.add(event);
        appended.signalAll();
    }

    private EventId nextId() {
        EventId id;
        do {
            id = EventId.of(++sequence + "-0");
        } while (positions.containsKey(id));
        return id;
    }

    private EpochClaim lastClaim() {
        return claims.isEmpty() ? null : claims.get(claims.size() - 1);
    }
}
