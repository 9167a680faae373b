package com.ryuqq.rollups.testkit.contract;

import com.ryuqq.rollups.core.model.AdvanceStateInput;
import com.ryuqq.rollups.core.model.Event;
import com.ryuqq.rollups.core.model.EventData;
import com.ryuqq.rollups.core.model.EventId;
import com.ryuqq.rollups.core.model.EventPayload;
import com.ryuqq.rollups.core.model.FinishEpoch;
import com.ryuqq.rollups.core.model.InputMetadata;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixture builder for well-formed input event chains.
 *
 * <p>Every built event carries the id of the previous one as parent, starting from
 * {@link EventId#INITIAL}. Ids are sequential stream offsets ({@code "1-0"}, {@code "2-0"}, ...),
 * and {@code inputsSentCount} counts the advance inputs of the current epoch.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * List&lt;Event&gt; chain = EventChainBuilder.create()
 *     .finishEpochs(3)          // F0, F1, F2
 *     .advance("deposit")      // epoch 3, inputsSentCount 1
 *     .finishEpoch()           // F3
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventChainBuilder {

    private static final String SENDER = "0x00000000000000000000000000000000000000aa";

    private final List<Event> events = new ArrayList<>();
    private long sequence;
    private long epoch;
    private long inputsSent;

    private EventChainBuilder() {
    }

    /**
     * @return a builder positioned at epoch 0 with an empty chain
     */
    public static EventChainBuilder create() {
        return new EventChainBuilder();
    }

    /**
     * Appends an advance input with UTF-8 text payload.
     *
     * @param text payload text
     * @return this builder
     */
    public EventChainBuilder advance(String text) {
        return advance(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Appends an advance input to the current epoch.
     *
     * @param payload payload bytes
     * @return this builder
     */
    public EventChainBuilder advance(byte[] payload) {
        InputMetadata metadata = metadata(epoch, inputsSent);
        inputsSent++;
        append(AdvanceStateInput.of(metadata, payload));
        return this;
    }

    /**
     * Appends a finish-epoch event and opens the next epoch.
     *
     * @return this builder
     */
    public EventChainBuilder finishEpoch() {
        append(FinishEpoch.instance());
        epoch++;
        inputsSent = 0;
        return this;
    }

    /**
     * Appends {@code count} consecutive finish-epoch events.
     *
     * @param count number of epochs to close
     * @return this builder
     */
    public EventChainBuilder finishEpochs(int count) {
        for (int i = 0; i < count; i++) {
            finishEpoch();
        }
        return this;
    }

    /**
     * @return immutable copy of the chain built so far
     */
    public List<Event> build() {
        return List.copyOf(events);
    }

    /**
     * @return the most recently appended event
     * @throws IllegalStateException if the chain is empty
     */
    public Event last() {
        if (events.isEmpty()) {
            throw new IllegalStateException("chain is empty");
        }
        return events.get(events.size() - 1);
    }

    /**
     * Creates deterministic metadata for an input.
     *
     * @param epochIndex epoch of the input
     * @param inputIndex index of the input inside the epoch
     * @return metadata
     */
    public static InputMetadata metadata(long epochIndex, long inputIndex) {
        return new InputMetadata(SENDER, 100 + epochIndex * 10 + inputIndex, 1_700_000_000L, epochIndex, inputIndex);
    }

    private void append(EventData data) {
        EventId parentId = events.isEmpty() ? EventId.INITIAL : last().id();
        EventId id = EventId.of(++sequence + "-0");
        events.add(Event.of(id, new EventPayload(epoch, inputsSent, parentId, data)));
    }
}
