package com.ryuqq.rollups.core.spi;

import com.ryuqq.rollups.core.model.EpochClaim;
import com.ryuqq.rollups.core.model.Event;
import com.ryuqq.rollups.core.model.EventId;

/**
 * Event Log SPI.
 *
 * <p>This interface exposes the linear, parent-linked input stream consumed by the runner,
 * and the claim stream the runner publishes to.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Locating the finish-epoch event that precedes a given epoch (recovery)</li>
 *   <li>Blocking delivery of the next input event in stream order</li>
 *   <li>Answering whether the claim of an epoch was already published</li>
 *   <li>Publishing epoch claims</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Ordering: events are delivered in append order</li>
 *   <li>No cursor: the log does not track the consumer position, the runner passes it on every read</li>
 *   <li>Transport concerns (reconnect, transient retry) belong to the implementation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventLog {

    /**
     * Locates the finish-epoch event that precedes resuming into {@code epoch}.
     *
     * <p>For {@code epoch = 0} there is no such event and {@link EventId#INITIAL} is returned.
     * Otherwise the result is the id of the finish-epoch event of epoch {@code epoch - 1}.</p>
     *
     * @param epoch the epoch the runner resumes into
     * @return the id to resume consumption after
     * @throws IllegalArgumentException if epoch is negative
     * @throws EventLogException with {@code NOT_FOUND} or {@code LOG_UNAVAILABLE}
     */
    EventId findPreviousFinishEpoch(long epoch);

    /**
     * Reads the event appended right after {@code after}.
     *
     * <p>This method blocks until such an event exists. The returned event's parent id is
     * not validated here; chain verification is the caller's job.</p>
     *
     * @param after the id of the last consumed event
     * @return the next event
     * @throws IllegalArgumentException if after is null
     * @throws EventLogException with {@code LOG_UNAVAILABLE}
     */
    Event consumeInput(EventId after);

    /**
     * Checks whether the claim for {@code epoch} has already been published.
     *
     * @param epoch the epoch index
     * @return true if a claim for this epoch exists in the claim stream
     * @throws EventLogException with {@code LOG_UNAVAILABLE}
     */
    boolean wasClaimProduced(long epoch);

    /**
     * Publishes the claim of {@code epoch}.
     *
     * @param epoch the epoch index
     * @param claim the claim produced by the compute session
     * @throws IllegalArgumentException if claim is null
     * @throws EventLogException with {@code LOG_UNAVAILABLE} or {@code DUPLICATE_CLAIM}
     */
    void produceRollupsClaim(long epoch, EpochClaim claim);
}
