package com.ryuqq.rollups.application.runtime;

import com.ryuqq.rollups.core.model.EventId;
import com.ryuqq.rollups.core.statemachine.RunnerState;

/**
 * Rollups Advance Runtime.
 *
 * <p>This interface defines the runner loop that consumes the input event stream,
 * drives the compute session and publishes epoch claims.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * recover()
 *   1. snapshotStore.getLatest()                    → Snapshot{path, epoch}
 *   2. eventLog.findPreviousFinishEpoch(epoch)      → lastConsumedId
 *   3. computeSession.startSession(path, epoch)
 *
 * while (running):
 *   pump()
 *     1. eventLog.consumeInput(lastConsumedId)      → event
 *     2. verify event.parentId == lastConsumedId
 *     3. dispatch:
 *        - AdvanceStateInput → computeSession.advanceState(epoch, inputsSentCount - 1, ...)
 *        - FinishEpoch       → allocate snapshot(epoch + 1) → finishEpoch
 *                              → setLatest → claim (if not produced yet)
 *     4. lastConsumedId = event.id
 * </pre>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>No internal retry: every failure is fatal for the runner instance</li>
 *   <li>Failures surface as {@link com.ryuqq.rollups.application.error.RunnerException}
 *       attributed to the failing operation</li>
 *   <li>An outer supervisor restarts the process, which re-enters recovery</li>
 *   <li>{@link com.ryuqq.rollups.application.error.ChainIntegrityException} is not retryable</li>
 * </ul>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>Strictly single-threaded: one event is fully processed before the next is read</li>
 *   <li>{@link #run()} blocks the calling thread; {@link #shutdown()} may be called from another thread</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Recovers the runner position from the latest snapshot and starts the compute session.
     *
     * @return the id of the event the main loop resumes after
     * @throws IllegalStateException if the runner was already recovered
     * @throws com.ryuqq.rollups.application.error.RunnerException if any collaborator fails
     */
    EventId recover();

    /**
     * Processes exactly one event: consume, verify chain, dispatch.
     *
     * <p>Blocks until the next event is available.</p>
     *
     * @return the id of the event just processed (the new last consumed id)
     * @throws IllegalStateException if the runner is not in STEADY state
     * @throws com.ryuqq.rollups.application.error.RunnerException if processing fails
     */
    EventId pump();

    /**
     * Recovers, then processes events until {@link #shutdown()} is requested,
     * the thread is interrupted, or an error occurs.
     *
     * @throws com.ryuqq.rollups.application.error.RunnerException if recovery or processing fails
     */
    void run();

    /**
     * Requests the main loop to stop before reading the next event.
     *
     * <p>An event already being dispatched is completed first.</p>
     */
    void shutdown();

    /**
     * Returns the current lifecycle state.
     *
     * @return runner state
     */
    RunnerState state();
}
