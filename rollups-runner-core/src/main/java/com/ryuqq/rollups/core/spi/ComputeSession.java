package com.ryuqq.rollups.core.spi;

import com.ryuqq.rollups.core.model.EpochClaim;
import com.ryuqq.rollups.core.model.InputMetadata;

/**
 * Compute Session SPI.
 *
 * <p>This interface drives a stateful external compute engine that applies inputs,
 * checkpoints its state when an epoch closes, and produces epoch claims.</p>
 *
 * <p><strong>Session Lifecycle:</strong></p>
 * <pre>
 * startSession(snapshotPath, epoch)
 *   ↓
 * advanceState(epoch, 0, ...) → advanceState(epoch, 1, ...) → ...
 *   ↓
 * finishEpoch(epoch, nextSnapshotPath)   // active epoch becomes epoch + 1
 *   ↓
 * getEpochClaim(epoch)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Exclusive: exactly one runner drives a session</li>
 *   <li>Not thread-safe by contract: calls are issued sequentially by the runner</li>
 *   <li>finishEpoch should tolerate being re-issued for an epoch whose finish was not
 *       recorded by the runner (crash between finish and snapshot persistence)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ComputeSession {

    /**
     * Starts a session from a snapshot.
     *
     * @param snapshotPath location of the checkpoint to load
     * @param epoch the active epoch of the new session
     * @throws IllegalArgumentException if snapshotPath is null or epoch is negative
     * @throws ComputeSessionException with {@code SESSION_UNREACHABLE}, {@code ALREADY_ACTIVE}
     *         or {@code INVALID_SNAPSHOT}
     */
    void startSession(String snapshotPath, long epoch);

    /**
     * Applies one input to the active epoch.
     *
     * @param epochIndex the active epoch
     * @param inputIndex zero-based index of the input within the epoch
     * @param metadata input metadata, passed through untouched
     * @param payload raw input bytes
     * @throws IllegalArgumentException if metadata or payload is null
     * @throws ComputeSessionException with {@code SESSION_UNREACHABLE} or {@code REJECTED_INPUT}
     */
    void advanceState(long epochIndex, long inputIndex, InputMetadata metadata, byte[] payload);

    /**
     * Closes {@code epochIndex} and writes a checkpoint to {@code snapshotPath}.
     *
     * @param epochIndex the epoch to close
     * @param snapshotPath location allocated for the next epoch's snapshot
     * @throws IllegalArgumentException if snapshotPath is null
     * @throws ComputeSessionException with {@code SESSION_UNREACHABLE} or {@code CHECKPOINT_FAILED}
     */
    void finishEpoch(long epochIndex, String snapshotPath);

    /**
     * Retrieves the claim of a finished epoch.
     *
     * @param epochIndex the finished epoch
     * @return the epoch claim
     * @throws ComputeSessionException with {@code SESSION_UNREACHABLE} or {@code CLAIM_NOT_READY}
     */
    EpochClaim getEpochClaim(long epochIndex);
}
