package com.ryuqq.rollups.adapter.inmemory.session;

import com.ryuqq.rollups.core.model.EpochClaim;
import com.ryuqq.rollups.core.model.InputMetadata;
import com.ryuqq.rollups.core.spi.ComputeSession;
import com.ryuqq.rollups.core.spi.ComputeSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory implementation of {@link ComputeSession} for testing and reference purposes.
 *
 * <p>The machine state is a running SHA-256 digest over every processed payload, so
 * replaying the same inputs from the same checkpoint always yields the same claim.</p>
 *
 * <p><strong>Checkpoints:</strong> checkpoints are keyed by snapshot location. A session
 * can only be started from a location that was seeded with {@link #seedSnapshot(String, long)}
 * or written by a previous {@link #finishEpoch(long, String)}.</p>
 *
 * <p><strong>Strict input checking:</strong> an advance is rejected unless its epoch is the
 * open epoch and its index equals the number of inputs already processed in that epoch.
 * This surfaces off-by-one errors in the caller immediately.</p>
 *
 * <p><strong>Thread Safety:</strong> all methods are synchronized.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryComputeSession implements ComputeSession {

    private static final Logger log = LoggerFactory.getLogger(InMemoryComputeSession.class);
    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final byte[] GENESIS_STATE = new byte[32];

    private final Map<String, Checkpoint> checkpoints = new HashMap<>();
    private final Map<Long, EpochClaim> claims = new HashMap<>();

    private ActiveSession active;

    /**
     * Registers a checkpoint with an empty machine state.
     *
     * @param snapshotPath snapshot location
     * @param epoch epoch the checkpoint opens
     * @throws IllegalArgumentException if snapshotPath is null or blank, or epoch is negative
     */
    public synchronized void seedSnapshot(String snapshotPath, long epoch) {
        validatePath(snapshotPath);
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must be non-negative (current: " + epoch + ")");
        }
        checkpoints.put(snapshotPath, new Checkpoint(epoch, GENESIS_STATE));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized void startSession(String snapshotPath, long epoch) {
        validatePath(snapshotPath);
        if (active != null) {
            throw new ComputeSessionException(ComputeSessionException.Reason.ALREADY_ACTIVE,
                "session already active at epoch " + active.epoch);
        }

        Checkpoint checkpoint = checkpoints.get(snapshotPath);
        if (checkpoint == null) {
            throw new ComputeSessionException(ComputeSessionException.Reason.INVALID_SNAPSHOT,
                "no checkpoint at " + snapshotPath);
        }
        if (checkpoint.epoch() != epoch) {
            throw new ComputeSessionException(ComputeSessionException.Reason.INVALID_SNAPSHOT,
                "checkpoint at " + snapshotPath + " opens epoch " + checkpoint.epoch() + ", not " + epoch);
        }

        active = new ActiveSession(epoch, checkpoint.state());
        log.debug("session started from {} at epoch {}", snapshotPath, epoch);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized void advanceState(long epochIndex, long inputIndex, InputMetadata metadata, byte[] payload) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        ActiveSession session = requireActive();

        if (epochIndex != session.epoch) {
            throw new ComputeSessionException(ComputeSessionException.Reason.REJECTED_INPUT,
                "input for epoch " + epochIndex + " but open epoch is " + session.epoch);
        }
        if (inputIndex != session.processedInputs) {
            throw new ComputeSessionException(ComputeSessionException.Reason.REJECTED_INPUT,
                "expected input index " + session.processedInputs + " but got " + inputIndex);
        }

        session.state = digest(session.state, payload);
        session.processedInputs++;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized void finishEpoch(long epochIndex, String snapshotPath) {
        validatePath(snapshotPath);
        ActiveSession session = requireActive();

        if (epochIndex != session.epoch) {
            throw new ComputeSessionException(ComputeSessionException.Reason.CHECKPOINT_FAILED,
                "cannot finish epoch " + epochIndex + " while epoch " + session.epoch + " is open");
        }

        byte[] claimValue = digest(session.state, ByteBuffer.allocate(Long.BYTES).putLong(epochIndex).array());
        claims.put(epochIndex, EpochClaim.of(epochIndex, claimValue));
        checkpoints.put(snapshotPath, new Checkpoint(epochIndex + 1, session.state));

        session.epoch = epochIndex + 1;
        session.processedInputs = 0;
        log.debug("epoch {} finished, checkpoint written to {}", epochIndex, snapshotPath);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized EpochClaim getEpochClaim(long epochIndex) {
        requireActive();
        EpochClaim claim = claims.get(epochIndex);
        if (claim == null) {
            throw new ComputeSessionException(ComputeSessionException.Reason.CLAIM_NOT_READY,
                "epoch " + epochIndex + " is not finished");
        }
        return claim;
    }

    /**
     * Ends the active session, if any. Checkpoints and claims are kept.
     */
    public synchronized void shutdown() {
        if (active != null) {
            log.debug("session at epoch {} shut down", active.epoch);
        }
        active = null;
    }

    /**
     * @return true if a session is running
     */
    public synchronized boolean isActive() {
        return active != null;
    }

    /**
     * Returns the epoch open in the active session.
     *
     * @return open epoch index
     * @throws IllegalStateException if no session is active
     */
    public synchronized long getActiveEpoch() {
        if (active == null) {
            throw new IllegalStateException("no active session");
        }
        return active.epoch;
    }

    /**
     * Returns the number of inputs processed in the open epoch.
     *
     * @return processed input count
     * @throws IllegalStateException if no session is active
     */
    public synchronized long getProcessedInputs() {
        if (active == null) {
            throw new IllegalStateException("no active session");
        }
        return active.processedInputs;
    }

    /**
     * @param snapshotPath snapshot location
     * @return true if a checkpoint exists at the location
     */
    public synchronized boolean hasCheckpoint(String snapshotPath) {
        return checkpoints.containsKey(snapshotPath);
    }

    private ActiveSession requireActive() {
        if (active == null) {
            throw new ComputeSessionException(ComputeSessionException.Reason.SESSION_UNREACHABLE,
                "no active session");
        }
        return active;
    }

    private static void validatePath(String snapshotPath) {
        if (snapshotPath == null || snapshotPath.isBlank()) {
            throw new IllegalArgumentException("snapshotPath cannot be null or blank");
        }
    }

    private static byte[] digest(byte[] state, byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            digest.update(state);
            digest.update(input);
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }

    private record Checkpoint(long epoch, byte[] state) {
        Checkpoint {
            state = Arrays.copyOf(state, state.length);
        }
    }

    private static final class ActiveSession {
        private long epoch;
        private long processedInputs;
        private byte[] state;

        private ActiveSession(long epoch, byte[] state) {
            this.epoch = epoch;
            this.state = state;
        }
    }
}
