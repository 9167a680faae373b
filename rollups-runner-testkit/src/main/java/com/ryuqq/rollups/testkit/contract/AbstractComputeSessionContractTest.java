package com.ryuqq.rollups.testkit.contract;

import com.ryuqq.rollups.core.model.EpochClaim;
import com.ryuqq.rollups.core.spi.ComputeSession;
import com.ryuqq.rollups.core.spi.ComputeSessionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link ComputeSession} implementations.
 *
 * <p>Subclasses provide the session under test, a way to seed a starting checkpoint,
 * and a way to stop the running session so a new one can be started.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractComputeSessionContractTest {

    protected ComputeSession session;

    /**
     * @return a fresh session adapter with no running session
     */
    protected abstract ComputeSession createSession();

    /**
     * Seeds a checkpoint that opens {@code epoch}.
     *
     * @param epoch epoch the checkpoint opens
     * @return snapshot location to start from
     */
    protected abstract String seedSnapshot(long epoch);

    /**
     * Allocates a fresh location for the checkpoint of {@code epoch}.
     *
     * @param epoch epoch the checkpoint opens
     * @return snapshot location to write to
     */
    protected abstract String allocateSnapshot(long epoch);

    /**
     * Stops the running session, keeping written checkpoints.
     */
    protected abstract void stopSession();

    @BeforeEach
    void setUpSession() {
        session = createSession();
    }

    @Test
    void fullEpoch_AdvanceFinishAndClaim() {
        session.startSession(seedSnapshot(0), 0);

        session.advanceState(0, 0, EventChainBuilder.metadata(0, 0), bytes("a"));
        session.advanceState(0, 1, EventChainBuilder.metadata(0, 1), bytes("b"));
        session.finishEpoch(0, allocateSnapshot(1));

        EpochClaim claim = session.getEpochClaim(0);
        assertEquals(0, claim.epochIndex());
        assertTrue(claim.value().length > 0);
    }

    @Test
    void getEpochClaim_BeforeFinish_ThrowsClaimNotReady() {
        session.startSession(seedSnapshot(0), 0);

        ComputeSessionException exception =
            assertThrows(ComputeSessionException.class, () -> session.getEpochClaim(0));
        assertEquals(ComputeSessionException.Reason.CLAIM_NOT_READY, exception.getReason());
    }

    @Test
    void startSession_Twice_ThrowsAlreadyActive() {
        String location = seedSnapshot(0);
        session.startSession(location, 0);

        ComputeSessionException exception =
            assertThrows(ComputeSessionException.class, () -> session.startSession(location, 0));
        assertEquals(ComputeSessionException.Reason.ALREADY_ACTIVE, exception.getReason());
    }

    @Test
    void startSession_UnknownLocation_ThrowsInvalidSnapshot() {
        ComputeSessionException exception = assertThrows(ComputeSessionException.class,
            () -> session.startSession(allocateSnapshot(7), 7));
        assertEquals(ComputeSessionException.Reason.INVALID_SNAPSHOT, exception.getReason());
    }

    @Test
    void advanceState_WithoutSession_ThrowsSessionUnreachable() {
        ComputeSessionException exception = assertThrows(ComputeSessionException.class,
            () -> session.advanceState(0, 0, EventChainBuilder.metadata(0, 0), bytes("a")));
        assertEquals(ComputeSessionException.Reason.SESSION_UNREACHABLE, exception.getReason());
    }

    @Test
    void finishEpoch_CheckpointResumesAtNextEpoch() {
        session.startSession(seedSnapshot(3), 3);
        session.advanceState(3, 0, EventChainBuilder.metadata(3, 0), bytes("a"));
        String checkpoint = allocateSnapshot(4);
        session.finishEpoch(3, checkpoint);
        stopSession();

        session.startSession(checkpoint, 4);
        session.advanceState(4, 0, EventChainBuilder.metadata(4, 0), bytes("b"));
        session.finishEpoch(4, allocateSnapshot(5));

        assertEquals(4, session.getEpochClaim(4).epochIndex());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
