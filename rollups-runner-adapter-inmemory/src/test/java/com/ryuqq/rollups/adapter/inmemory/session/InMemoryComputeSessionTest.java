package com.ryuqq.rollups.adapter.inmemory.session;

import com.ryuqq.rollups.core.model.EpochClaim;
import com.ryuqq.rollups.core.spi.ComputeSessionException;
import com.ryuqq.rollups.testkit.contract.EventChainBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryComputeSession 단위 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryComputeSessionTest {

    private InMemoryComputeSession session;

    @BeforeEach
    void setUp() {
        session = new InMemoryComputeSession();
        session.seedSnapshot("memory://snapshots/0", 0);
    }

    @Test
    void 같은_입력을_재생하면_같은_claim이_나온다() {
        EpochClaim first = runEpoch(session, "a", "b");

        InMemoryComputeSession replay = new InMemoryComputeSession();
        replay.seedSnapshot("memory://snapshots/0", 0);
        EpochClaim second = runEpoch(replay, "a", "b");

        assertThat(second).isEqualTo(first);
    }

    @Test
    void 다른_입력은_다른_claim을_만든다() {
        EpochClaim first = runEpoch(session, "a", "b");

        InMemoryComputeSession other = new InMemoryComputeSession();
        other.seedSnapshot("memory://snapshots/0", 0);
        EpochClaim second = runEpoch(other, "a", "c");

        assertThat(second).isNotEqualTo(first);
    }

    @Test
    void advanceState_index가_하나라도_어긋나면_REJECTED_INPUT() {
        session.startSession("memory://snapshots/0", 0);

        assertThatThrownBy(() -> session.advanceState(0, 1, EventChainBuilder.metadata(0, 1), bytes("a")))
            .isInstanceOf(ComputeSessionException.class)
            .extracting(e -> ((ComputeSessionException) e).getReason())
            .isEqualTo(ComputeSessionException.Reason.REJECTED_INPUT);
        assertThat(session.getProcessedInputs()).isZero();
    }

    @Test
    void advanceState_다른_epoch_입력은_REJECTED_INPUT() {
        session.startSession("memory://snapshots/0", 0);

        assertThatThrownBy(() -> session.advanceState(1, 0, EventChainBuilder.metadata(1, 0), bytes("a")))
            .isInstanceOf(ComputeSessionException.class)
            .extracting(e -> ((ComputeSessionException) e).getReason())
            .isEqualTo(ComputeSessionException.Reason.REJECTED_INPUT);
    }

    @Test
    void finishEpoch_열린_epoch가_아니면_CHECKPOINT_FAILED() {
        session.startSession("memory://snapshots/0", 0);

        assertThatThrownBy(() -> session.finishEpoch(1, "memory://snapshots/2"))
            .isInstanceOf(ComputeSessionException.class)
            .extracting(e -> ((ComputeSessionException) e).getReason())
            .isEqualTo(ComputeSessionException.Reason.CHECKPOINT_FAILED);
        assertThat(session.hasCheckpoint("memory://snapshots/2")).isFalse();
    }

    @Test
    void finishEpoch_다음_epoch를_열고_checkpoint를_남긴다() {
        session.startSession("memory://snapshots/0", 0);
        session.advanceState(0, 0, EventChainBuilder.metadata(0, 0), bytes("a"));

        session.finishEpoch(0, "memory://snapshots/1");

        assertThat(session.getActiveEpoch()).isEqualTo(1);
        assertThat(session.getProcessedInputs()).isZero();
        assertThat(session.hasCheckpoint("memory://snapshots/1")).isTrue();
    }

    @Test
    void startSession_checkpoint의_epoch와_다르면_INVALID_SNAPSHOT() {
        assertThatThrownBy(() -> session.startSession("memory://snapshots/0", 1))
            .isInstanceOf(ComputeSessionException.class)
            .extracting(e -> ((ComputeSessionException) e).getReason())
            .isEqualTo(ComputeSessionException.Reason.INVALID_SNAPSHOT);
    }

    @Test
    void shutdown_이후에는_getEpochClaim이_SESSION_UNREACHABLE() {
        runEpoch(session, "a");
        session.shutdown();

        assertThat(session.isActive()).isFalse();
        assertThatThrownBy(() -> session.getEpochClaim(0))
            .isInstanceOf(ComputeSessionException.class)
            .extracting(e -> ((ComputeSessionException) e).getReason())
            .isEqualTo(ComputeSessionException.Reason.SESSION_UNREACHABLE);
    }

    @Test
    void seedSnapshot_빈_경로는_거부된다() {
        assertThatThrownBy(() -> session.seedSnapshot(" ", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("snapshotPath cannot be null or blank");
    }

    private static EpochClaim runEpoch(InMemoryComputeSession target, String... inputs) {
        target.startSession("memory://snapshots/0", 0);
        for (int i = 0; i < inputs.length; i++) {
            target.advanceState(0, i, EventChainBuilder.metadata(0, i), bytes(inputs[i]));
        }
        target.finishEpoch(0, "memory://snapshots/1");
        return target.getEpochClaim(0);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
