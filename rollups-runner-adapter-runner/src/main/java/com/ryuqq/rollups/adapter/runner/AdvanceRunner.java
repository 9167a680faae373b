package com.ryuqq.rollups.adapter.runner;

import com.ryuqq.rollups.application.error.ChainIntegrityException;
import com.ryuqq.rollups.application.error.LogException;
import com.ryuqq.rollups.application.error.RunnerException;
import com.ryuqq.rollups.application.error.RunnerOperation;
import com.ryuqq.rollups.application.error.SessionException;
import com.ryuqq.rollups.application.error.SnapshotException;
import com.ryuqq.rollups.application.runtime.Runtime;
import com.ryuqq.rollups.core.model.AdvanceStateInput;
import com.ryuqq.rollups.core.model.EpochClaim;
import com.ryuqq.rollups.core.model.Event;
import com.ryuqq.rollups.core.model.EventData;
import com.ryuqq.rollups.core.model.EventId;
import com.ryuqq.rollups.core.model.EventPayload;
import com.ryuqq.rollups.core.model.Snapshot;
import com.ryuqq.rollups.core.spi.ComputeSession;
import com.ryuqq.rollups.core.spi.EventLog;
import com.ryuqq.rollups.core.spi.SnapshotStore;
import com.ryuqq.rollups.core.statemachine.RunnerState;
import com.ryuqq.rollups.core.statemachine.RunnerStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advance Runner 구현체.
 *
 * <p>Event Log의 입력 이벤트를 순서대로 읽어 Compute Session에 전달하고,
 * epoch가 닫힐 때마다 snapshot을 남기고 epoch claim을 게시합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>최신 snapshot 기준 위치 복구 및 세션 시작</li>
 *   <li>이벤트 체인 무결성 검증 (parentId == lastConsumedId)</li>
 *   <li>AdvanceStateInput → advanceState 전달</li>
 *   <li>FinishEpoch → snapshot 할당, finishEpoch, 최신 snapshot 승격, claim 게시</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * recover()
 *   getLatest() → findPreviousFinishEpoch(epoch) → startSession(path, epoch)
 *   ↓
 * pump() 반복:
 *   1. consumeInput(lastConsumedId)
 *   2. parentId 검증 (불일치 시 ChainIntegrityException)
 *   3. 분기:
 *      - AdvanceStateInput → advanceState(epoch, inputsSentCount - 1, metadata, payload)
 *      - FinishEpoch → getStorageDirectory(epoch + 1) → finishEpoch → setLatest
 *                      → wasClaimProduced ? skip : getEpochClaim → produceRollupsClaim
 *   4. lastConsumedId = event.id
 * </pre>
 *
 * <p><strong>실패 처리:</strong> 내부 재시도는 없습니다. 협력 객체의 실패는 단계 정보와 함께
 * Session/Log/Snapshot 예외로 래핑되어 호출자에게 전달되고, Runner는 FAILED 상태가 됩니다.
 * 복구는 외부 supervisor가 새 인스턴스로 수행합니다.</p>
 *
 * <p><strong>동시성:</strong> 단일 스레드 전용입니다. {@link #shutdown()}과 {@link #state()}만
 * 다른 스레드에서 호출할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AdvanceRunner implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(AdvanceRunner.class);

    private final SnapshotStore snapshotStore;
    private final EventLog eventLog;
    private final ComputeSession computeSession;

    private volatile RunnerState state = RunnerState.UNINITIALIZED;
    private volatile boolean stopRequested;
    private EventId lastConsumedId;

    /**
     * 생성자.
     *
     * @param snapshotStore snapshot 저장소
     * @param eventLog 입력 이벤트 로그
     * @param computeSession 연산 세션
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AdvanceRunner(SnapshotStore snapshotStore, EventLog eventLog, ComputeSession computeSession) {
        if (snapshotStore == null) {
            throw new IllegalArgumentException("snapshotStore cannot be null");
        }
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (computeSession == null) {
            throw new IllegalArgumentException("computeSession cannot be null");
        }

        this.snapshotStore = snapshotStore;
        this.eventLog = eventLog;
        this.computeSession = computeSession;
    }

    @Override
    public EventId recover() {
        transitionTo(RunnerState.RECOVERING);
        try {
            Snapshot snapshot = getLatestSnapshot();
            log.debug("Latest snapshot: epoch={}, path={}", snapshot.epoch(), snapshot.path());

            EventId resumeAfter = findFinishEpochInput(snapshot.epoch());
            log.debug("Resuming after event {}", resumeAfter);

            createSession(snapshot);

            lastConsumedId = resumeAfter;
            transitionTo(RunnerState.STEADY);
            log.info("Starting runner main loop (epoch={}, lastConsumedId={})", snapshot.epoch(), resumeAfter);
            return resumeAfter;
        } catch (RunnerException e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public EventId pump() {
        if (state != RunnerState.STEADY) {
            throw new IllegalStateException("Runner is not running (state: " + state + ")");
        }
        try {
            return processNext();
        } catch (RunnerException e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void run() {
        recover();

        while (!stopRequested && !Thread.currentThread().isInterrupted()) {
            try {
                processNext();
            } catch (RunnerException e) {
                if (isCancellation(e)) {
                    log.info("Interrupted while waiting for input after {}", lastConsumedId);
                    break;
                }
                fail(e);
                throw e;
            }
        }

        transitionTo(RunnerState.STOPPED);
        log.info("Runner stopped (lastConsumedId={})", lastConsumedId);
    }

    @Override
    public void shutdown() {
        stopRequested = true;
        log.debug("Shutdown requested (state: {})", state);
    }

    @Override
    public RunnerState state() {
        return state;
    }

    /**
     * 마지막으로 처리한 이벤트 ID 조회.
     *
     * @return lastConsumedId (recover 이전에는 null)
     */
    public EventId getLastConsumedId() {
        return lastConsumedId;
    }

    /**
     * 이벤트 하나 처리 (consume → 검증 → dispatch).
     *
     * @return 처리한 이벤트 ID
     */
    private EventId processNext() {
        Event event = consumeInput(lastConsumedId);
        EventPayload payload = event.payload();
        log.info("Consumed input event (id={}, epoch={}, kind={})",
            event.id(), payload.epochIndex(), payload.data().kind());

        if (!event.chainsFrom(lastConsumedId)) {
            throw new ChainIntegrityException(lastConsumedId, payload.parentId());
        }

        lastConsumedId = switch (payload.data().kind()) {
            case ADVANCE_STATE_INPUT -> handleAdvance(event);
            case FINISH_EPOCH -> handleFinish(event);
        };
        return lastConsumedId;
    }

    /**
     * AdvanceStateInput 처리.
     *
     * <p>입력 인덱스는 해당 이벤트까지 epoch 안에서 보낸 입력 수 - 1입니다.</p>
     *
     * @param event AdvanceStateInput 이벤트
     * @return 처리한 이벤트 ID
     */
    private EventId handleAdvance(Event event) {
        EventPayload payload = event.payload();
        if (payload.inputsSentCount() == 0) {
            throw new LogException(RunnerOperation.CONSUME_INPUT, new IllegalStateException(
                "advance input event " + event.id() + " has inputsSentCount 0"));
        }

        AdvanceStateInput input = (AdvanceStateInput) payload.data();
        long inputIndex = payload.inputsSentCount() - 1;
        log.trace("Sending advance-state input (epoch={}, inputIndex={})", payload.epochIndex(), inputIndex);

        try {
            computeSession.advanceState(payload.epochIndex(), inputIndex, input.metadata(), input.payload());
        } catch (RuntimeException e) {
            throw new SessionException(RunnerOperation.ADVANCE, e);
        }
        return event.id();
    }

    /**
     * FinishEpoch 처리.
     *
     * <p>각 단계는 이전 단계가 성공한 뒤에만 실행됩니다. 최신 snapshot 승격은
     * finishEpoch 성공 이후, claim 게시는 승격 이후입니다.</p>
     *
     * @param event FinishEpoch 이벤트 (payload의 epoch가 닫히는 epoch)
     * @return 처리한 이벤트 ID
     */
    private EventId handleFinish(Event event) {
        long epochIndex = event.payload().epochIndex();
        Snapshot snapshot = getStorageDirectory(epochIndex + 1);
        log.trace("Got storage directory {} for epoch {}", snapshot.path(), snapshot.epoch());

        try {
            computeSession.finishEpoch(epochIndex, snapshot.path());
        } catch (RuntimeException e) {
            throw new SessionException(RunnerOperation.FINISH_EPOCH, e);
        }
        log.trace("Finished epoch {} in compute session", epochIndex);

        try {
            snapshotStore.setLatest(snapshot);
        } catch (RuntimeException e) {
            throw new SnapshotException(RunnerOperation.SET_LATEST_SNAPSHOT, e);
        }
        log.trace("Set latest snapshot to epoch {}", snapshot.epoch());

        boolean claimProduced;
        try {
            claimProduced = eventLog.wasClaimProduced(epochIndex);
        } catch (RuntimeException e) {
            throw new LogException(RunnerOperation.PEEK_CLAIM, e);
        }
        if (claimProduced) {
            log.trace("Claim for epoch {} already produced, skipping", epochIndex);
            return event.id();
        }

        EpochClaim claim = getEpochClaim(epochIndex);

        try {
            eventLog.produceRollupsClaim(epochIndex, claim);
        } catch (RuntimeException e) {
            throw new LogException(RunnerOperation.PRODUCE_CLAIM, e);
        }
        log.info("Produced epoch claim {}", claim);
        return event.id();
    }

    private Snapshot getLatestSnapshot() {
        Snapshot snapshot;
        try {
            snapshot = snapshotStore.getLatest();
        } catch (RuntimeException e) {
            throw new SnapshotException(RunnerOperation.GET_LATEST_SNAPSHOT, e);
        }
        if (snapshot == null) {
            throw new SnapshotException(RunnerOperation.GET_LATEST_SNAPSHOT,
                new IllegalStateException("snapshot store returned no latest snapshot"));
        }
        return snapshot;
    }

    private Snapshot getStorageDirectory(long epoch) {
        Snapshot snapshot;
        try {
            snapshot = snapshotStore.getStorageDirectory(epoch);
        } catch (RuntimeException e) {
            throw new SnapshotException(RunnerOperation.GET_STORAGE_DIRECTORY, e);
        }
        if (snapshot == null) {
            throw new SnapshotException(RunnerOperation.GET_STORAGE_DIRECTORY,
                new IllegalStateException("snapshot store returned no storage directory for epoch " + epoch));
        }
        return snapshot;
    }

    private EventId findFinishEpochInput(long epoch) {
        EventId id;
        try {
            id = eventLog.findPreviousFinishEpoch(epoch);
        } catch (RuntimeException e) {
            throw new LogException(RunnerOperation.FIND_FINISH_EPOCH_INPUT, e);
        }
        if (id == null) {
            throw new LogException(RunnerOperation.FIND_FINISH_EPOCH_INPUT,
                new IllegalStateException("event log returned no finish epoch event for epoch " + epoch));
        }
        return id;
    }

    private Event consumeInput(EventId after) {
        Event event;
        try {
            event = eventLog.consumeInput(after);
        } catch (RuntimeException e) {
            throw new LogException(RunnerOperation.CONSUME_INPUT, e);
        }
        if (event == null) {
            throw new LogException(RunnerOperation.CONSUME_INPUT,
                new IllegalStateException("event log returned no event after " + after));
        }
        return event;
    }

    private EpochClaim getEpochClaim(long epochIndex) {
        EpochClaim claim;
        try {
            claim = computeSession.getEpochClaim(epochIndex);
        } catch (RuntimeException e) {
            throw new SessionException(RunnerOperation.GET_EPOCH_CLAIM, e);
        }
        if (claim == null) {
            throw new SessionException(RunnerOperation.GET_EPOCH_CLAIM,
                new IllegalStateException("compute session returned no claim for epoch " + epochIndex));
        }
        return claim;
    }

    private void createSession(Snapshot snapshot) {
        try {
            computeSession.startSession(snapshot.path(), snapshot.epoch());
        } catch (RuntimeException e) {
            throw new SessionException(RunnerOperation.CREATE_SESSION, e);
        }
    }

    private boolean isCancellation(RunnerException e) {
        return e.getOperation() == RunnerOperation.CONSUME_INPUT
            && Thread.currentThread().isInterrupted();
    }

    private void fail(RunnerException e) {
        log.error("Runner failed at {} (lastConsumedId={}): {}", e.getOperation(), lastConsumedId, e.getMessage(), e);
        transitionTo(RunnerState.FAILED);
    }

    private void transitionTo(RunnerState next) {
        state = RunnerStateTransition.transition(state, next);
    }
}
