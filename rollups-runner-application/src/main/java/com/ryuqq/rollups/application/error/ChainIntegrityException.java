package com.ryuqq.rollups.application.error;

import com.ryuqq.rollups.core.model.EventId;

/**
 * 이벤트 체인 무결성 위반 (parentId 불일치).
 *
 * <p>로그 손상이나 두 번째 consumer의 존재를 의미하므로, 프로세스를 그대로 재시작해도
 * 같은 불일치가 재현됩니다. 따라서 {@link #isRetryable()}은 항상 false입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChainIntegrityException extends RunnerException {

    private final EventId expected;
    private final EventId got;

    /**
     * 생성자.
     *
     * @param expected 마지막으로 처리한 이벤트 ID
     * @param got 수신한 이벤트의 parentId
     * @throws IllegalArgumentException expected 또는 got이 null인 경우
     */
    public ChainIntegrityException(EventId expected, EventId got) {
        super(RunnerOperation.VERIFY_PARENT,
            RunnerOperation.VERIFY_PARENT.description() + " expected=" + expected + " got=" + got,
            null);
        if (expected == null || got == null) {
            throw new IllegalArgumentException("expected and got cannot be null");
        }
        this.expected = expected;
        this.got = got;
    }

    public EventId getExpected() {
        return expected;
    }

    public EventId getGot() {
        return got;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
