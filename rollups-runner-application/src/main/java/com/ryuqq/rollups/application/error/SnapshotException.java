package com.ryuqq.rollups.application.error;

/**
 * Snapshot 저장소 호출(조회/할당/기록) 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SnapshotException extends RunnerException {

    /**
     * 생성자.
     *
     * @param operation 실패한 단계
     * @param cause 협력자가 보고한 원인
     */
    public SnapshotException(RunnerOperation operation, Throwable cause) {
        super(operation, operation.description(), cause);
    }
}
