package com.ryuqq.rollups.application.error;

/**
 * Compute Session 호출(start/advance/finish/claim) 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionException extends RunnerException {

    /**
     * 생성자.
     *
     * @param operation 실패한 단계
     * @param cause 협력자가 보고한 원인
     */
    public SessionException(RunnerOperation operation, Throwable cause) {
        super(operation, operation.description(), cause);
    }
}
