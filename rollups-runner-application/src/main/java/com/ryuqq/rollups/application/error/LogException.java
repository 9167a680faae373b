package com.ryuqq.rollups.application.error;

/**
 * 이벤트 로그 호출(위치 조회/consume/claim 조회/claim 게시) 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LogException extends RunnerException {

    /**
     * 생성자.
     *
     * @param operation 실패한 단계
     * @param cause 협력자가 보고한 원인
     */
    public LogException(RunnerOperation operation, Throwable cause) {
        super(operation, operation.description(), cause);
    }
}
