package com.ryuqq.rollups.application.error;

/**
 * 러너 실패의 최상위 예외.
 *
 * <p>러너는 내부 재시도를 하지 않으며, 모든 실패는 이 예외(또는 하위 타입)로
 * 실패한 단계({@link RunnerOperation})와 함께 호출자에게 전파됩니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link SessionException}: Compute Session 실패</li>
 *   <li>{@link LogException}: 이벤트 로그 실패</li>
 *   <li>{@link SnapshotException}: Snapshot 저장소 실패</li>
 *   <li>{@link ChainIntegrityException}: parentId 불일치 (재시도 불가)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class RunnerException extends RuntimeException {

    private final RunnerOperation operation;

    /**
     * 생성자.
     *
     * @param operation 실패한 단계
     * @param message 예외 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException operation이 null인 경우
     */
    protected RunnerException(RunnerOperation operation, String message, Throwable cause) {
        super(message, cause);
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        this.operation = operation;
    }

    /**
     * 실패한 단계 조회.
     *
     * @return 실패한 단계
     */
    public RunnerOperation getOperation() {
        return operation;
    }

    /**
     * 외부 supervisor가 프로세스를 다시 시작해서 해결될 수 있는 실패인지 확인.
     *
     * @return 재시작으로 회복 가능하면 true
     */
    public boolean isRetryable() {
        return true;
    }
}
