package com.ryuqq.rollups.core.statemachine;

/**
 * 러너의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>UNINITIALIZED → RECOVERING (복구 시작)</li>
 *   <li>RECOVERING → STEADY (복구 완료, 메인 루프 진입)</li>
 *   <li>RECOVERING → FAILED (복구 실패)</li>
 *   <li>STEADY → FAILED (이벤트 처리 실패)</li>
 *   <li>STEADY → STOPPED (종료 요청)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNINITIALIZED
 *    │
 *    ▼ (recover)
 * RECOVERING ──► FAILED
 *    │             ▲
 *    ▼             │
 * STEADY ──────────┘
 *    │
 *    └─► STOPPED (shutdown)
 * </pre>
 *
 * <p>FAILED 이후의 재시작은 새 프로세스(새 러너 인스턴스)가 담당하며,
 * 다시 RECOVERING부터 시작합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunnerState {

    /**
     * 생성됨 (아직 복구 시작 안 됨).
     */
    UNINITIALIZED,

    /**
     * Snapshot 조회, 스트림 위치 재계산, 세션 시작 중.
     */
    RECOVERING,

    /**
     * 메인 루프에서 이벤트 처리 중.
     */
    STEADY,

    /**
     * 복구 불가능한 오류로 중단됨.
     */
    FAILED,

    /**
     * 종료 요청으로 이벤트 사이에서 멈춤.
     */
    STOPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return FAILED 또는 STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == FAILED || this == STOPPED;
    }
}
