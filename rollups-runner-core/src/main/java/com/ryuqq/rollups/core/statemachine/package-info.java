/**
 * 러너 생명주기 상태 머신.
 *
 * <p>{@link com.ryuqq.rollups.core.statemachine.RunnerState}와
 * {@link com.ryuqq.rollups.core.statemachine.RunnerStateTransition}은
 * 러너가 복구 → 정상 처리 → 실패/종료 순서로만 진행하도록 보장합니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollups.core.statemachine;
