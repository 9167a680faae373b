/**
 * 러너 오류 분류 (error taxonomy).
 *
 * <p>모든 실패는 {@link com.ryuqq.rollups.application.error.RunnerException} 하위 타입으로,
 * 실패한 협력자와 단계({@link com.ryuqq.rollups.application.error.RunnerOperation})를 담아
 * 러너 호출자에게 전파됩니다. 협력자의 원래 예외는 cause로 유지됩니다.</p>
 *
 * <h2>재시도 정책</h2>
 * <ul>
 *   <li>러너 내부: 재시도 없음</li>
 *   <li>외부 supervisor: {@code isRetryable()}이 true인 경우에만 프로세스 재시작</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollups.application.error;
