/**
 * Rollups 러너 데이터 모델.
 *
 * <p>이 패키지는 이벤트 로그, Compute Session, Snapshot 저장소 사이를 오가는
 * 불변 값 객체들을 정의합니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.rollups.core.model.Event} - 이벤트 로그의 입력 이벤트 (ID + 본문)</li>
 *   <li>{@link com.ryuqq.rollups.core.model.EventPayload} - epoch, 전송 입력 수, 부모 ID, 데이터</li>
 *   <li>{@link com.ryuqq.rollups.core.model.EventData} - AdvanceStateInput 또는 FinishEpoch</li>
 *   <li>{@link com.ryuqq.rollups.core.model.Snapshot} - 재개할 epoch에 태깅된 체크포인트</li>
 *   <li>{@link com.ryuqq.rollups.core.model.EpochClaim} - epoch 결과 요약</li>
 * </ul>
 *
 * <h2>불변식</h2>
 * <ul>
 *   <li>처리된 이벤트의 parentId는 항상 직전에 처리된 이벤트의 ID와 같음</li>
 *   <li>Snapshot은 닫힌 epoch가 아니라 재개할 epoch로 태깅됨</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollups.core.model;
