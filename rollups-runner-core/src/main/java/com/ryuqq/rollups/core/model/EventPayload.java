package com.ryuqq.rollups.core.model;

/**
 * 이벤트 본문.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>epochIndex:</strong> 이벤트가 속한 epoch</li>
 *   <li><strong>inputsSentCount:</strong> 현재 epoch에서 지금까지 전송된 입력 수 (1부터 증가)</li>
 *   <li><strong>parentId:</strong> 바로 앞 이벤트의 ID (첫 이벤트는 {@link EventId#INITIAL})</li>
 *   <li><strong>data:</strong> 이벤트 종류별 데이터</li>
 * </ul>
 *
 * <p>parentId는 이벤트들을 단일 연결 체인으로 묶으며, 러너는 이를 통해
 * 누락/중복/손상을 검출합니다.</p>
 *
 * @param epochIndex epoch 인덱스 (0 이상)
 * @param inputsSentCount 전송된 입력 수 (0 이상)
 * @param parentId 부모 이벤트 ID
 * @param data 이벤트 데이터
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventPayload(
    long epochIndex,
    long inputsSentCount,
    EventId parentId,
    EventData data
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 숫자 필드가 음수인 경우
     */
    public EventPayload {
        if (epochIndex < 0) {
            throw new IllegalArgumentException("epochIndex must be non-negative (current: " + epochIndex + ")");
        }
        if (inputsSentCount < 0) {
            throw new IllegalArgumentException("inputsSentCount must be non-negative (current: " + inputsSentCount + ")");
        }
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
    }
}
