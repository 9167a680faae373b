package com.ryuqq.rollups.core.model;

/**
 * 이벤트 로그에서 읽은 입력 이벤트.
 *
 * <p>식별자는 {@code id}이며, 상위 인프라가 생성한 뒤에는 변경되지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Event event = Event.of(EventId.of("1-0"),
 *     new EventPayload(0, 1, EventId.INITIAL, AdvanceStateInput.of(metadata, bytes)));
 * </pre>
 *
 * @param id 이벤트 ID
 * @param payload 이벤트 본문
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Event(
    EventId id,
    EventPayload payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 payload가 null인 경우
     */
    public Event {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * Event 생성.
     *
     * @param id 이벤트 ID
     * @param payload 이벤트 본문
     * @return Event 인스턴스
     * @throws IllegalArgumentException id 또는 payload가 null인 경우
     */
    public static Event of(EventId id, EventPayload payload) {
        return new Event(id, payload);
    }

    /**
     * 이 이벤트가 주어진 ID 바로 다음에 오는지 확인.
     *
     * @param lastConsumedId 마지막으로 처리한 이벤트 ID
     * @return parentId가 lastConsumedId와 같으면 true
     */
    public boolean chainsFrom(EventId lastConsumedId) {
        return payload.parentId().equals(lastConsumedId);
    }
}
