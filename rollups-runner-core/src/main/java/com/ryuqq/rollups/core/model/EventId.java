package com.ryuqq.rollups.core.model;

/**
 * 이벤트 로그 내 이벤트의 위치 식별자 (stream offset).
 *
 * <p>EventId는 이벤트 로그가 부여한 불투명한(opaque) 값이며, 러너는 값의 형식을 해석하지 않고
 * 동등성 비교만 수행합니다.</p>
 *
 * <p><strong>Sentinel:</strong> {@link #INITIAL}은 스트림의 첫 번째 이벤트가 가리키는 부모 ID입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventId {

    /**
     * 스트림의 첫 번째 이벤트의 부모 ID.
     */
    public static final EventId INITIAL = new EventId("0");

    private final String value;

    private EventId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EventId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("EventId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * EventId 생성.
     *
     * @param value EventId 값
     * @return EventId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EventId of(String value) {
        return new EventId(value);
    }

    /**
     * EventId 값 조회.
     *
     * @return EventId 값
     */
    public String getValue() {
        return value;
    }

    /**
     * Sentinel ID인지 확인.
     *
     * @return {@link #INITIAL}과 같은 값이면 true
     */
    public boolean isInitial() {
        return INITIAL.value.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventId eventId = (EventId) o;
        return value.equals(eventId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
