package com.ryuqq.rollups.core.model;

import java.util.Arrays;

/**
 * 현재 epoch에 적용할 사용자 입력.
 *
 * <p>payload는 방어적으로 복사되어 외부에서 변경할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AdvanceStateInput implements EventData {

    private final InputMetadata metadata;
    private final byte[] payload;

    private AdvanceStateInput(InputMetadata metadata, byte[] payload) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        this.metadata = metadata;
        this.payload = payload.clone();
    }

    /**
     * AdvanceStateInput 생성.
     *
     * @param metadata 입력 메타데이터
     * @param payload 입력 바이트 (빈 배열 허용)
     * @return AdvanceStateInput 인스턴스
     * @throws IllegalArgumentException metadata 또는 payload가 null인 경우
     */
    public static AdvanceStateInput of(InputMetadata metadata, byte[] payload) {
        return new AdvanceStateInput(metadata, payload);
    }

    @Override
    public Kind kind() {
        return Kind.ADVANCE_STATE_INPUT;
    }

    public InputMetadata metadata() {
        return metadata;
    }

    /**
     * payload 조회.
     *
     * @return payload 복사본
     */
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AdvanceStateInput that = (AdvanceStateInput) o;
        return metadata.equals(that.metadata) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * metadata.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "AdvanceStateInput{metadata=" + metadata + ", payload=" + payload.length + " bytes}";
    }
}
