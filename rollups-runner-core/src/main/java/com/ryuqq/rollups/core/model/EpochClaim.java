package com.ryuqq.rollups.core.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * 종료된 epoch의 결과 요약 (claim).
 *
 * <p>Compute Session이 생성하며, 러너는 내용을 해석하지 않고 이벤트 로그로 그대로 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EpochClaim {

    private final long epochIndex;
    private final byte[] value;

    private EpochClaim(long epochIndex, byte[] value) {
        if (epochIndex < 0) {
            throw new IllegalArgumentException("epochIndex must be non-negative (current: " + epochIndex + ")");
        }
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException("value cannot be null or empty");
        }
        this.epochIndex = epochIndex;
        this.value = value.clone();
    }

    /**
     * EpochClaim 생성.
     *
     * @param epochIndex claim 대상 epoch
     * @param value claim 바이트
     * @return EpochClaim 인스턴스
     * @throws IllegalArgumentException epochIndex가 음수이거나 value가 비어있는 경우
     */
    public static EpochClaim of(long epochIndex, byte[] value) {
        return new EpochClaim(epochIndex, value);
    }

    public long epochIndex() {
        return epochIndex;
    }

    /**
     * claim 바이트 조회.
     *
     * @return 복사본
     */
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EpochClaim that = (EpochClaim) o;
        return epochIndex == that.epochIndex && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(epochIndex) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "EpochClaim{epochIndex=" + epochIndex + ", value=0x" + HexFormat.of().formatHex(value) + '}';
    }
}
