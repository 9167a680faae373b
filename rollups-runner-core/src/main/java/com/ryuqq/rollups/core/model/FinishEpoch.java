package com.ryuqq.rollups.core.model;

/**
 * 현재 epoch의 종료 표시.
 *
 * <p>EventPayload의 필드 외에 추가 데이터가 없으므로 단일 인스턴스를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FinishEpoch implements EventData {

    private static final FinishEpoch INSTANCE = new FinishEpoch();

    private FinishEpoch() {
    }

    /**
     * FinishEpoch 인스턴스 조회.
     *
     * @return 단일 인스턴스
     */
    public static FinishEpoch instance() {
        return INSTANCE;
    }

    @Override
    public Kind kind() {
        return Kind.FINISH_EPOCH;
    }

    @Override
    public String toString() {
        return "FinishEpoch";
    }
}
