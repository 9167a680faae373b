package com.ryuqq.rollups.core.model;

/**
 * 이벤트 종류별 데이터.
 *
 * <p>두 가지 경우만 존재합니다:</p>
 * <ul>
 *   <li>{@link AdvanceStateInput}: 현재 epoch에 적용할 사용자 입력 하나</li>
 *   <li>{@link FinishEpoch}: 현재 epoch의 종료 표시</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 새로운 종류가 추가되면 {@link #kind()}의 {@link Kind} enum에도
 * 반영되어야 하며, {@code switch} 식에서 누락된 경우를 컴파일러가 검출합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * switch (data.kind()) {
 *     case ADVANCE_STATE_INPUT -&gt; handleAdvance((AdvanceStateInput) data);
 *     case FINISH_EPOCH -&gt; handleFinish();
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface EventData permits AdvanceStateInput, FinishEpoch {

    /**
     * 이벤트 데이터 종류.
     */
    enum Kind {
        ADVANCE_STATE_INPUT,
        FINISH_EPOCH
    }

    /**
     * 이벤트 데이터 종류 조회.
     *
     * @return 종류 태그
     */
    Kind kind();
}
