package com.ryuqq.rollups.core.model;

/**
 * 입력 하나에 동반되는 메타데이터.
 *
 * <p>러너는 이 값을 해석하지 않고 Compute Session으로 그대로 전달합니다.</p>
 *
 * @param msgSender 입력을 보낸 주소 (hex 문자열)
 * @param blockNumber 입력이 포함된 블록 번호
 * @param timestamp 블록 타임스탬프 (epoch seconds)
 * @param epochIndex 입력이 속한 epoch
 * @param inputIndex epoch 내 입력 인덱스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InputMetadata(
    String msgSender,
    long blockNumber,
    long timestamp,
    long epochIndex,
    long inputIndex
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException msgSender가 null이거나 숫자 필드가 음수인 경우
     */
    public InputMetadata {
        if (msgSender == null) {
            throw new IllegalArgumentException("msgSender cannot be null");
        }
        if (blockNumber < 0) {
            throw new IllegalArgumentException("blockNumber must be non-negative (current: " + blockNumber + ")");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative (current: " + timestamp + ")");
        }
        if (epochIndex < 0) {
            throw new IllegalArgumentException("epochIndex must be non-negative (current: " + epochIndex + ")");
        }
        if (inputIndex < 0) {
            throw new IllegalArgumentException("inputIndex must be non-negative (current: " + inputIndex + ")");
        }
    }
}
