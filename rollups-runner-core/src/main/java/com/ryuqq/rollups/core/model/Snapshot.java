package com.ryuqq.rollups.core.model;

/**
 * Compute Session 상태의 영속 체크포인트.
 *
 * <p>Snapshot은 epoch {@code epoch}를 <strong>막 시작한 시점</strong>의 상태를 나타냅니다.
 * epoch N을 닫으면 epoch N+1용 Snapshot이 만들어집니다.</p>
 *
 * @param path 저장 위치 (저장소 구현이 해석)
 * @param epoch 이 Snapshot에서 재개할 epoch
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Snapshot(
    String path,
    long epoch
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException path가 null/빈 문자열이거나 epoch가 음수인 경우
     */
    public Snapshot {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must be non-negative (current: " + epoch + ")");
        }
    }

    /**
     * Snapshot 생성.
     *
     * @param path 저장 위치
     * @param epoch 재개할 epoch
     * @return Snapshot 인스턴스
     */
    public static Snapshot of(String path, long epoch) {
        return new Snapshot(path, epoch);
    }
}
