package com.ryuqq.rollups.adapter.filesystem.snapshot;

import java.nio.file.Path;

/**
 * 파일시스템 Snapshot Store 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>snapshotDir: epoch별 snapshot 디렉터리가 위치하는 루트 (필수)</li>
 *   <li>latestLinkName: 최신 snapshot을 가리키는 심볼릭 링크 이름 (기본 "latest")</li>
 *   <li>pruneOldSnapshots: 최신 snapshot 승격 후 나머지 epoch 디렉터리 삭제 여부 (기본 true)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param snapshotDir snapshot 루트 디렉터리 (null 불가)
 * @param latestLinkName 링크 이름 (공백 불가, 숫자만으로 구성 불가, 경로 구분자 불가)
 * @param pruneOldSnapshots 이전 snapshot 정리 여부
 */
public record FileSystemSnapshotConfig(Path snapshotDir, String latestLinkName, boolean pruneOldSnapshots) {

    /** 기본 링크 이름. */
    public static final String DEFAULT_LATEST_LINK_NAME = "latest";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: latestLinkName="latest", pruneOldSnapshots=true</p>
     *
     * @param snapshotDir snapshot 루트 디렉터리
     */
    public FileSystemSnapshotConfig(Path snapshotDir) {
        this(snapshotDir, DEFAULT_LATEST_LINK_NAME, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FileSystemSnapshotConfig {
        if (snapshotDir == null) {
            throw new IllegalArgumentException("snapshotDir cannot be null");
        }
        if (latestLinkName == null || latestLinkName.isBlank()) {
            throw new IllegalArgumentException("latestLinkName cannot be null or blank");
        }
        if (latestLinkName.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException(
                "latestLinkName must not be an epoch number (current: " + latestLinkName + ")"
            );
        }
        if (latestLinkName.contains("/") || latestLinkName.contains("\\")) {
            throw new IllegalArgumentException(
                "latestLinkName must not contain path separators (current: " + latestLinkName + ")"
            );
        }
    }

    /**
     * latestLinkName만 변경한 새 인스턴스 생성.
     *
     * @param latestLinkName 새로운 링크 이름
     * @return 새 FileSystemSnapshotConfig 인스턴스
     */
    public FileSystemSnapshotConfig withLatestLinkName(String latestLinkName) {
        return new FileSystemSnapshotConfig(this.snapshotDir, latestLinkName, this.pruneOldSnapshots);
    }

    /**
     * pruneOldSnapshots만 변경한 새 인스턴스 생성.
     *
     * @param pruneOldSnapshots 새로운 정리 여부
     * @return 새 FileSystemSnapshotConfig 인스턴스
     */
    public FileSystemSnapshotConfig withPruneOldSnapshots(boolean pruneOldSnapshots) {
        return new FileSystemSnapshotConfig(this.snapshotDir, this.latestLinkName, pruneOldSnapshots);
    }

    /**
     * @return 최신 snapshot 링크 경로
     */
    public Path latestLink() {
        return snapshotDir.resolve(latestLinkName);
    }
}
