package com.ryuqq.rollups.adapter.filesystem.snapshot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileSystemSnapshotConfig 단위 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FileSystemSnapshotConfigTest {

    @Test
    void 기본값은_latest_링크와_정리_활성화() {
        FileSystemSnapshotConfig config = new FileSystemSnapshotConfig(Path.of("/var/snapshots"));

        assertThat(config.latestLinkName()).isEqualTo("latest");
        assertThat(config.pruneOldSnapshots()).isTrue();
        assertThat(config.latestLink()).isEqualTo(Path.of("/var/snapshots/latest"));
    }

    @Test
    void snapshotDir_null은_거부된다() {
        assertThatThrownBy(() -> new FileSystemSnapshotConfig(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("snapshotDir cannot be null");
    }

    @ParameterizedTest
    @ValueSource(strings = {" ", "42", "a/b", "a\\b"})
    void 잘못된_링크_이름은_거부된다(String latestLinkName) {
        assertThatThrownBy(() -> new FileSystemSnapshotConfig(Path.of("/var/snapshots"), latestLinkName, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void with_메서드는_나머지_값을_유지한다() {
        FileSystemSnapshotConfig config = new FileSystemSnapshotConfig(Path.of("/var/snapshots"))
            .withLatestLinkName("current")
            .withPruneOldSnapshots(false);

        assertThat(config.snapshotDir()).isEqualTo(Path.of("/var/snapshots"));
        assertThat(config.latestLinkName()).isEqualTo("current");
        assertThat(config.pruneOldSnapshots()).isFalse();
    }
}
