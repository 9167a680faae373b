package com.ryuqq.rollups.adapter.filesystem.snapshot;

import com.ryuqq.rollups.core.model.Snapshot;
import com.ryuqq.rollups.core.spi.SnapshotStore;
import com.ryuqq.rollups.core.spi.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 파일시스템 기반 Snapshot Store.
 *
 * <p>epoch마다 {@code <snapshotDir>/<epoch>} 디렉터리를 할당하고, 최신 snapshot은
 * {@code <snapshotDir>/<latestLinkName>} 심볼릭 링크로 가리킵니다.</p>
 *
 * <p><strong>원자적 승격:</strong></p>
 * <ol>
 *   <li>임시 링크 생성 ({@code <latestLinkName>.tmp})</li>
 *   <li>ATOMIC_MOVE로 기존 링크 교체</li>
 *   <li>파일시스템이 원자적 이동을 지원하지 않으면 일반 교체로 폴백 (WARN 로그)</li>
 * </ol>
 *
 * <p>링크는 항상 이전 snapshot 또는 새 snapshot 중 하나를 가리키며, 중간 상태는 관찰되지 않습니다.</p>
 *
 * <p><strong>정리 정책:</strong> pruneOldSnapshots가 켜져 있으면 승격 후 최신 snapshot을 제외한
 * epoch 디렉터리를 삭제합니다. 정리 실패는 승격 결과에 영향을 주지 않으며 WARN으로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileSystemSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSnapshotStore.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final FileSystemSnapshotConfig config;

    /**
     * 생성자.
     *
     * @param config 파일시스템 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FileSystemSnapshotStore(FileSystemSnapshotConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Snapshot getLatest() {
        Path link = config.latestLink();
        if (!Files.isSymbolicLink(link)) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.NOT_FOUND,
                "latest snapshot link not found: " + link);
        }

        Path target;
        try {
            target = config.snapshotDir().resolve(Files.readSymbolicLink(link));
        } catch (IOException e) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.STORE_UNAVAILABLE,
                "failed to read latest snapshot link: " + link, e);
        }

        if (!Files.isDirectory(target)) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.NOT_FOUND,
                "latest snapshot directory not found: " + target);
        }
        return Snapshot.of(target.toString(), parseEpoch(target));
    }

    /**
     * {@inheritDoc}
     *
     * <p>이미 같은 epoch 디렉터리가 있으면 중단된 이전 finish의 잔여물로 보고 삭제합니다.
     * 디렉터리 자체는 Compute Session이 생성합니다.</p>
     */
    @Override
    public Snapshot getStorageDirectory(long epoch) {
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must be non-negative (current: " + epoch + ")");
        }

        Path directory = epochDirectory(epoch);
        try {
            Files.createDirectories(config.snapshotDir());
            if (Files.exists(directory, LinkOption.NOFOLLOW_LINKS)) {
                if (directory.equals(currentTarget())) {
                    throw new SnapshotStoreException(SnapshotStoreException.Reason.ALLOCATION_FAILED,
                        "refusing to reuse directory of latest snapshot: " + directory);
                }
                log.warn("Removing stale snapshot directory: {}", directory);
                deleteRecursively(directory);
            }
        } catch (IOException e) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.ALLOCATION_FAILED,
                "failed to allocate snapshot directory: " + directory, e);
        }
        return Snapshot.of(directory.toString(), epoch);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setLatest(Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }

        Path directory = Path.of(snapshot.path());
        if (!config.snapshotDir().equals(directory.getParent())) {
            throw new IllegalArgumentException(
                "snapshot is not under " + config.snapshotDir() + ": " + snapshot.path());
        }
        if (!Files.isDirectory(directory)) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.NOT_FOUND,
                "snapshot directory not found: " + directory);
        }

        Path link = config.latestLink();
        Path tempLink = config.snapshotDir().resolve(config.latestLinkName() + TEMP_SUFFIX);
        try {
            Files.deleteIfExists(tempLink);
            Files.createSymbolicLink(tempLink, directory.getFileName());
            moveAtomically(tempLink, link);
        } catch (IOException e) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.STORE_UNAVAILABLE,
                "failed to update latest snapshot link to " + directory, e);
        }
        log.debug("Latest snapshot set to epoch {} ({})", snapshot.epoch(), directory);

        if (config.pruneOldSnapshots()) {
            pruneExcept(directory);
        }
    }

    /**
     * @return 현재 설정
     */
    public FileSystemSnapshotConfig getConfig() {
        return config;
    }

    private Path epochDirectory(long epoch) {
        return config.snapshotDir().resolve(Long.toString(epoch));
    }

    private Path currentTarget() throws IOException {
        Path link = config.latestLink();
        if (!Files.isSymbolicLink(link)) {
            return null;
        }
        return config.snapshotDir().resolve(Files.readSymbolicLink(link));
    }

    private static long parseEpoch(Path directory) {
        String name = directory.getFileName().toString();
        try {
            return Long.parseLong(name);
        } catch (NumberFormatException e) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.STORE_UNAVAILABLE,
                "latest snapshot directory name is not an epoch number: " + name, e);
        }
    }

    private void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void pruneExcept(Path keep) {
        List<Path> stale;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(config.snapshotDir())) {
            stale = StreamSupport.stream(entries.spliterator(), false)
                .filter(entry -> !Files.isSymbolicLink(entry))
                .filter(Files::isDirectory)
                .filter(entry -> isEpochName(entry.getFileName().toString()))
                .filter(entry -> !entry.equals(keep))
                .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list snapshot directory {} for pruning", config.snapshotDir(), e);
            return;
        }

        for (Path directory : stale) {
            try {
                deleteRecursively(directory);
                log.debug("Pruned old snapshot {}", directory);
            } catch (IOException e) {
                log.warn("Failed to prune old snapshot {}", directory, e);
            }
        }
    }

    private static boolean isEpochName(String name) {
        return !name.isEmpty() && name.chars().allMatch(Character::isDigit);
    }

    private static void deleteRecursively(Path root) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
}
