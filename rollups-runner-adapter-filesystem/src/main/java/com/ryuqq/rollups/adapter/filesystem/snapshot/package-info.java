/**
 * 파일시스템 Snapshot Store 어댑터.
 *
 * <h2>디렉터리 구조</h2>
 * <pre>
 * snapshotDir/
 *   3/            (epoch 3을 여는 snapshot)
 *   4/            (epoch 4를 여는 snapshot)
 *   latest -&gt; 4  (심볼릭 링크)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollups.adapter.filesystem.snapshot;
