/**
 * Runner 어댑터.
 *
 * <p>{@link com.ryuqq.rollups.adapter.runner.AdvanceRunner}는 SPI 구현체 세 개를 받아
 * 복구와 메인 루프를 실행합니다.</p>
 *
 * <h2>사용 예시</h2>
 * <pre>
 * Runtime runner = new AdvanceRunner(snapshotStore, eventLog, computeSession);
 * runner.run();   // shutdown() 요청 또는 실패 시까지 블록
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollups.adapter.runner;
