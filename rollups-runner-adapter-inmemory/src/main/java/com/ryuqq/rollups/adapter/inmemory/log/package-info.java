/**
 * In-memory Event Log adapter.
 *
 * <p>{@link com.ryuqq.rollups.adapter.inmemory.log.InMemoryEventLog} plays both the
 * upstream producer (chain building) and the log service the runner reads from.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * InMemoryEventLog eventLog = new InMemoryEventLog();
 * eventLog.appendAdvance("deposit".getBytes());   // epoch 0, inputsSentCount 1
 * eventLog.appendFinishEpoch();                  // closes epoch 0
 *
 * Event first = eventLog.consumeInput(EventId.INITIAL);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollups.adapter.inmemory.log;
