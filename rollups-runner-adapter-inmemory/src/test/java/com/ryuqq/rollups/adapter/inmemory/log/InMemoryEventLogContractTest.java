package com.ryuqq.rollups.adapter.inmemory.log;

import com.ryuqq.rollups.core.model.Event;
import com.ryuqq.rollups.core.spi.EventLog;
import com.ryuqq.rollups.testkit.contract.AbstractEventLogContractTest;

class InMemoryEventLogContractTest extends AbstractEventLogContractTest {

    private InMemoryEventLog inMemoryEventLog;

    @Override
    protected EventLog createLog() {
        inMemoryEventLog = new InMemoryEventLog();
        return inMemoryEventLog;
    }

    @Override
    protected void append(Event event) {
        inMemoryEventLog.appendRaw(event);
    }
}
