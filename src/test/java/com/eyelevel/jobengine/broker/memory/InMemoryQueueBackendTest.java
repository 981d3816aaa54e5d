package com.eyelevel.jobengine.broker.memory;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueBackendContract;
import com.eyelevel.jobengine.broker.QueueRegistry;
import com.eyelevel.jobengine.support.MutableClock;

class InMemoryQueueBackendTest extends QueueBackendContract {

    @Override
    protected QueueBackend createBackend(final QueueRegistry registry, final MutableClock clock) {
        return new InMemoryQueueBackend(registry, clock);
    }
}
