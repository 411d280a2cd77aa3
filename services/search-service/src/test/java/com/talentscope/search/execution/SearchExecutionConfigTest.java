package com.talentscope.search.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.Test;

class SearchExecutionConfigTest {
    @Test
    void cacheWritersRunAtFullWidthBeforeQueueing() {
        ExecutorService executor = new SearchExecutionConfig().cacheExecutor(2, 10);
        try {
            ThreadPoolExecutor pool = (ThreadPoolExecutor) executor;
            assertEquals(2, pool.getCorePoolSize());
            assertEquals(2, pool.getMaximumPoolSize());
            assertTrue(pool.allowsCoreThreadTimeOut());
            assertEquals(10, pool.getQueue().remainingCapacity());
        } finally {
            executor.shutdownNow();
        }
    }
}
