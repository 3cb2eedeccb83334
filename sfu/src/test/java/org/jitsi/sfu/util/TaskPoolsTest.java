/*
 * Copyright @ 2018 - present 8x8, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.jitsi.sfu.util;

import org.json.simple.*;
import org.junit.*;

import java.util.concurrent.*;

import static org.junit.Assert.*;

public class TaskPoolsTest
{
    private final TaskPools.ExceptionLogger exceptionLogger = new TaskPools.ExceptionLogger("test");

    @Test
    public void thrownExceptionsAreCounted()
    {
        exceptionLogger.checkForExceptionAndLog(() -> { }, new RuntimeException("boom"));

        assertEquals(1, exceptionLogger.getNumExceptions());
    }

    @Test
    public void failedFuturesAreCounted()
    {
        FutureTask<Void> task = new FutureTask<>(() -> {
            throw new IllegalStateException("boom");
        });
        task.run();

        exceptionLogger.checkForExceptionAndLog(task, null);

        assertEquals(1, exceptionLogger.getNumExceptions());
    }

    @Test
    public void cancelledAndSuccessfulFuturesAreNotCounted()
    {
        FutureTask<Void> cancelled = new FutureTask<>(() -> null);
        cancelled.cancel(false);
        FutureTask<Void> done = new FutureTask<>(() -> null);
        done.run();

        exceptionLogger.checkForExceptionAndLog(cancelled, null);
        exceptionLogger.checkForExceptionAndLog(done, null);

        assertEquals(0, exceptionLogger.getNumExceptions());
    }

    @Test
    public void statsJson()
    {
        JSONObject stats = TaskPools.getStatsJson();

        JSONObject scheduled = (JSONObject) stats.get("SCHEDULED_POOL");
        assertNotNull(scheduled);
        assertTrue(scheduled.containsKey("pool_size"));
        assertTrue(scheduled.containsKey("num_exceptions"));
    }
}
