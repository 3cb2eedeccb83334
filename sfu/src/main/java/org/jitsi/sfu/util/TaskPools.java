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

import org.jitsi.utils.concurrent.*;
import org.jitsi.utils.logging2.*;
import org.json.simple.*;

import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

public class TaskPools
{
    private static final Logger classLogger = new LoggerImpl(TaskPools.class.getName());

    /**
     * Count and log exceptions from the scheduled executor.
     */
    private static final ExceptionLogger SCHEDULED_POOL_EXCEPTION_LOGGER
        = new ExceptionLogger("Global scheduled pool");

    /**
     * The executor which runs the recurring adaptation ticks of all
     * connections. Ticks must not block for long, since they share the pool.
     */
    public static final ScheduledExecutorService SCHEDULED_POOL =
        new ScheduledThreadPoolExecutor(
                Math.max(2, Runtime.getRuntime().availableProcessors() / 2),
                new CustomizableThreadFactory("Global scheduled pool", true))
        {
            @Override
            protected void afterExecute(Runnable runnable, Throwable t)
            {
                super.afterExecute(runnable, t);
                SCHEDULED_POOL_EXCEPTION_LOGGER.checkForExceptionAndLog(runnable, t);
            }
        };

    @SuppressWarnings("unchecked")
    public static JSONObject getStatsJson(ExecutorService es)
    {
        JSONObject debugState = new JSONObject();
        debugState.put("executor_class", es.getClass().getSimpleName());

        if (es instanceof ThreadPoolExecutor)
        {
            ThreadPoolExecutor ex = (ThreadPoolExecutor)es;
            debugState.put("pool_size", ex.getPoolSize());
            debugState.put("active_task_count", ex.getActiveCount());
            debugState.put("completed_task_count", ex.getCompletedTaskCount());
            debugState.put("core_pool_size", ex.getCorePoolSize());
            debugState.put("pending_task_count", ex.getQueue().size());
        }

        return debugState;
    }

    @SuppressWarnings("unchecked")
    public static JSONObject getStatsJson()
    {
        JSONObject stats = new JSONObject();

        JSONObject scheduledPoolStats = getStatsJson(SCHEDULED_POOL);
        scheduledPoolStats.put("num_exceptions", SCHEDULED_POOL_EXCEPTION_LOGGER.numExceptions.get());
        stats.put("SCHEDULED_POOL", scheduledPoolStats);

        return stats;
    }

    /**
     * Count and log exceptions from an {@link ExecutorService}.
     */
    static class ExceptionLogger
    {
        private final AtomicLong numExceptions = new AtomicLong();
        private final String name;

        ExceptionLogger(String name)
        {
            this.name = name;
        }

        long getNumExceptions()
        {
            return numExceptions.get();
        }

        /**
         * See {@link ThreadPoolExecutor#afterExecute(Runnable, Throwable)}
         * @param runnable
         * @param t
         */
        void checkForExceptionAndLog(Runnable runnable, Throwable t)
        {
            if (t == null && runnable instanceof Future<?>)
            {
                Future<?> future = (Future<?>) runnable;
                try
                {
                    if (future.isDone())
                    {
                        future.get();
                    }
                }
                catch (CancellationException ce)
                {
                    // Stopped adaptation loops cancel their futures.
                    return;
                }
                catch (ExecutionException ee)
                {
                    t = ee.getCause();
                }
                catch (InterruptedException ie)
                {
                    Thread.currentThread().interrupt();
                }
            }

            if (t != null)
            {
                numExceptions.incrementAndGet();
                classLogger.warn("Uncaught exception (" + name + "): ", t);
            }
        }
    }
}
