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
package org.jitsi.sfu;

import org.jetbrains.annotations.*;
import org.jitsi.sfu.transport.*;
import org.jitsi.utils.logging2.*;
import org.json.simple.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/**
 * Periodically re-estimates the bandwidth available on one outbound
 * {@link PeerConnection} and clamps the bitrate of its encodings to it.
 *
 * A loop starts {@link State#IDLE}, runs a tick every interval once
 * {@link #start()}ed and never runs again once {@link #stop()}ped. A tick
 * which fails (e.g. because the connection was closed underneath it) is
 * skipped; the next tick runs as scheduled.
 */
public class AdaptationLoop
{
    public enum State
    {
        IDLE,
        RUNNING,
        STOPPED
    }

    private final Logger logger;

    private final PeerConnection connection;

    private final LayerController layerController;

    private final BandwidthEstimator estimator;

    private final ScheduledExecutorService scheduler;

    private final Duration interval;

    private State state = State.IDLE;

    /**
     * The scheduled task, set while {@link State#RUNNING}.
     */
    private ScheduledFuture<?> future;

    private final AtomicLong ticks = new AtomicLong();

    private final AtomicLong skippedTicks = new AtomicLong();

    /**
     * The last estimate applied, in bits per second, or -1.
     */
    private volatile long lastEstimate = -1;

    public AdaptationLoop(
            @NotNull PeerConnection connection,
            @NotNull LayerController layerController,
            @NotNull BandwidthEstimator estimator,
            @NotNull ScheduledExecutorService scheduler,
            @NotNull Duration interval,
            @NotNull Logger parentLogger)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.layerController = Objects.requireNonNull(layerController, "layerController");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.logger = parentLogger.createChildLogger(AdaptationLoop.class.getName());
    }

    /**
     * Schedules the ticks of this loop, the first one after one interval.
     *
     * @return <tt>true</tt> if the loop was started by this call,
     * <tt>false</tt> if it was already running or has been stopped.
     */
    public synchronized boolean start()
    {
        if (state != State.IDLE)
        {
            return false;
        }

        long intervalMs = interval.toMillis();
        future = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        state = State.RUNNING;
        logger.info("Started bandwidth adaptation every " + intervalMs + " ms");
        return true;
    }

    /**
     * Cancels the ticks of this loop. A tick which is already executing is
     * allowed to finish.
     */
    public synchronized void stop()
    {
        if (state == State.STOPPED)
        {
            return;
        }

        if (future != null)
        {
            future.cancel(false);
            future = null;
        }
        State previous = state;
        state = State.STOPPED;
        if (previous == State.RUNNING)
        {
            logger.info("Stopped bandwidth adaptation after " + ticks.get() + " ticks");
        }
    }

    /**
     * Runs one adaptation tick: fetches the statistics of the connection and,
     * for every locally measured outbound RTP stream, clamps the bitrate caps
     * of the connection to the bandwidth estimated for that stream. Never
     * throws.
     */
    void tick()
    {
        if (getState() != State.RUNNING)
        {
            return;
        }

        try
        {
            StatsReport report = connection.getStats();
            for (RtcStats stats : report.getLocalOutboundStats())
            {
                long estimate = Math.round(estimator.estimate(stats));
                layerController.adjustBitrate(connection, estimate);
                lastEstimate = estimate;
            }
            ticks.incrementAndGet();
        }
        catch (Exception e)
        {
            skippedTicks.incrementAndGet();
            logger.warn("Skipping adaptation tick: " + e.getMessage(), e);
        }
    }

    public synchronized State getState()
    {
        return state;
    }

    public @NotNull PeerConnection getConnection()
    {
        return connection;
    }

    public long getTicks()
    {
        return ticks.get();
    }

    public long getSkippedTicks()
    {
        return skippedTicks.get();
    }

    /**
     * @return the last bandwidth estimate applied, in bits per second, or -1
     * if none has been applied yet.
     */
    public long getLastEstimate()
    {
        return lastEstimate;
    }

    @SuppressWarnings("unchecked")
    public JSONObject getDebugState()
    {
        JSONObject debugState = new JSONObject();
        debugState.put("state", getState().name());
        debugState.put("interval_ms", interval.toMillis());
        debugState.put("ticks", ticks.get());
        debugState.put("skipped_ticks", skippedTicks.get());
        debugState.put("last_estimate_bps", lastEstimate);
        return debugState;
    }
}
