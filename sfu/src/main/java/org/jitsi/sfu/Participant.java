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

import java.util.*;
import java.util.concurrent.atomic.*;

/**
 * A participant of a session: its identifier, the transport connection it
 * owns and the adaptation loop of that connection.
 */
public class Participant
{
    @NotNull
    private final String id;

    @NotNull
    private final PeerConnection connection;

    @NotNull
    private final AdaptationLoop adaptationLoop;

    private final Logger logger;

    private final AtomicBoolean expired = new AtomicBoolean(false);

    private final long creationTime = System.currentTimeMillis();

    /**
     * Initializes a new {@link Participant}.
     *
     * @param id the identifier, unique within the session.
     * @param connection the connection, owned by the new participant from
     * now on.
     * @param adaptationLoop the (not yet started) adaptation loop of
     * <tt>connection</tt>.
     */
    public Participant(
            @NotNull String id,
            @NotNull PeerConnection connection,
            @NotNull AdaptationLoop adaptationLoop,
            @NotNull Logger logger)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.adaptationLoop = Objects.requireNonNull(adaptationLoop, "adaptationLoop");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public @NotNull String getId()
    {
        return id;
    }

    public @NotNull PeerConnection getConnection()
    {
        return connection;
    }

    public @NotNull AdaptationLoop getAdaptationLoop()
    {
        return adaptationLoop;
    }

    /**
     * Starts the adaptation loop of this participant's connection, unless it
     * is already running.
     *
     * @return <tt>true</tt> if the loop was started by this call.
     */
    public boolean startAdaptation()
    {
        if (expired.get())
        {
            return false;
        }
        return adaptationLoop.start();
    }

    public boolean isExpired()
    {
        return expired.get();
    }

    /**
     * Stops the adaptation loop, detaches from and closes the connection.
     * Only the first call has an effect.
     */
    public void expire()
    {
        expire(true);
    }

    /**
     * Expires this participant. Only the first call has an effect.
     *
     * @param releaseConnection whether to detach from and close the
     * connection, <tt>false</tt> when the connection has been handed over to
     * a new participant.
     */
    public void expire(boolean releaseConnection)
    {
        if (!expired.compareAndSet(false, true))
        {
            return;
        }

        logger.info("Expiring.");
        adaptationLoop.stop();
        if (!releaseConnection)
        {
            return;
        }
        try
        {
            connection.setTrackListener(null);
        }
        finally
        {
            connection.close();
        }
    }

    @SuppressWarnings("unchecked")
    public JSONObject getDebugState()
    {
        JSONObject debugState = new JSONObject();
        debugState.put("id", id);
        debugState.put("expired", expired.get());
        debugState.put("age_ms", System.currentTimeMillis() - creationTime);
        debugState.put("adaptation", adaptationLoop.getDebugState());
        return debugState;
    }

    @Override
    public String toString()
    {
        return "Participant[" + id + "]";
    }
}
