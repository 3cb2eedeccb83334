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
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/**
 * Redistributes inbound tracks to the other participants of a session. Tracks
 * from the same inbound stream are bound to the same {@link MixedStream}.
 *
 * Forwarding to one participant never depends on forwarding to another: a
 * failure is logged for that target only and the remaining targets are
 * still served.
 */
public class StreamMixer
{
    private final Logger logger;

    private final ParticipantRegistry registry;

    private final TrackForwarder forwarder;

    /**
     * Maps the identifier of an inbound stream to its mixed stream.
     */
    private final ConcurrentHashMap<String, MixedStream> mixedStreams = new ConcurrentHashMap<>();

    private final AtomicLong tracksForwarded = new AtomicLong();

    private final AtomicLong forwardingFailures = new AtomicLong();

    public StreamMixer(
            @NotNull ParticipantRegistry registry,
            @NotNull TrackForwarder forwarder,
            @NotNull Logger parentLogger)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.logger = parentLogger.createChildLogger(StreamMixer.class.getName());
    }

    /**
     * Handles a track which arrived from a participant: adds it to the mixed
     * stream of <tt>originStream</tt> (creating it if needed) and forwards it,
     * bound to that mixed stream, to every other registered participant.
     *
     * @param participantId the participant the track arrived from, which
     * does not get it back.
     * @param originStream the inbound stream of the track, or <tt>null</tt>
     * if the sender bound it to none. Such tracks are forwarded without a
     * stream.
     * @return the mixed stream of the track, or <tt>null</tt> if it has no
     * inbound stream.
     */
    public @Nullable MixedStream handleTrack(
            @NotNull String participantId,
            @NotNull MediaStreamTrack track,
            @Nullable MediaStream originStream)
    {
        if (originStream == null)
        {
            logger.debug(() -> "Track " + track.getId() + " from " + participantId + " has no stream.");
            forward(participantId, track);
            return null;
        }

        MixedStream mixedStream = mixedStreams.computeIfAbsent(originStream.getId(), MixedStream::new);
        mixedStream.addTrack(track);

        forward(participantId, track, mixedStream);
        return mixedStream;
    }

    /**
     * Forwards <tt>track</tt> to every registered participant except
     * <tt>excludedParticipantId</tt>.
     *
     * @param excludedParticipantId the participant to skip, or <tt>null</tt>
     * to forward to everyone.
     * @param streams the streams to bind the track to.
     * @return the number of participants the track was forwarded to.
     */
    public int forward(
            @Nullable String excludedParticipantId,
            @NotNull MediaStreamTrack track,
            MediaStream... streams)
    {
        int forwarded = 0;
        for (Participant target : registry.getParticipants())
        {
            if (target.getId().equals(excludedParticipantId))
            {
                continue;
            }

            try
            {
                forwarder.forward(target, track, streams);
                forwarded++;
                tracksForwarded.incrementAndGet();
            }
            catch (Exception e)
            {
                forwardingFailures.incrementAndGet();
                logger.warn("Failed to forward track " + track.getId() + " to " + target.getId(), e);
            }
        }

        if (logger.isDebugEnabled())
        {
            logger.debug("Forwarded track " + track.getId() + " to " + forwarded + " participants.");
        }
        return forwarded;
    }

    public @Nullable MixedStream getMixedStream(@NotNull String originStreamId)
    {
        return mixedStreams.get(originStreamId);
    }

    public @NotNull Collection<MixedStream> getMixedStreams()
    {
        return new ArrayList<>(mixedStreams.values());
    }

    public long getForwardingFailures()
    {
        return forwardingFailures.get();
    }

    @SuppressWarnings("unchecked")
    public JSONObject getDebugState()
    {
        JSONObject debugState = new JSONObject();
        JSONObject streams = new JSONObject();
        mixedStreams.forEach((id, stream) -> streams.put(id, stream.getTracks().size()));
        debugState.put("mixed_streams", streams);
        debugState.put("tracks_forwarded", tracksForwarded.get());
        debugState.put("forwarding_failures", forwardingFailures.get());
        return debugState;
    }

    /**
     * Publishes a track on the connection of a participant.
     */
    public interface TrackForwarder
    {
        /**
         * @throws RtcException if the target's connection rejects the track.
         */
        RtpSender forward(@NotNull Participant target, @NotNull MediaStreamTrack track, MediaStream... streams);
    }
}
