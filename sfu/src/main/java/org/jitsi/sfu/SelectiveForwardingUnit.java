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
import org.jitsi.sfu.config.*;
import org.jitsi.sfu.transport.*;
import org.jitsi.sfu.util.*;
import org.jitsi.utils.logging2.*;
import org.json.simple.*;

import java.util.*;
import java.util.concurrent.*;

/**
 * The control plane of one session: tracks its participants, redistributes
 * every inbound track to the other participants and keeps adapting the
 * outbound encodings of each connection to its available bandwidth.
 *
 * Participants and tracks are expected to be added from the session's event
 * handling context. Adaptation ticks run on the scheduler.
 */
public class SelectiveForwardingUnit
{
    private final Logger logger;

    private final ParticipantRegistry registry = new ParticipantRegistry();

    private final StreamMixer mixer;

    private final LayerController layerController;

    private final BandwidthEstimator estimator;

    private final AdaptationConfig adaptationConfig;

    private final ScheduledExecutorService scheduler;

    /**
     * The adaptation loops started through
     * {@link #monitorNetworkConditions(PeerConnection)} for connections which
     * are not owned by a registered participant.
     */
    private final ConcurrentHashMap<PeerConnection, AdaptationLoop> detachedLoops = new ConcurrentHashMap<>();

    /**
     * Initializes a new {@link SelectiveForwardingUnit} which reads its
     * settings from the loaded configuration and runs adaptation on
     * {@link TaskPools#SCHEDULED_POOL}.
     */
    public SelectiveForwardingUnit()
    {
        this(
            TaskPools.SCHEDULED_POOL,
            new AdaptationConfig(),
            new EstimatorConfig(),
            new LayerConfig(),
            new LoggerImpl(SelectiveForwardingUnit.class.getName()));
    }

    public SelectiveForwardingUnit(
            @NotNull ScheduledExecutorService scheduler,
            @NotNull AdaptationConfig adaptationConfig,
            @NotNull EstimatorConfig estimatorConfig,
            @NotNull LayerConfig layerConfig,
            @NotNull Logger logger)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.adaptationConfig = Objects.requireNonNull(adaptationConfig, "adaptationConfig");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.estimator = new BandwidthEstimator(estimatorConfig);
        this.layerController = new LayerController(layerConfig, logger);
        this.mixer = new StreamMixer(registry, this::publishTrack, logger);
    }

    /**
     * Registers a participant and starts routing the tracks arriving on its
     * connection to the other participants. If a participant is already
     * registered with <tt>id</tt>, it is expired and replaced. Its connection
     * is closed, unless it is <tt>connection</tt> itself, in which case the
     * new participant takes it over and keeps adapting it if the previous
     * participant did.
     *
     * @param id the identifier of the participant.
     * @param connection the connection of the participant, owned by the SFU
     * from now on.
     * @return the new participant.
     * @throws IllegalArgumentException if <tt>id</tt> is null or empty.
     */
    public @NotNull Participant addParticipant(String id, @NotNull PeerConnection connection)
    {
        if (id == null || id.isEmpty())
        {
            throw new IllegalArgumentException("Invalid participant id: '" + id + "'");
        }
        Objects.requireNonNull(connection, "connection");

        Map<String, String> context = new HashMap<>();
        context.put("participantId", id);
        Logger participantLogger = logger.createChildLogger(Participant.class.getName(), context);

        AdaptationLoop adaptationLoop = detachedLoops.remove(connection);
        if (adaptationLoop == null || adaptationLoop.getState() == AdaptationLoop.State.STOPPED)
        {
            adaptationLoop = createAdaptationLoop(connection, participantLogger);
        }

        Participant participant = new Participant(id, connection, adaptationLoop, participantLogger);
        Participant previous = registry.add(participant);
        if (previous != null)
        {
            logger.warn("Participant " + id + " was already registered, replacing it.");
            boolean sameConnection = previous.getConnection() == connection;
            boolean wasAdapting = previous.getAdaptationLoop().getState() == AdaptationLoop.State.RUNNING;
            previous.expire(!sameConnection);
            if (sameConnection && wasAdapting)
            {
                // The connection changes hands, its adaptation carries on.
                participant.startAdaptation();
            }
        }

        connection.setTrackListener((track, streams) -> onTrack(id, track, streams));
        participantLogger.info("Added, " + registry.size() + " participants.");
        return participant;
    }

    /**
     * Expires and unregisters a participant: stops its adaptation loop and
     * closes its connection. Does nothing if no participant is registered
     * with <tt>id</tt>.
     *
     * @return <tt>true</tt> if a participant was removed.
     */
    public boolean removeParticipant(@NotNull String id)
    {
        Participant participant = registry.remove(id);
        if (participant == null)
        {
            logger.debug(() -> "Participant " + id + " is not registered, nothing to remove.");
            return false;
        }

        participant.expire();
        logger.info("Removed participant " + id + ", " + registry.size() + " participants left.");
        return true;
    }

    /**
     * Called when a track arrives on the connection of a participant.
     */
    private void onTrack(String participantId, MediaStreamTrack track, List<MediaStream> streams)
    {
        Participant participant = registry.get(participantId);
        if (participant == null || participant.isExpired())
        {
            logger.warn("Track " + track.getId() + " arrived for unknown participant " + participantId);
            return;
        }

        MediaStream originStream = streams.isEmpty() ? null : streams.get(0);
        mixer.handleTrack(participantId, track, originStream);
    }

    /**
     * Forwards every track of <tt>stream</tt>, bound to <tt>stream</tt>, to
     * every registered participant.
     */
    public void broadcastStream(@NotNull MediaStream stream)
    {
        for (MediaStreamTrack track : stream.getTracks())
        {
            mixer.forward(null, track, stream);
        }
    }

    /**
     * Publishes a track on the connection of <tt>target</tt>, configures its
     * layers if it is a video track, and makes sure the connection adapts to
     * its bandwidth if the track is bound to a stream.
     */
    private RtpSender publishTrack(Participant target, MediaStreamTrack track, MediaStream... streams)
    {
        PeerConnection connection = target.getConnection();
        RtpSender sender = connection.addTrack(track, streams);

        LayerMode autoMode = layerController.getConfig().getAutoMode();
        if (track.getKind() == MediaType.VIDEO && autoMode != LayerMode.NONE)
        {
            try
            {
                layerController.configure(connection, sender, autoMode);
            }
            catch (RtcException e)
            {
                logger.warn("Failed to configure " + autoMode + " for track " + track.getId()
                    + " sent to " + target.getId(), e);
            }
        }

        if (streams.length > 0)
        {
            target.startAdaptation();
        }
        return sender;
    }

    /**
     * @see LayerController#enableSimulcast
     */
    public @NotNull RtpSender enableSimulcast(@NotNull PeerConnection connection, @NotNull MediaStreamTrack track)
    {
        return layerController.enableSimulcast(connection, track);
    }

    /**
     * @see LayerController#enableSVC
     */
    public @NotNull RtpSender enableSVC(@NotNull PeerConnection connection, @NotNull MediaStreamTrack track)
    {
        return layerController.enableSVC(connection, track);
    }

    /**
     * @see LayerController#adjustBitrate
     */
    public void adjustBitrate(@NotNull PeerConnection connection, long availableBandwidth)
    {
        layerController.adjustBitrate(connection, availableBandwidth);
    }

    /**
     * Starts adapting the encodings of <tt>connection</tt> to its available
     * bandwidth. If the connection belongs to a registered participant, the
     * participant's loop is started and stops with the participant.
     * Otherwise a loop is started for the connection and it is up to the
     * caller to stop it (or to register the connection, handing the loop to
     * the new participant). Starting an already running loop has no effect.
     *
     * @return the adaptation loop of <tt>connection</tt>.
     */
    public @NotNull AdaptationLoop monitorNetworkConditions(@NotNull PeerConnection connection)
    {
        Participant participant = registry.findByConnection(connection);
        if (participant != null)
        {
            participant.startAdaptation();
            return participant.getAdaptationLoop();
        }

        AdaptationLoop loop = detachedLoops.compute(
            connection,
            (c, existing) -> existing == null || existing.getState() == AdaptationLoop.State.STOPPED
                ? createAdaptationLoop(c, logger)
                : existing);
        loop.start();
        return loop;
    }

    private AdaptationLoop createAdaptationLoop(PeerConnection connection, Logger parentLogger)
    {
        return new AdaptationLoop(
            connection,
            layerController,
            estimator,
            scheduler,
            adaptationConfig.getInterval(),
            parentLogger);
    }

    /**
     * Tears the session down: removes every participant and stops every
     * adaptation loop.
     */
    public void expire()
    {
        logger.info("Expiring, " + registry.size() + " participants.");
        for (Participant participant : registry.getParticipants())
        {
            removeParticipant(participant.getId());
        }
        detachedLoops.values().forEach(AdaptationLoop::stop);
        detachedLoops.clear();
    }

    public @Nullable Participant getParticipant(@NotNull String id)
    {
        return registry.get(id);
    }

    public @NotNull List<Participant> getParticipants()
    {
        return registry.getParticipants();
    }

    public @NotNull StreamMixer getMixer()
    {
        return mixer;
    }

    public @NotNull LayerController getLayerController()
    {
        return layerController;
    }

    public @NotNull BandwidthEstimator getEstimator()
    {
        return estimator;
    }

    @SuppressWarnings("unchecked")
    public JSONObject getDebugState()
    {
        JSONObject debugState = new JSONObject();

        JSONObject participants = new JSONObject();
        for (Participant participant : registry.getParticipants())
        {
            participants.put(participant.getId(), participant.getDebugState());
        }
        debugState.put("participants", participants);
        debugState.put("detached_adaptation_loops", detachedLoops.size());
        debugState.put("mixer", mixer.getDebugState());
        debugState.put("task_pools", TaskPools.getStatsJson());

        return debugState;
    }
}
