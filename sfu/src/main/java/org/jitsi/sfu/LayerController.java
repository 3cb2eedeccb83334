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
import org.jitsi.utils.logging2.*;

import java.util.*;

/**
 * Configures the encoding layers of outbound senders and clamps their
 * bitrate caps to the available bandwidth.
 *
 * Every read-modify-write of a sender's parameter block happens while holding
 * a lock private to the sender's {@link PeerConnection}, so that an
 * adaptation tick and an explicit call for the same connection do not
 * overwrite each other's changes.
 */
public class LayerController
{
    private final Logger logger;

    private final LayerConfig config;

    /**
     * One lock per connection. Weak keys, so that closed connections which
     * are no longer referenced do not keep their lock around.
     */
    private final Map<PeerConnection, Object> connectionLocks = new WeakHashMap<>();

    public LayerController(@NotNull LayerConfig config, @NotNull Logger parentLogger)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = parentLogger.createChildLogger(LayerController.class.getName());
    }

    /**
     * Publishes <tt>track</tt> on <tt>connection</tt> and replaces the
     * encodings of the new sender with the configured simulcast layers.
     *
     * @return the sender of the published track.
     * @throws RtcException if the engine fails to add the track or to apply
     * the parameters.
     */
    public @NotNull RtpSender enableSimulcast(
            @NotNull PeerConnection connection,
            @NotNull MediaStreamTrack track,
            MediaStream... streams)
    {
        RtpSender sender = connection.addTrack(track, streams);
        configureSimulcast(connection, sender);
        return sender;
    }

    /**
     * Publishes <tt>track</tt> on <tt>connection</tt> and sets the configured
     * scalability mode on the first encoding of the new sender.
     *
     * @return the sender of the published track.
     * @throws RtcException if the engine fails to add the track or to apply
     * the parameters.
     */
    public @NotNull RtpSender enableSVC(
            @NotNull PeerConnection connection,
            @NotNull MediaStreamTrack track,
            MediaStream... streams)
    {
        RtpSender sender = connection.addTrack(track, streams);
        configureSvc(connection, sender);
        return sender;
    }

    /**
     * Installs the configured simulcast layers on an existing sender,
     * whatever its current encodings are.
     */
    public void configureSimulcast(@NotNull PeerConnection connection, @NotNull RtpSender sender)
    {
        synchronized (lockFor(connection))
        {
            RtpParameters parameters = parametersOf(sender);
            LayerConfiguration.Simulcast simulcast = LayerConfiguration.simulcast(config.getSimulcastLayers());
            simulcast.applyTo(parameters);
            sender.setParameters(parameters);
            logger.debug(() -> "Configured " + simulcast + " on " + trackIdOf(sender));
        }
    }

    /**
     * Sets the configured scalability mode on the first encoding of an
     * existing sender, creating that encoding if the sender has none.
     */
    public void configureSvc(@NotNull PeerConnection connection, @NotNull RtpSender sender)
    {
        synchronized (lockFor(connection))
        {
            RtpParameters parameters = parametersOf(sender);
            LayerConfiguration.Svc svc
                = LayerConfiguration.svc(LayerConfiguration.of(parameters), config.getSvcScalabilityMode());
            svc.applyTo(parameters);
            sender.setParameters(parameters);
            logger.debug(() -> "Configured " + svc + " on " + trackIdOf(sender));
        }
    }

    /**
     * Applies a {@link LayerMode} to a sender. {@link LayerMode#NONE} leaves
     * the sender untouched.
     */
    public void configure(@NotNull PeerConnection connection, @NotNull RtpSender sender, @NotNull LayerMode mode)
    {
        switch (mode)
        {
        case SIMULCAST:
            configureSimulcast(connection, sender);
            break;
        case SVC:
            configureSvc(connection, sender);
            break;
        case NONE:
        default:
            break;
        }
    }

    /**
     * Caps the bitrate of every encoding of every sender of
     * <tt>connection</tt> at <tt>availableBandwidth</tt>. Caps are only ever
     * lowered: an encoding whose cap is already below the estimate keeps it,
     * an encoding without a cap gets the estimate. Senders without encodings
     * are left alone.
     *
     * @param availableBandwidth the available bandwidth in bits per second.
     * @throws IllegalArgumentException if <tt>availableBandwidth</tt> is
     * negative.
     * @throws RtcException if the connection is closed.
     */
    public void adjustBitrate(@NotNull PeerConnection connection, long availableBandwidth)
    {
        if (availableBandwidth < 0)
        {
            throw new IllegalArgumentException("Negative bandwidth: " + availableBandwidth);
        }

        synchronized (lockFor(connection))
        {
            for (RtpSender sender : connection.getSenders())
            {
                RtpParameters parameters = parametersOf(sender);
                LayerConfiguration current = LayerConfiguration.of(parameters);
                if (!current.isConfigured())
                {
                    continue;
                }

                current.clampBitrate(availableBandwidth).applyTo(parameters);
                sender.setParameters(parameters);
            }
        }

        if (logger.isDebugEnabled())
        {
            logger.debug("Clamped layer bitrates to " + availableBandwidth + " bps");
        }
    }

    /**
     * @return the current layering of <tt>sender</tt>.
     */
    public @NotNull LayerConfiguration getLayerConfiguration(@NotNull RtpSender sender)
    {
        return LayerConfiguration.of(sender.getParameters());
    }

    public @NotNull LayerConfig getConfig()
    {
        return config;
    }

    /**
     * @return the lock which guards the parameters of the senders of
     * <tt>connection</tt>.
     */
    Object lockFor(@NotNull PeerConnection connection)
    {
        synchronized (connectionLocks)
        {
            return connectionLocks.computeIfAbsent(connection, c -> new Object());
        }
    }

    private static RtpParameters parametersOf(RtpSender sender)
    {
        RtpParameters parameters = sender.getParameters();
        return parameters == null ? new RtpParameters() : parameters;
    }

    private static String trackIdOf(RtpSender sender)
    {
        MediaStreamTrack track = sender.getTrack();
        return track == null ? "detached sender" : "track " + track.getId();
    }
}
