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
package org.jitsi.sfu.transport;

import org.jetbrains.annotations.*;

import java.util.*;

/**
 * A transport connection to one remote participant. The offer/answer
 * exchange, ICE and DTLS are handled by the engine before the connection is
 * handed to the SFU.
 */
public interface PeerConnection
{
    /**
     * Starts sending a track on this connection.
     *
     * @param track the track to send.
     * @param streams the streams to which the track is bound on the remote
     * side, possibly none.
     * @return the sender which was created for the track.
     * @throws RtcException if the connection is closed or the track can not
     * be added.
     */
    @NotNull
    RtpSender addTrack(@NotNull MediaStreamTrack track, MediaStream... streams);

    /**
     * @return the senders of this connection.
     * @throws RtcException if the connection is closed.
     */
    @NotNull
    List<RtpSender> getSenders();

    /**
     * Collects the current statistics of this connection. This may block
     * until the engine has gathered them.
     *
     * @throws RtcException if the connection is closed.
     */
    @NotNull
    StatsReport getStats();

    /**
     * Installs the listener which is notified when the remote side starts
     * sending a new track. Replaces any previously installed listener.
     */
    void setTrackListener(@Nullable TrackListener listener);

    /**
     * Closes this connection and releases its transport resources.
     */
    void close();

    /**
     * Notified when a track arrives on a {@link PeerConnection}.
     */
    interface TrackListener
    {
        /**
         * @param track the track which arrived.
         * @param streams the streams the remote side bound the track to,
         * possibly empty.
         */
        void trackAdded(@NotNull MediaStreamTrack track, @NotNull List<MediaStream> streams);
    }
}
