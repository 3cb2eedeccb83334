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

/**
 * The sending side of one track on a {@link PeerConnection}. Sender handles
 * are owned by their connection and only borrowed by the SFU.
 */
public interface RtpSender
{
    /**
     * @return the track which this sender sends, or <tt>null</tt> if it has
     * been detached.
     */
    @Nullable
    MediaStreamTrack getTrack();

    /**
     * Reads the current parameter block of this sender. The returned object
     * is a copy: changes only take effect through
     * {@link #setParameters(RtpParameters)}.
     *
     * @return the current parameters, possibly <tt>null</tt> if the engine
     * has none.
     * @throws RtcException if the connection is closed.
     */
    @Nullable
    RtpParameters getParameters();

    /**
     * Applies a parameter block to this sender.
     *
     * @throws RtcException if the parameters are rejected or the connection
     * is closed.
     */
    void setParameters(@NotNull RtpParameters parameters);
}
