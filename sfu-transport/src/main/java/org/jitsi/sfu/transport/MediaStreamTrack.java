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
 * A single audio or video track, as exposed by the transport engine. Tracks
 * are owned by the engine; the SFU only holds references to them.
 */
public interface MediaStreamTrack
{
    /**
     * @return the identifier of this track, unique within its connection.
     */
    @NotNull
    String getId();

    /**
     * @return whether this is an audio or a video track.
     */
    @NotNull
    MediaType getKind();
}
