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
 * A group of tracks which belong together (e.g. the microphone and camera of
 * one participant). Binding a track to a stream when it is added to a
 * {@link PeerConnection} tells the remote side how to group it.
 */
public interface MediaStream
{
    @NotNull
    String getId();

    /**
     * @return a snapshot of the tracks currently in this stream.
     */
    @NotNull
    List<MediaStreamTrack> getTracks();
}
