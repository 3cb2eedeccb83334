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
package org.jitsi.sfu.signaling;

import org.jetbrains.annotations.*;
import org.jitsi.utils.logging2.*;

import java.util.*;
import java.util.regex.*;

/**
 * Utilities for rewriting session descriptions.
 */
public class SdpUtils
{
    private static final Logger logger = new LoggerImpl(SdpUtils.class.getName());

    /**
     * Makes <tt>codecName</tt> the preferred video codec of <tt>sdp</tt> by
     * moving its payload type to the front of the format list of every video
     * media line. If the description does not offer the codec, it is
     * returned unchanged and a warning is logged.
     *
     * @param sdp the session description.
     * @param codecName the encoding name, e.g. <tt>VP9</tt> (case
     * insensitive).
     * @return the rewritten session description.
     * @throws IllegalArgumentException if either argument is null or empty.
     */
    public static @NotNull String setPreferredCodec(String sdp, String codecName)
    {
        if (sdp == null || sdp.isEmpty())
        {
            throw new IllegalArgumentException("Invalid input: sdp must be a non-empty string");
        }
        if (codecName == null || codecName.isEmpty())
        {
            throw new IllegalArgumentException("Invalid input: codec name must be a non-empty string");
        }

        Matcher rtpmap = Pattern.compile(
                "^a=rtpmap:(\\d+) " + Pattern.quote(codecName) + "/",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE)
            .matcher(sdp);
        if (!rtpmap.find())
        {
            logger.warn("No " + codecName + " codec found in the SDP");
            return sdp;
        }
        String payloadType = rtpmap.group(1);

        String lineSeparator = sdp.contains("\r\n") ? "\r\n" : "\n";
        String[] lines = sdp.split("\r?\n", -1);
        StringBuilder result = new StringBuilder(sdp.length());
        for (int i = 0; i < lines.length; i++)
        {
            String line = lines[i];
            if (line.startsWith("m=video "))
            {
                line = preferPayloadType(line, payloadType);
            }
            result.append(line);
            if (i < lines.length - 1)
            {
                result.append(lineSeparator);
            }
        }
        return result.toString();
    }

    /**
     * Moves <tt>payloadType</tt> to the front of the format list of a media
     * line (<tt>m=&lt;media&gt; &lt;port&gt; &lt;proto&gt; &lt;fmt&gt; ...</tt>).
     * Lines which do not list <tt>payloadType</tt> are returned unchanged.
     */
    static String preferPayloadType(String mediaLine, String payloadType)
    {
        List<String> tokens = new ArrayList<>(Arrays.asList(mediaLine.split(" ")));
        if (tokens.size() < 4)
        {
            return mediaLine;
        }

        List<String> formats = tokens.subList(3, tokens.size());
        if (!formats.remove(payloadType))
        {
            return mediaLine;
        }
        formats.add(0, payloadType);
        return String.join(" ", tokens);
    }
}
