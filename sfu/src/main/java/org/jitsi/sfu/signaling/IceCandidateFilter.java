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

import java.util.regex.*;

/**
 * Removes IPv4 UDP host candidates from candidate strings, so that private
 * addresses are not disclosed to remote participants.
 */
public class IceCandidateFilter
{
    private static final Pattern HOST_CANDIDATE = Pattern.compile(
        "a=candidate:\\d+ \\d+ udp \\d+ \\d+\\.\\d+\\.\\d+\\.\\d+ \\d+ typ host",
        Pattern.CASE_INSENSITIVE);

    /**
     * @return <tt>candidate</tt> with every IPv4 UDP host candidate removed.
     * @throws IllegalArgumentException if <tt>candidate</tt> is null.
     */
    public static @NotNull String sanitize(String candidate)
    {
        if (candidate == null)
        {
            throw new IllegalArgumentException("Invalid input: candidate must be a string");
        }
        return HOST_CANDIDATE.matcher(candidate).replaceAll("");
    }
}
