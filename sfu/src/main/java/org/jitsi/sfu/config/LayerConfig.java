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

package org.jitsi.sfu.config;

import com.typesafe.config.*;
import org.jetbrains.annotations.*;
import org.jitsi.sfu.*;

import java.util.*;

/**
 * Configuration of the simulcast and SVC layers which the
 * {@link LayerController} installs on outbound senders.
 */
public class LayerConfig
{
    protected static final String SIMULCAST_LAYERS_PNAME = "layers.simulcast";
    protected static final String SVC_MODE_PNAME = "layers.svc.scalability-mode";
    protected static final String AUTO_MODE_PNAME = "layers.auto-mode";

    private final List<SimulcastLayer> simulcastLayers;

    private final String svcScalabilityMode;

    private final LayerMode autoMode;

    public LayerConfig()
    {
        this(SfuConfig.getSfuConfig());
    }

    /**
     * @param config the <tt>sfu</tt> configuration block.
     */
    public LayerConfig(@NotNull Config config)
    {
        List<SimulcastLayer> layers = new ArrayList<>();
        for (Config layer : config.getConfigList(SIMULCAST_LAYERS_PNAME))
        {
            Double scaleDown = layer.hasPath("scale-down") ? layer.getDouble("scale-down") : null;
            if (scaleDown != null && scaleDown < 1)
            {
                throw new ConfigException.BadValue(
                        SIMULCAST_LAYERS_PNAME, "scale-down must be at least 1, got " + scaleDown);
            }
            layers.add(new SimulcastLayer(layer.getString("rid"), layer.getLong("max-bitrate"), scaleDown));
        }
        if (layers.isEmpty())
        {
            throw new ConfigException.BadValue(SIMULCAST_LAYERS_PNAME, "at least one layer is required");
        }
        simulcastLayers = Collections.unmodifiableList(layers);

        svcScalabilityMode = config.getString(SVC_MODE_PNAME);

        String mode = config.getString(AUTO_MODE_PNAME);
        try
        {
            autoMode = LayerMode.valueOf(mode.toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e)
        {
            throw new ConfigException.BadValue(AUTO_MODE_PNAME, "unknown mode " + mode, e);
        }
    }

    /**
     * @return the simulcast layers, highest resolution first.
     */
    public List<SimulcastLayer> getSimulcastLayers()
    {
        return simulcastLayers;
    }

    public String getSvcScalabilityMode()
    {
        return svcScalabilityMode;
    }

    /**
     * @return the layer mode applied to video tracks which the SFU forwards
     * on its own (as opposed to explicit calls to
     * {@link LayerController#enableSimulcast} or
     * {@link LayerController#enableSVC}).
     */
    public LayerMode getAutoMode()
    {
        return autoMode;
    }
}
