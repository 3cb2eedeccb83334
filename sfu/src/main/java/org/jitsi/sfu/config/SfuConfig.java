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
import org.jitsi.utils.logging2.*;

import java.util.function.*;

/**
 * Holds the configuration of the SFU. The configuration is read from
 * <tt>reference.conf</tt> (the defaults shipped with the SFU) and, when
 * present, <tt>application.conf</tt> in the classpath or the file named by
 * the <tt>-Dconfig.file</tt> system property.
 */
public class SfuConfig
{
    protected static Logger logger = new LoggerImpl(SfuConfig.class.getName());

    /**
     * The name of the block which holds all SFU properties.
     */
    public static final String BASE = "sfu";

    /**
     * The supplier to load the config.  Overridable for testing
     */
    public static Supplier<Config> configSupplier = ConfigFactory::load;

    public static final Supplier<Config> DEFAULT_CONFIG_SUPPLIER = ConfigFactory::load;

    protected static Config config;

    static {
        loadConfig();
    }

    public static void loadConfig()
    {
        Config newConfig = configSupplier.get();
        if (!newConfig.hasPath(BASE))
        {
            throw new ConfigException.Missing(BASE);
        }
        config = newConfig;
        logger.info("Loaded SFU config: " + config.getConfig(BASE).root().render(ConfigRenderOptions.concise()));
    }

    public static void reloadConfig()
    {
        logger.info("Reloading config");
        ConfigFactory.invalidateCaches();
        loadConfig();
    }

    /**
     * @return the complete loaded configuration.
     */
    public static @NotNull Config getConfig()
    {
        return config;
    }

    /**
     * @return the <tt>sfu</tt> block of the loaded configuration.
     */
    public static @NotNull Config getSfuConfig()
    {
        return config.getConfig(BASE);
    }
}
