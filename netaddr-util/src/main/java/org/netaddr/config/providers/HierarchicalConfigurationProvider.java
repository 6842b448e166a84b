/*
 * Copyright 2015 Midokura SARL
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

package org.netaddr.config.providers;

import org.apache.commons.configuration.HierarchicalConfiguration;
import org.apache.commons.configuration.SubnodeConfiguration;

import org.netaddr.config.ConfigProvider;

/**
 * Reads configuration values from the sections of a commons-configuration
 * hierarchy, e.g. an INI file. A group with no section of its own yields
 * the defaults.
 */
public class HierarchicalConfigurationProvider extends ConfigProvider {

    private final HierarchicalConfiguration config;

    public HierarchicalConfigurationProvider(HierarchicalConfiguration config) {
        this.config = config;
    }

    @Override
    public int getValue(String group, String key, int defaultValue) {
        SubnodeConfiguration subConfig = groupAt(group);
        return subConfig == null ? defaultValue
                                 : subConfig.getInt(key, defaultValue);
    }

    @Override
    public boolean getValue(String group, String key, boolean defaultValue) {
        SubnodeConfiguration subConfig = groupAt(group);
        return subConfig == null ? defaultValue
                                 : subConfig.getBoolean(key, defaultValue);
    }

    private SubnodeConfiguration groupAt(String group) {
        if (config.configurationsAt(group).isEmpty())
            return null;
        return config.configurationAt(group);
    }
}
