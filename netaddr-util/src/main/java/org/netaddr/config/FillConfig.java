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

package org.netaddr.config;

/**
 * Settings of {@link org.netaddr.ip.IPv4NetFiller}, read from the [fill]
 * section of a configuration file.
 */
@ConfigGroup(FillConfig.GROUP_NAME)
public interface FillConfig {

    String GROUP_NAME = "fill";

    /**
     * Upper bound on the number of networks one fill may produce, 0 for no
     * bound.
     */
    @ConfigInt(key = "max_blocks", defaultValue = 0)
    int getMaxBlocks();

    /**
     * Whether candidates that are not subnets of the filled network are
     * rejected rather than ignored.
     */
    @ConfigBool(key = "strict", defaultValue = false)
    boolean isStrict();
}
