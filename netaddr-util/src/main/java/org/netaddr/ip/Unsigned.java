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

package org.netaddr.ip;

public class Unsigned {

    public static final long MAX_UINT32 = 0xffffffffL;

    /** Number of values in the 32 bit address space. */
    public static final long UINT32_RANGE = 1L << 32;

    public static long unsign(int i) {
        return (long)i & MAX_UINT32;
    }

    public static int compare(int a, int b) {
        return Long.compare(unsign(a), unsign(b));
    }
}
