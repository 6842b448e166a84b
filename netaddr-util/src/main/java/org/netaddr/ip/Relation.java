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

/**
 * How one network relates to another in terms of containment, as seen from
 * the network on which {@link IPv4Net#relationship(IPv4Net)} was called.
 */
public enum Relation {

    /** This network contains the other one. */
    SUPERNET(1),
    /** Both networks cover the same range. */
    EQUAL(0),
    /** This network is contained in the other one. */
    SUBNET(-1),
    /** The networks do not overlap. */
    UNRELATED(0);

    private final int value;

    Relation(int value) {
        this.value = value;
    }

    public boolean isRelated() {
        return this != UNRELATED;
    }

    /** The inverse relation, as seen from the other network. */
    public Relation reverse() {
        switch (this) {
            case SUPERNET: return SUBNET;
            case SUBNET: return SUPERNET;
            default: return this;
        }
    }

    /**
     * +1, 0 or -1 for supernet, equal and subnet. Unrelated networks have
     * no numeric value, so check {@link #isRelated()} first.
     */
    public int toInt() {
        if (this == UNRELATED)
            throw new IllegalStateException(
                "Unrelated networks have no numeric relationship");
        return value;
    }
}
