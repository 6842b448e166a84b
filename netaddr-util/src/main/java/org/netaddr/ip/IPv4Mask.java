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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A 32 bit netmask, always a left aligned run of one bits. It is only ever
 * built from a prefix length, so arbitrary bit patterns cannot sneak in.
 *
 * Masks are ordered by capacity: a mask with a shorter prefix (that is,
 * one covering more addresses) compares greater.
 */
public final class IPv4Mask implements Comparable<IPv4Mask> {

    public static final int MAX_PREFIX_LEN = 32;

    private static final IPv4Mask[] MASKS = new IPv4Mask[MAX_PREFIX_LEN + 1];
    static {
        for (int i = 0; i <= MAX_PREFIX_LEN; i++)
            MASKS[i] = new IPv4Mask(i);
    }

    private final int prefixLen;
    private final int mask;

    private IPv4Mask(int prefixLen) {
        this.prefixLen = prefixLen;
        // In Java, a shift by 32 is a no-op, so special case /0
        this.mask = prefixLen == 0 ? 0 : -1 << (32 - prefixLen);
    }

    public static IPv4Mask of(int prefixLen) {
        if (prefixLen < 0 || prefixLen > MAX_PREFIX_LEN)
            throw new ValidationException(
                "Prefix length must be in [0, 32] but was " + prefixLen + ".");
        return MASKS[prefixLen];
    }

    /**
     * Parses a mask given either as a prefix length ("24" or "/24") or as a
     * dotted quad netmask ("255.255.255.0").
     */
    @JsonCreator
    public static IPv4Mask parse(String str) {
        if (str == null)
            throw new ValidationException("Netmask must not be null.");
        String s = str.trim();
        if (s.contains(".")) {
            int bits;
            try {
                bits = IPv4Addr.stringToInt(s);
            } catch (ValidationException e) {
                throw new ValidationException(
                    str + " is not a valid dotted quad netmask.", e);
            }
            int inverted = ~bits;
            if ((inverted & (inverted + 1)) != 0)
                throw new ValidationException(
                    str + " is not a contiguous netmask.");
            return MASKS[Integer.bitCount(bits)];
        }

        if (s.startsWith("/"))
            s = s.substring(1);
        if (s.isEmpty() || s.length() > 2
            || !IPv4Addr.DECIMAL.matchesAllOf(s))
            throw new ValidationException(
                str + " is not a valid prefix length.");
        return of(Integer.parseInt(s));
    }

    public int prefixLen() {
        return prefixLen;
    }

    public int mask() {
        return mask;
    }

    public int hostmask() {
        return mask ^ 0xffffffff;
    }

    /**
     * Number of addresses covered by this mask. A /0 covers the whole
     * address space, which does not fit the count, so it reports 0.
     */
    public long len() {
        if (prefixLen == 0)
            return 0;
        return 1L << (32 - prefixLen);
    }

    @Override
    public int compareTo(IPv4Mask other) {
        return Integer.compare(other.prefixLen, prefixLen);
    }

    /** The mask as a dotted quad, e.g. 255.255.255.0. */
    public String extended() {
        return IPv4Addr.intToString(mask);
    }

    @JsonValue
    @Override
    public String toString() {
        return "/" + prefixLen;
    }

    @Override
    public boolean equals(Object rhs) {
        if (this == rhs)
            return true;
        if (!(rhs instanceof IPv4Mask))
            return false;
        return prefixLen == ((IPv4Mask) rhs).prefixLen;
    }

    @Override
    public int hashCode() {
        return prefixLen;
    }
}
