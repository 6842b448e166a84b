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
import com.google.common.base.CharMatcher;
import org.apache.commons.lang.StringUtils;

/**
 * An IPv4 address. The 32 bit value is kept in an int and is always
 * treated as unsigned: ordering, {@link #toLong()} and the text form never
 * see a negative number.
 */
public final class IPv4Addr implements Comparable<IPv4Addr> {

    public static final IPv4Addr ANY = new IPv4Addr(0);
    public static final IPv4Addr BROADCAST = new IPv4Addr(0xffffffff);

    // ASCII digits only, parseInt also reads other unicode digits
    static final CharMatcher DECIMAL = CharMatcher.inRange('0', '9');

    private final int addr;
    // not final to allow lazy init, racing threads compute the same string
    private String sAddr = null;

    public IPv4Addr(int addr) {
        this.addr = addr;
    }

    public static IPv4Addr fromInt(int addr) {
        return new IPv4Addr(addr);
    }

    public static IPv4Addr fromLong(long addr) {
        if (addr < 0 || addr > Unsigned.MAX_UINT32)
            throw new ValidationException(
                addr + " is outside of the IPv4 address space.");
        return new IPv4Addr((int) addr);
    }

    @JsonCreator
    public static IPv4Addr fromString(String str) {
        return new IPv4Addr(stringToInt(str));
    }

    public int toInt() {
        return addr;
    }

    public long toLong() {
        return Unsigned.unsign(addr);
    }

    private static ValidationException illegalAddrString(String str) {
        return new ValidationException(
            "IPv4 address string must be 4 decimal octets in [0, 255] " +
                "joined with 3 '.' but was " + str + ".");
    }

    /**
     * Converts a dotted quad into its integer value. Whitespace around the
     * address is ignored, anything else that is not exactly four decimal
     * octets is rejected.
     */
    public static int stringToInt(String str) throws ValidationException {
        if (str == null)
            throw illegalAddrString(str);
        String[] octets = StringUtils.splitPreserveAllTokens(str.trim(), '.');
        if (octets.length != 4)
            throw illegalAddrString(str);
        int addr = 0;
        for (String s : octets) {
            if (s.isEmpty() || s.length() > 3 || !DECIMAL.matchesAllOf(s))
                throw illegalAddrString(str);
            int octet = Integer.parseInt(s);
            if (octet > 255)
                throw illegalAddrString(str);
            addr = (addr << 8) | octet;
        }
        return addr;
    }

    public static String intToString(int addr) {
        return ((addr >>> 24) & 0xff) + "." +
               ((addr >>> 16) & 0xff) + "." +
               ((addr >>> 8) & 0xff) + "." +
               (addr & 0xff);
    }

    @Override
    public int compareTo(IPv4Addr other) {
        return Unsigned.compare(addr, other.addr);
    }

    @JsonValue
    @Override
    public String toString() {
        if (sAddr == null)
            sAddr = intToString(addr);
        return sAddr;
    }

    @Override
    public boolean equals(Object rhs) {
        if (this == rhs)
            return true;
        if (!(rhs instanceof IPv4Addr))
            return false;
        return addr == ((IPv4Addr) rhs).addr;
    }

    @Override
    public int hashCode() {
        return addr;
    }
}
