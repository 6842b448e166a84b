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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang.StringUtils;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An IPv4 network: a base address and a netmask. The base is always the
 * network address, host bits of the address given at construction are
 * cleared.
 *
 * Instances are immutable. Operations that would run off either end of the
 * address space, or that have no meaningful answer for the given input,
 * return {@link Optional#empty()}.
 */
public final class IPv4Net implements Comparable<IPv4Net> {

    private final IPv4Addr base;
    private final IPv4Mask mask;
    // benign race, every thread caches the same value
    private String string = null;

    public IPv4Net(IPv4Addr address) {
        this(address, null);
    }

    /**
     * @param address any address inside the network
     * @param mask the netmask, a /32 is assumed when null
     */
    public IPv4Net(IPv4Addr address, IPv4Mask mask) {
        checkNotNull(address, "address");
        this.mask = mask == null ? IPv4Mask.of(32) : mask;
        this.base = address.toInt() == (address.toInt() & this.mask.mask())
                    ? address
                    : new IPv4Addr(address.toInt() & this.mask.mask());
    }

    public IPv4Net(String address, int prefixLen) {
        this(IPv4Addr.fromString(address), IPv4Mask.of(prefixLen));
    }

    public IPv4Net(int address, int prefixLen) {
        this(new IPv4Addr(address), IPv4Mask.of(prefixLen));
    }

    /**
     * Construct an IPv4Net from one of its text forms:
     * <ul>
     *   <li>CIDR notation, "192.168.0.0/16"</li>
     *   <li>extended notation, "192.168.0.0 255.255.0.0"</li>
     *   <li>a bare address, "192.168.0.1", taken as a /32</li>
     * </ul>
     * Surrounding whitespace is ignored.
     *
     * @throws ValidationException if the text is none of the above
     */
    @JsonCreator
    public static IPv4Net parse(String net) {
        if (net == null)
            throw new ValidationException("Network must not be null.");
        String s = net.trim();
        String[] parts;
        if (s.contains("/")) {
            parts = StringUtils.splitPreserveAllTokens(s, '/');
        } else if (s.contains(" ")) {
            parts = StringUtils.split(s);
        } else {
            parts = new String[] { s, "32" };
        }
        if (parts.length != 2)
            throw new ValidationException(net + " is not a valid network.");
        return new IPv4Net(IPv4Addr.fromString(parts[0]),
                           IPv4Mask.parse(parts[1]));
    }

    /** The network address. */
    public IPv4Addr network() {
        return base;
    }

    public IPv4Mask netmask() {
        return mask;
    }

    /**
     * Number of addresses in this network. Always 0 for a /0, whose size
     * does not fit.
     */
    public long len() {
        return mask.len();
    }

    /** The last address of this network. */
    public IPv4Addr broadcast() {
        return new IPv4Addr(base.toInt() | mask.hostmask());
    }

    public boolean contains(IPv4Addr address) {
        checkNotNull(address, "address");
        return (address.toInt() & mask.mask()) == base.toInt();
    }

    /** The network in extended format, e.g. "10.0.0.0 255.255.255.0". */
    public String extended() {
        return base.toString() + " " + mask.extended();
    }

    /**
     * Orders by network address first. Networks sharing an address are
     * ordered by their netmask, the larger network being the greater one.
     */
    @Override
    public int compareTo(IPv4Net other) {
        int cmp = base.compareTo(other.base);
        if (cmp != 0)
            return cmp;
        return mask.compareTo(other.mask);
    }

    /** Same as {@link #compareTo(IPv4Net)}, normalized to -1, 0 or 1. */
    public int cmp(IPv4Net other) {
        checkNotNull(other, "other");
        return Integer.signum(compareTo(other));
    }

    /**
     * Determines the relationship of this network to another one.
     */
    public Relation relationship(IPv4Net other) {
        checkNotNull(other, "other");

        // with the same network address only the netmask matters
        if (base.equals(other.base)) {
            int cmp = mask.compareTo(other.mask);
            if (cmp > 0)
                return Relation.SUPERNET;
            return cmp == 0 ? Relation.EQUAL : Relation.SUBNET;
        }

        int addr = base.toInt();
        int otherAddr = other.base.toInt();
        int hostmask = mask.hostmask();
        int otherHostmask = other.mask.hostmask();
        if ((addr | hostmask) == (otherAddr | hostmask))
            return Relation.SUPERNET;
        if ((addr | otherHostmask) == (otherAddr | otherHostmask))
            return Relation.SUBNET;
        return Relation.UNRELATED;
    }

    /**
     * The network of the same size immediately following this one, or
     * empty at the end of the address space.
     */
    public Optional<IPv4Net> nextSib() {
        return nthSib(1, false);
    }

    /**
     * The network of the same size immediately preceding this one, or
     * empty if this network starts at 0.0.0.0.
     */
    public Optional<IPv4Net> prevSib() {
        return nthSib(1, true);
    }

    /**
     * The largest network starting right after this one, or empty at the
     * end of the address space.
     */
    public Optional<IPv4Net> next() {
        Optional<IPv4Net> sib = nextSib();
        if (!sib.isPresent())
            return sib;
        return Optional.of(sib.get().grow());
    }

    /**
     * The largest network, aligned on its own size, ending right before
     * this one. Empty if this network starts at 0.0.0.0.
     */
    public Optional<IPv4Net> prev() {
        return grow().prevSib();
    }

    /**
     * Widens the netmask as far as possible without changing the network
     * address.
     */
    public IPv4Net grow() {
        long addr = base.toLong();
        long m = Unsigned.unsign(mask.mask());
        int prefixLen = mask.prefixLen();
        while (prefixLen > 0) {
            m = (m << 1) & Unsigned.MAX_UINT32;
            // one bits of the address would fall in the host part
            if ((addr | m) != m)
                break;
            prefixLen--;
        }
        if (prefixLen == mask.prefixLen())
            return this;
        return new IPv4Net(base, IPv4Mask.of(prefixLen));
    }

    /**
     * Returns the nth next sibling network, or the nth previous one if
     * backward is set. Empty if the sibling would fall outside of the
     * address space or n is negative.
     */
    public Optional<IPv4Net> nthSib(long n, boolean backward) {
        if (n < 0 || n > Unsigned.MAX_UINT32)
            return Optional.empty();

        // siblings are consecutive indexes once the host bits are shifted out
        int shift = 32 - mask.prefixLen();
        long index = base.toLong() >>> shift;
        long sib = backward ? index - n : index + n;
        if (sib < 0 || sib > (Unsigned.MAX_UINT32 >>> shift))
            return Optional.empty();
        return Optional.of(
            new IPv4Net(IPv4Addr.fromLong(sib << shift), mask));
    }

    /**
     * The address at the given offset from the network address, or empty if
     * the offset is outside of the network. See {@link #len()}.
     */
    public Optional<IPv4Addr> nth(long index) {
        if (index < 0 || index >= len())
            return Optional.empty();
        return Optional.of(IPv4Addr.fromLong(base.toLong() + index));
    }

    /**
     * The subnet with the given prefix length at the given index, or empty
     * if there is no such subnet. See {@link #subnetCount(int)}.
     */
    public Optional<IPv4Net> nthSubnet(int prefixLen, long index) {
        long count = subnetCount(prefixLen);
        if (count == 0 || index < 0 || index >= count)
            return Optional.empty();
        IPv4Net sub0 = new IPv4Net(base, IPv4Mask.of(prefixLen));
        return sub0.nthSib(index, false);
    }

    /**
     * A copy of this network with a different netmask.
     *
     * @throws ValidationException if prefixLen is not in [0, 32]
     */
    public IPv4Net resize(int prefixLen) {
        return new IPv4Net(base, IPv4Mask.of(prefixLen));
    }

    /**
     * Number of subnets with the given prefix length this network holds.
     * Returns 0 when the prefix length is invalid or not longer than this
     * network's, and when the count would not fit 32 bits (e.g. /32s in a
     * /0).
     */
    public long subnetCount(int prefixLen) {
        int ownLen = mask.prefixLen();
        if (prefixLen <= ownLen || prefixLen > 32 || prefixLen - ownLen >= 32)
            return 0;
        return 1L << (prefixLen - ownLen);
    }

    /**
     * Merges this network and its sibling into their parent network. Empty
     * if the two networks are not the two halves of the same parent.
     */
    public Optional<IPv4Net> summarize(IPv4Net other) {
        checkNotNull(other, "other");
        int prefixLen = mask.prefixLen();
        if (prefixLen != other.mask.prefixLen() || prefixLen == 0)
            return Optional.empty();

        // halves of the same parent are equal without the host bits and
        // the bit that tells them apart
        int shift = 32 - prefixLen + 1;
        if (base.toLong() >>> shift != other.base.toLong() >>> shift)
            return Optional.empty();
        return Optional.of(resize(prefixLen - 1));
    }

    /**
     * Partitions this network. The subnets of this network found in the
     * list are kept, and the gaps between them are filled with the largest
     * networks that fit. See {@link IPv4NetFiller}.
     */
    public List<IPv4Net> fill(List<?> list) {
        return IPv4NetFiller.DEFAULT.fill(this, list);
    }

    /**
     * Networks between limit and this network, in ascending order. The
     * first one starts at limit or above.
     */
    List<IPv4Net> backfill(long limit) {
        List<IPv4Net> nets = new ArrayList<>();
        IPv4Net cur = this;
        while (true) {
            Optional<IPv4Net> prev = cur.prev();
            if (!prev.isPresent() || prev.get().base.toLong() < limit)
                break;
            nets.add(prev.get());
            cur = prev.get();
        }
        Collections.reverse(nets);
        return nets;
    }

    /**
     * Networks between this network and limit, exclusive. A network that
     * would reach past limit is narrowed until it ends before it.
     */
    List<IPv4Net> fwdfill(long limit) {
        List<IPv4Net> nets = new ArrayList<>();
        IPv4Net cur = this;
        while (true) {
            Optional<IPv4Net> next = cur.next();
            if (!next.isPresent() || next.get().base.toLong() >= limit)
                break;
            IPv4Net net = next.get();
            while (net.base.toLong() + net.size() > limit)
                net = net.resize(net.mask.prefixLen() + 1);
            nets.add(net);
            cur = net;
        }
        return nets;
    }

    private long size() {
        return 1L << (32 - mask.prefixLen());
    }

    @JsonValue
    @Override
    public String toString() {
        if (string == null)
            string = base.toString() + mask.toString();
        return string;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IPv4Net)) return false;

        IPv4Net that = (IPv4Net) o;
        return base.equals(that.base) && mask.equals(that.mask);
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + mask.hashCode();
    }
}
