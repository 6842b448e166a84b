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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.netaddr.config.FillConfig;
import org.netaddr.util.collection.ListUtil;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Builds a partition of a network out of a list of candidate subnets.
 *
 * The candidates that are subnets of the network are kept as they are, all
 * other members of the list are ignored. Candidates contained in another
 * candidate are dropped so that the kept subnets do not overlap. Whatever
 * the kept subnets leave uncovered is filled with the largest networks that
 * fit the gaps. The result is sorted by address and covers the network
 * exactly.
 *
 * If no candidate is a subnet of the network the result is empty, not a
 * single block covering the whole network.
 */
public class IPv4NetFiller {

    private static final Logger log =
        LoggerFactory.getLogger(IPv4NetFiller.class);

    public static final IPv4NetFiller DEFAULT = new IPv4NetFiller(0, false);

    private final int maxBlocks;
    private final boolean strict;

    public IPv4NetFiller(FillConfig config) {
        this(config.getMaxBlocks(), config.isStrict());
    }

    /**
     * @param maxBlocks upper bound on the size of a fill result, 0 for none
     * @param strict reject candidates that are not subnets of the filled
     *               network instead of ignoring them
     */
    public IPv4NetFiller(int maxBlocks, boolean strict) {
        if (maxBlocks < 0)
            throw new ValidationException(
                "max_blocks must not be negative but was " + maxBlocks + ".");
        this.maxBlocks = maxBlocks;
        this.strict = strict;
    }

    public int getMaxBlocks() {
        return maxBlocks;
    }

    public boolean isStrict() {
        return strict;
    }

    public List<IPv4Net> fill(final IPv4Net net, List<?> candidates) {
        checkNotNull(net, "net");
        checkNotNull(candidates, "candidates");

        List<IPv4Net> nets = IPv4Nets.filter(candidates);
        if (strict) {
            if (nets.size() != candidates.size())
                throw new ValidationException(
                    "Cannot fill " + net + ": " +
                    (candidates.size() - nets.size()) +
                    " candidates are not networks.");
            for (IPv4Net sub : nets) {
                if (net.relationship(sub) != Relation.SUPERNET)
                    throw new ValidationException(
                        "Cannot fill " + net + ": " + sub + " is not a " +
                        "subnet of it.");
            }
        }
        List<IPv4Net> subs = ListUtil.filter(
            IPv4Nets.discardSubnets(nets),
            sub -> net.relationship(sub) == Relation.SUPERNET);
        subs = IPv4Nets.sort(subs);
        log.debug("Filling {} around {} subnets, {} of {} candidates ignored",
                  net, subs.size(), candidates.size() - subs.size(),
                  candidates.size());

        List<IPv4Net> filled = new ArrayList<>();
        if (subs.isEmpty())
            return filled;

        long base = net.network().toLong();
        IPv4Net first = subs.get(0);
        if (first.network().toLong() != base)
            addAll(net, filled, first.backfill(base));

        // the last subnet is filled up to the start of the next network, or
        // to the end of the address space
        Optional<IPv4Net> sib = net.nextSib();
        long ceil = sib.isPresent() ? sib.get().network().toLong()
                                    : Unsigned.UINT32_RANGE;

        for (int i = 0; i < subs.size(); i++) {
            IPv4Net sub = subs.get(i);
            long limit = i + 1 < subs.size()
                         ? subs.get(i + 1).network().toLong() : ceil;
            addAll(net, filled, Collections.singletonList(sub));
            addAll(net, filled, sub.fwdfill(limit));
        }

        if (log.isTraceEnabled())
            log.trace("Filled {}: {}", net, ListUtil.toString(filled));
        return filled;
    }

    private void addAll(IPv4Net net, List<IPv4Net> filled,
                        List<IPv4Net> blocks) {
        if (maxBlocks > 0 && filled.size() + blocks.size() > maxBlocks)
            throw new ValidationException(
                "Filling " + net + " takes more than " + maxBlocks +
                " networks.");
        filled.addAll(blocks);
    }
}
