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
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.netaddr.util.collection.ListUtil;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Operations on lists of {@link IPv4Net}.
 */
public class IPv4Nets {

    /**
     * The members of the list that are networks, in their original order.
     */
    public static List<IPv4Net> filter(List<?> list) {
        checkNotNull(list, "list");
        return ListUtil.filterType(list, IPv4Net.class);
    }

    /**
     * A sorted copy of the list. The sort is stable.
     */
    public static List<IPv4Net> sort(List<IPv4Net> list) {
        List<IPv4Net> sorted = new ArrayList<>(list);
        Collections.sort(sorted);
        return sorted;
    }

    /**
     * Removes the networks contained in another member of the list. Of
     * several equal networks only the first one is kept. The remaining
     * networks keep their relative order.
     */
    public static List<IPv4Net> discardSubnets(List<IPv4Net> list) {
        List<IPv4Net> keepers = new ArrayList<>(list.size());
        outer:
        for (IPv4Net net : list) {
            Iterator<IPv4Net> it = keepers.iterator();
            while (it.hasNext()) {
                Relation rel = it.next().relationship(net);
                if (rel == Relation.SUPERNET || rel == Relation.EQUAL)
                    continue outer;
                if (rel == Relation.SUBNET)
                    it.remove();
            }
            keepers.add(net);
        }
        return keepers;
    }

    /**
     * Summarizes the networks of the list into as few networks as possible
     * by repeatedly merging sibling pairs. Members that are not networks
     * and networks contained in another member are dropped first. The
     * result is sorted.
     */
    public static List<IPv4Net> summarize(List<?> list) {
        List<IPv4Net> nets = sort(discardSubnets(filter(list)));
        while (true) {
            List<IPv4Net> merged = new ArrayList<>(nets.size());
            boolean changed = false;
            for (int i = 0; i < nets.size(); i++) {
                IPv4Net net = nets.get(i);
                if (i + 1 < nets.size()) {
                    Optional<IPv4Net> summ = net.summarize(nets.get(i + 1));
                    if (summ.isPresent()) {
                        merged.add(summ.get());
                        changed = true;
                        i++;
                        continue;
                    }
                }
                merged.add(net);
            }
            if (!changed)
                return merged;
            nets = sort(discardSubnets(merged));
        }
    }

    /**
     * The longest prefix length whose networks hold at least size
     * addresses.
     *
     * @throws ValidationException if size is not in [1, 2^32]
     */
    public static int prefixLenForSize(long size) {
        if (size < 1 || size > Unsigned.UINT32_RANGE)
            throw new ValidationException(
                "Network size must be in [1, 2^32] but was " + size + ".");
        int prefixLen = IPv4Mask.MAX_PREFIX_LEN;
        while ((1L << (32 - prefixLen)) < size)
            prefixLen--;
        return prefixLen;
    }
}
