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

import java.util.Arrays;
import java.util.List;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;

import static junitparams.JUnitParamsRunner.$;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

@RunWith(JUnitParamsRunner.class)
public class TestIPv4Nets {

    private static IPv4Net net(String cidr) {
        return IPv4Net.parse(cidr);
    }

    @Test
    public void testFilter() {
        List<Object> list = Arrays.<Object>asList(
            "10.0.0.0/8", net("10.0.0.0/8"), null, 5, net("192.168.0.0/16"));
        assertThat(IPv4Nets.filter(list),
                   contains(net("10.0.0.0/8"), net("192.168.0.0/16")));
    }

    @Test
    public void testSortKeepsInputUntouched() {
        List<IPv4Net> list = Arrays.asList(net("10.0.1.0/24"),
                                           net("10.0.0.0/24"));
        assertThat(IPv4Nets.sort(list),
                   contains(net("10.0.0.0/24"), net("10.0.1.0/24")));
        assertThat(list, contains(net("10.0.1.0/24"), net("10.0.0.0/24")));
    }

    @Test
    public void testDiscardSubnets() {
        List<IPv4Net> list = Arrays.asList(
            net("10.0.0.0/26"), net("10.0.0.0/24"), net("192.168.0.0/16"),
            net("10.0.0.0/24"), net("192.168.1.0/24"), net("172.16.0.0/12"));
        assertThat(IPv4Nets.discardSubnets(list),
                   contains(net("10.0.0.0/24"), net("192.168.0.0/16"),
                            net("172.16.0.0/12")));
    }

    @Test
    public void testDiscardSubnetsOfEmptyList() {
        assertThat(IPv4Nets.discardSubnets(Arrays.<IPv4Net>asList()), empty());
    }

    @Test
    public void testSummarize() {
        List<Object> list = Arrays.<Object>asList(
            net("10.0.0.0/24"), net("10.0.1.0/24"), net("10.0.2.0/23"), "x",
            net("10.0.0.128/25"));
        assertThat(IPv4Nets.summarize(list), contains(net("10.0.0.0/22")));
    }

    @Test
    public void testSummarizeOnlySiblings() {
        List<IPv4Net> list = Arrays.asList(
            net("10.0.3.0/24"), net("10.0.1.0/24"), net("10.0.2.0/24"));
        assertThat(IPv4Nets.summarize(list),
                   contains(net("10.0.1.0/24"), net("10.0.2.0/23")));

        assertThat(IPv4Nets.summarize(Arrays.asList(net("10.0.1.0/24"),
                                                    net("10.0.2.0/24"))),
                   contains(net("10.0.1.0/24"), net("10.0.2.0/24")));
    }

    @Test
    public void testSummarizeToWholeSpace() {
        List<IPv4Net> list = Arrays.asList(
            net("128.0.0.0/2"), net("0.0.0.0/1"), net("192.0.0.0/2"));
        assertThat(IPv4Nets.summarize(list), contains(net("0.0.0.0/0")));
    }

    @Test
    @Parameters(source = TestIPv4Nets.class, method = "sizes")
    public void testPrefixLenForSize(long size, int expected) {
        Assert.assertEquals(expected, IPv4Nets.prefixLenForSize(size));
    }

    @Test(expected = ValidationException.class)
    public void testPrefixLenForZeroSize() {
        IPv4Nets.prefixLenForSize(0);
    }

    @Test(expected = ValidationException.class)
    public void testPrefixLenForOversize() {
        IPv4Nets.prefixLenForSize((1L << 32) + 1);
    }

    public static Object[] sizes() {
        return $(
                $(1L, 32),
                $(2L, 31),
                $(3L, 30),
                $(4L, 30),
                $(256L, 24),
                $(257L, 23),
                $(1L << 31, 1),
                $(1L << 32, 0)
        );
    }
}
