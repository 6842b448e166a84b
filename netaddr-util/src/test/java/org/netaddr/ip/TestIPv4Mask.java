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

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;

import static junitparams.JUnitParamsRunner.$;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

@RunWith(JUnitParamsRunner.class)
public class TestIPv4Mask {

    @Test
    @Parameters(source = TestIPv4Mask.class, method = "masks")
    public void testMaskValues(int prefixLen, int mask, long len,
                               String extended) {
        IPv4Mask m = IPv4Mask.of(prefixLen);
        Assert.assertEquals(prefixLen, m.prefixLen());
        Assert.assertEquals(mask, m.mask());
        Assert.assertEquals(~mask, m.hostmask());
        Assert.assertEquals(len, m.len());
        Assert.assertEquals(extended, m.extended());
        Assert.assertEquals("/" + prefixLen, m.toString());
    }

    @Test
    @Parameters(source = TestIPv4Mask.class, method = "masks")
    public void testParseForms(int prefixLen, int mask, long len,
                               String extended) {
        IPv4Mask m = IPv4Mask.of(prefixLen);
        assertThat(IPv4Mask.parse(Integer.toString(prefixLen)), is(m));
        assertThat(IPv4Mask.parse("/" + prefixLen), is(m));
        assertThat(IPv4Mask.parse(extended), is(m));
        assertThat(IPv4Mask.parse(" " + extended + " "), is(m));
    }

    @Test(expected = ValidationException.class)
    @Parameters(source = TestIPv4Mask.class, method = "invalidMasks")
    public void testInvalidMasks(String input) {
        IPv4Mask.parse(input);
    }

    @Test(expected = ValidationException.class)
    public void testNegativePrefixLen() {
        IPv4Mask.of(-1);
    }

    @Test(expected = ValidationException.class)
    public void testPrefixLenTooLong() {
        IPv4Mask.of(33);
    }

    @Test
    public void testOrderingByCapacity() {
        assertThat(IPv4Mask.of(8).compareTo(IPv4Mask.of(24)), greaterThan(0));
        assertThat(IPv4Mask.of(24).compareTo(IPv4Mask.of(8)), lessThan(0));
        assertThat(IPv4Mask.of(16).compareTo(IPv4Mask.parse("255.255.0.0")),
                   is(0));
    }

    public static Object[] masks() {
        return $(
                $(0, 0, 0L, "0.0.0.0"),
                $(1, 0x80000000, 2147483648L, "128.0.0.0"),
                $(8, 0xff000000, 16777216L, "255.0.0.0"),
                $(23, 0xfffffe00, 512L, "255.255.254.0"),
                $(24, 0xffffff00, 256L, "255.255.255.0"),
                $(31, 0xfffffffe, 2L, "255.255.255.254"),
                $(32, 0xffffffff, 1L, "255.255.255.255")
        );
    }

    public static Object[] invalidMasks() {
        return $(
                $(""),
                $("/"),
                $("33"),
                $("/33"),
                $("-1"),
                $("+8"),
                $("100"),
                $("abc"),
                $("255.0.255.0"),
                $("0.255.255.255"),
                $("255.255.255"),
                $("255.255.255.256"),
                $("\u0662\u0664"),
                $("/\u0668"),
                $("\u0662\u0665\u0665.255.255.0")
        );
    }
}
