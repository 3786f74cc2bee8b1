/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2024 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.switchback.util;

import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.switchback.testutils.category.UnitTest;

@Category(UnitTest.class)
public class HttpStringTestCase {

    @Test
    public void testEqualsIgnoresCase() {
        Assert.assertEquals(new HttpString("Content-Length"), new HttpString("content-length"));
        Assert.assertEquals(new HttpString("Content-Length").hashCode(), new HttpString("CONTENT-LENGTH").hashCode());
        Assert.assertNotEquals(new HttpString("Content-Length"), new HttpString("Content-Type"));
        Assert.assertEquals(Methods.GET, new HttpString("get"));
        Assert.assertNotEquals(new HttpString("Accept"), "Accept");
    }

    @Test
    public void testToUpperCase() {
        Assert.assertSame(Methods.GET, Methods.GET.toUpperCase());
        Assert.assertEquals("PATCH", new HttpString("patch").toUpperCase().toString());
        Assert.assertEquals("patch", new HttpString("patch").toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNewlineRejected() {
        new HttpString("X-Header\r\nInjected: true");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonLatin1Rejected() {
        new HttpString("X-\u0394");
    }

    @Test
    public void testLatin1IsKeptAsGiven() {
        HttpString value = new HttpString("X-Caf\u00e9");
        Assert.assertEquals("X-Caf\u00e9", value.toString());
        Assert.assertEquals("X-CAF\u00e9", value.toUpperCase().toString());
    }

    @Test
    public void testValidMethods() {
        Assert.assertTrue(Methods.isValidMethod("GET"));
        Assert.assertTrue(Methods.isValidMethod("PROPFIND"));
        Assert.assertTrue(Methods.isValidMethod("X-CUSTOM"));
        Assert.assertFalse(Methods.isValidMethod(""));
        Assert.assertFalse(Methods.isValidMethod("GET POST"));
        Assert.assertFalse(Methods.isValidMethod("GET/1"));
    }

    @Test
    public void testContainsToken() {
        Assert.assertTrue(Headers.containsToken("gzip, Chunked", Headers.CHUNKED));
        Assert.assertFalse(Headers.containsToken("gzip", Headers.CHUNKED));
        Assert.assertFalse(Headers.containsToken(null, Headers.CHUNKED));
    }
}
