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
public class URLUtilsTestCase {

    @Test
    public void testGetPath() {
        Assert.assertEquals("/cats", URLUtils.getPath("/cats"));
        Assert.assertEquals("/cats", URLUtils.getPath("/cats?name=molly"));
        Assert.assertEquals("/cats/", URLUtils.getPath("/cats/#top"));
        Assert.assertEquals("/", URLUtils.getPath("?a=b"));
        Assert.assertEquals("/", URLUtils.getPath(""));
        Assert.assertEquals("/", URLUtils.getPath(null));
        Assert.assertEquals("*", URLUtils.getPath("*"));
    }

    @Test
    public void testPathIsNotDecoded() {
        Assert.assertEquals("/cats/molly%20two", URLUtils.getPath("/cats/molly%20two?x=%20"));
    }

    @Test
    public void testAbsoluteForm() {
        Assert.assertEquals("/cats/12", URLUtils.getPath("http://localhost:8080/cats/12?x=1"));
        Assert.assertEquals("/", URLUtils.getPath("https://example.com"));
        Assert.assertEquals("/", URLUtils.getPath("https://example.com?/cats"));
    }

    @Test
    public void testIsAbsoluteUrl() {
        Assert.assertTrue(URLUtils.isAbsoluteUrl("http://example.com/"));
        Assert.assertTrue(URLUtils.isAbsoluteUrl("svn+ssh://example.com/"));
        Assert.assertFalse(URLUtils.isAbsoluteUrl("/http://example.com/"));
        Assert.assertFalse(URLUtils.isAbsoluteUrl("://example.com/"));
        Assert.assertFalse(URLUtils.isAbsoluteUrl("1http://example.com/"));
        Assert.assertFalse(URLUtils.isAbsoluteUrl(null));
    }
}
