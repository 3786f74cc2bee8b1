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

package io.switchback.server.routing;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Pattern;

import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.switchback.testutils.category.UnitTest;

@Category(UnitTest.class)
public class RegexRouteTestCase {

    @Test
    public void testNumberedGroups() {
        RegexRoute route = new RegexRoute("~/cats/([0-9]+)/toys/([a-z]+)~");
        Map<String, String> variables = route.match("/cats/12/toys/ball").getPathVariables();
        Assert.assertEquals(2, variables.size());
        Assert.assertEquals("12", variables.get("1"));
        Assert.assertEquals("ball", variables.get("2"));
    }

    @Test
    public void testNamedGroupsAreAlsoNumbered() {
        RegexRoute route = new RegexRoute("~/cats/(?<id>[0-9]+)~");
        Assert.assertEquals(Collections.singletonList("id"), route.getGroupNames());
        Map<String, String> variables = route.match("/cats/12").getPathVariables();
        Assert.assertEquals("12", variables.get("id"));
        Assert.assertEquals("12", variables.get("1"));
    }

    @Test
    public void testUnmatchedOptionalGroupIsLeftOut() {
        RegexRoute route = new RegexRoute("~/cats(/(?<id>[0-9]+))?~");
        Map<String, String> variables = route.match("/cats").getPathVariables();
        Assert.assertTrue(variables.isEmpty());
        Assert.assertEquals("7", route.match("/cats/7").getPathVariables().get("id"));
    }

    @Test
    public void testWholePathMustMatch() {
        RegexRoute route = new RegexRoute("~/cats/[0-9]+~");
        Assert.assertTrue(route.match("/cats/12").isMatched());
        Assert.assertFalse(route.match("/cats/12/toys").isMatched());
        Assert.assertFalse(route.match("/pets/cats/12").isMatched());
    }

    @Test
    public void testAnchorsAreAccepted() {
        RegexRoute route = new RegexRoute("#^/cats/(\\d+)$#");
        Assert.assertTrue(route.match("/cats/3").isMatched());
        Assert.assertFalse(route.match("/cats/x").isMatched());
    }

    @Test
    public void testModifiers() {
        RegexRoute route = new RegexRoute("~/cats/[a-z]+~i");
        Assert.assertTrue(route.match("/CATS/Molly").isMatched());
        Assert.assertTrue((route.getPattern().flags() & Pattern.CASE_INSENSITIVE) != 0);

        route = new RegexRoute("~/cats/ [a-z]+ # name~x");
        Assert.assertTrue(route.match("/cats/molly").isMatched());
    }

    @Test
    public void testGroupSyntaxInCommentIsIgnored() {
        RegexRoute route = new RegexRoute("~/cats/([0-9]+) # not a group: (?<name>x)~x");
        Assert.assertTrue(route.getGroupNames().isEmpty());
        Map<String, String> variables = route.match("/cats/1").getPathVariables();
        Assert.assertEquals(Collections.singletonMap("1", "1"), variables);
    }

    @Test
    public void testBracketDelimiters() {
        Assert.assertTrue(new RegexRoute("(/cats/[0-9]+)").match("/cats/1").isMatched());
        Assert.assertTrue(new RegexRoute("[/cats/[0-9]+]").match("/cats/1").isMatched());
        Assert.assertTrue(new RegexRoute("</cats/[0-9]+>").match("/cats/1").isMatched());
    }

    @Test
    public void testIsRegexTarget() {
        Assert.assertTrue(RegexRoute.isRegexTarget("~/cats~"));
        Assert.assertTrue(RegexRoute.isRegexTarget("@/cats@iu"));
        Assert.assertFalse(RegexRoute.isRegexTarget("/cats/"));
        Assert.assertFalse(RegexRoute.isRegexTarget("cats"));
        Assert.assertFalse(RegexRoute.isRegexTarget("~"));
        Assert.assertFalse(RegexRoute.isRegexTarget("~/cats"));
        Assert.assertFalse(RegexRoute.isRegexTarget("*/cats*"));
        Assert.assertFalse(RegexRoute.isRegexTarget("{/cats}"));
        Assert.assertFalse(RegexRoute.isRegexTarget("~/cats~1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedModifier() {
        new RegexRoute("~/cats~q");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidExpression() {
        new RegexRoute("~/cats/([0-9]+~");
    }

    @Test
    public void testFindGroupNames() {
        Assert.assertEquals(Arrays.asList("a", "b"), RegexRoute.findGroupNames("(?<a>x)(?:y)(?<b>z)", 0));
        Assert.assertEquals(Collections.singletonList("b"), RegexRoute.findGroupNames("\\(?<a>x)(?<b>z)", 0));
        Assert.assertEquals(Collections.emptyList(), RegexRoute.findGroupNames("[(?<a>x)]", 0));
        Assert.assertEquals(Collections.emptyList(), RegexRoute.findGroupNames("\\Q(?<a>x)\\E(?<=y)", 0));
    }

    @Test
    public void testFindGroupNamesWithComments() {
        String regex = "(?<a>x) # (?<b>y)\n(?<c>z)";
        Assert.assertEquals(Arrays.asList("a", "b", "c"), RegexRoute.findGroupNames(regex, 0));
        Assert.assertEquals(Arrays.asList("a", "c"), RegexRoute.findGroupNames(regex, Pattern.COMMENTS));
        Assert.assertEquals(Collections.singletonList("a"), RegexRoute.findGroupNames("\\#(?<a>x)", Pattern.COMMENTS));
        Assert.assertEquals(Collections.singletonList("a"), RegexRoute.findGroupNames("(?<a>x)#(?<b>y)", Pattern.COMMENTS));
    }
}
