/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.gorgon.workflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parameter template resolution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-03
 */
class VariableResolverTest {

    private VariableResolver resolver;

    @BeforeEach
    void setUp() {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("repo", "gorgon");
        variables.put("count", 3);
        variables.put("files", List.of("a.txt", "b.txt"));
        variables.put("review", Map.of("summary", "looks good", "score", 8));
        variables.put("nothing", null);
        resolver = new VariableResolver(variables);
    }

    @Test
    void testDollarBraceSyntax() {
        assertEquals("repo is gorgon", resolver.resolveString("repo is ${repo}"));
    }

    @Test
    void testDoubleBraceSyntax() {
        assertEquals("gorgon/3", resolver.resolveString("{{repo}}/{{ count }}"));
    }

    @Test
    void testWholeStringReferenceKeepsType() {
        assertEquals(List.of("a.txt", "b.txt"), resolver.resolve("${files}"));
        assertEquals(3, resolver.resolve("{{count}}"));
    }

    @Test
    void testDottedPathIntoMapsAndLists() {
        assertEquals("looks good", resolver.resolve("${review.summary}"));
        assertEquals("b.txt", resolver.resolve("${files.1}"));
        assertEquals("score=8", resolver.resolveString("score=${review.score}"));
    }

    @Test
    void testNestedParamsResolved() {
        Map<String, Object> params = Map.of(
                "command", "git log ${repo}",
                "args", List.of("${count}", "plain"),
                "env", Map.of("REPO", "${repo}"));

        Map<String, Object> resolved = resolver.resolveParams(params);

        assertEquals("git log gorgon", resolved.get("command"));
        assertEquals(List.of(3, "plain"), resolved.get("args"));
        assertEquals(Map.of("REPO", "gorgon"), resolved.get("env"));
    }

    @Test
    void testNonStringValuesUnchanged() {
        assertEquals(42, resolver.resolve(42));
        assertEquals(Boolean.TRUE, resolver.resolve(true));
        assertNull(resolver.resolve(null));
    }

    @Test
    void testBoundNullInterpolatesAsEmpty() {
        assertEquals("[]", resolver.resolveString("[${nothing}]"));
        assertNull(resolver.resolve("${nothing}"));
    }

    @Test
    void testUnboundReferenceFailsNamingEveryVariable() {
        TemplateResolutionException e = assertThrows(TemplateResolutionException.class,
                () -> resolver.resolveParams(Map.of("text", "${missing} and {{other}}")));

        assertEquals(List.of("missing", "other"), e.getUnresolved());
    }

    @Test
    void testOptionalVariableResolvesToEmpty() {
        VariableResolver lenient = new VariableResolver(Map.of("repo", "gorgon"), Set.of("branch"));

        assertEquals("gorgon@", lenient.resolveString("${repo}@${branch}"));
        assertNull(lenient.resolve("${branch}"));
        assertNull(lenient.resolve("${branch.name}"));
    }

    @Test
    void testNoVariables() {
        assertEquals("plain text", resolver.resolveString("plain text"));
        assertFalse(resolver.hasVariables("plain text"));
        assertTrue(resolver.hasVariables("${repo}"));
    }

    @Test
    void testGetVariableNames() {
        assertEquals(Set.of("a", "b.c"), VariableResolver.getVariableNames("${a} {{ b.c }} ${a}"));
        assertTrue(VariableResolver.getVariableNames(null).isEmpty());
    }

    @Test
    void testLookupPrefersExactKey() {
        Map<String, Object> variables = Map.of("a.b", "flat", "a", Map.of("b", "nested"));

        assertEquals("flat", VariableResolver.lookup(variables, "a.b").orElse(null));
    }

    @Test
    void testLookupOutOfRangeIndex() {
        assertTrue(VariableResolver.lookup(Map.of("files", List.of("x")), "files.5").isEmpty());
        assertTrue(VariableResolver.lookup(Map.of("files", List.of("x")), "files.first").isEmpty());
    }
}
