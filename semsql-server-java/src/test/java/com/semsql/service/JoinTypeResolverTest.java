package com.semsql.service;

import com.semsql.model.DimensionUsage;
import com.semsql.model.JoinKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JoinTypeResolverTest {

    private final JoinTypeResolver resolver = new JoinTypeResolver();

    @Test
    void shouldResolveFilterToInnerRegardlessOfOptionality() {
        assertEquals(JoinKind.INNER, resolver.resolve(DimensionUsage.FILTER, true));
        assertEquals(JoinKind.INNER, resolver.resolve(DimensionUsage.FILTER, false));
    }

    @Test
    void shouldResolveSelectByOptionality() {
        assertEquals(JoinKind.LEFT, resolver.resolve(DimensionUsage.SELECT, true));
        assertEquals(JoinKind.INNER, resolver.resolve(DimensionUsage.SELECT, false));
    }

    @Test
    void shouldLetFilteringWinForBoth() {
        assertEquals(JoinKind.INNER, resolver.resolve(DimensionUsage.BOTH, true));
        assertEquals(JoinKind.INNER, resolver.resolve(DimensionUsage.BOTH, false));
    }

    @Test
    void shouldFallBackToLeftForUnrecognizedUsage() {
        assertEquals(JoinKind.LEFT, resolver.resolve((DimensionUsage) null, false));
        assertEquals(JoinKind.LEFT, resolver.resolve("group", false));
        assertEquals(JoinKind.LEFT, resolver.resolve("", true));
        assertEquals(JoinKind.LEFT, resolver.resolve((String) null, false));
    }

    @Test
    void shouldParseRawUsageCaseInsensitively() {
        assertEquals(JoinKind.INNER, resolver.resolve("FILTER", true));
        assertEquals(JoinKind.INNER, resolver.resolve(" Both ", true));
        assertEquals(JoinKind.LEFT, resolver.resolve("select", true));
    }

    @Test
    void shouldExplainDecision() {
        assertTrue(resolver.explain(DimensionUsage.BOTH, true).startsWith("INNER"));
        assertTrue(resolver.explain(DimensionUsage.SELECT, true).contains("optional"));
        assertTrue(resolver.explain(null, false).contains("unrecognized"));
    }
}
