package com.sitewalker.core.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class StrategyTest {

    @ParameterizedTest
    @ValueSource(strings = {"depth-first", "DFS", "Depth_First", " depth first "})
    void resolvesDepthFirstAliases(String name) {
        assertEquals(Strategy.DEPTH_FIRST, Strategy.resolve(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"breadth-first", "bfs", "BREADTH_FIRST"})
    void resolvesBreadthFirstAliases(String name) {
        assertEquals(Strategy.BREADTH_FIRST, Strategy.resolve(name));
    }

    @Test
    @DisplayName("null/blank → 기본(breadth-first)")
    void blankFallsBackToDefault() {
        assertSame(Strategy.DEFAULT, Strategy.resolve(null));
        assertSame(Strategy.DEFAULT, Strategy.resolve("  "));
        assertEquals(Strategy.BREADTH_FIRST, Strategy.DEFAULT);
    }

    @Test
    void unknownNameThrows() {
        UnknownStrategyException e = assertThrows(UnknownStrategyException.class, () -> Strategy.resolve("XYZ"));
        assertEquals("XYZ", e.getName());
        assertInstanceOf(IllegalArgumentException.class, e);
    }

    @Test
    void pushDirection() {
        URI a = URI.create("https://ex.com/a");
        URI b = URI.create("https://ex.com/b");

        Frontier stack = new Frontier();
        Strategy.DEPTH_FIRST.push(stack, a);
        Strategy.DEPTH_FIRST.push(stack, b);
        assertEquals(b, stack.pop().orElseThrow());

        Frontier queue = new Frontier();
        Strategy.BREADTH_FIRST.push(queue, a);
        Strategy.BREADTH_FIRST.push(queue, b);
        assertEquals(a, queue.pop().orElseThrow());
    }

    @Test
    void labels() {
        assertEquals("depth-first", Strategy.DEPTH_FIRST.label());
        assertEquals("breadth-first", Strategy.BREADTH_FIRST.label());
    }
}
