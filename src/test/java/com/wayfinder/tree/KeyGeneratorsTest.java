package com.wayfinder.tree;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class KeyGeneratorsTest {

    @Test
    void testRandomKeysHaveRequestedLength() {
        Supplier<String> keys = KeyGenerators.random(12);

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String key = keys.get();
            assertEquals(12, key.length());
            assertTrue(key.matches("[0-9a-f]+"));
            seen.add(key);
        }
        assertEquals(100, seen.size());
        assertEquals(KeyGenerators.DEFAULT_KEY_LENGTH, KeyGenerators.random().get().length());
    }

    @Test
    void testRandomRejectsBadLength() {
        assertThrows(IllegalArgumentException.class, () -> KeyGenerators.random(0));
        assertThrows(IllegalArgumentException.class, () -> KeyGenerators.random(33));
    }

    @Test
    void testSequentialGeneratorsAreIndependent() {
        Supplier<String> first = KeyGenerators.sequential("a");
        Supplier<String> second = KeyGenerators.sequential("b");

        assertEquals("a1", first.get());
        assertEquals("a2", first.get());
        assertEquals("b1", second.get());
    }
}
