package com.wayfinder.tree;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Factories for the key generators passed to tree operations.
 * 
 * Each generator owns its own state, so two navigators never share a counter.
 */
public final class KeyGenerators {
    
    public static final int DEFAULT_KEY_LENGTH = 8;
    
    private KeyGenerators() {}
    
    /**
     * Random short keys of {@value #DEFAULT_KEY_LENGTH} characters.
     */
    public static Supplier<String> random() {
        return random(DEFAULT_KEY_LENGTH);
    }
    
    /**
     * Random keys cut from a UUID.
     * 
     * @param length key length, 1 to 32
     * @return the generator
     */
    public static Supplier<String> random(int length) {
        if (length < 1 || length > 32) {
            throw new IllegalArgumentException(
                String.format("Key length must be between 1 and 32, got %d", length)
            );
        }
        return () -> UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
    
    /**
     * Deterministic keys {@code prefix1, prefix2, ...}.
     * 
     * @param prefix key prefix
     * @return a generator with its own counter
     */
    public static Supplier<String> sequential(String prefix) {
        AtomicLong counter = new AtomicLong();
        return () -> prefix + counter.incrementAndGet();
    }
}
