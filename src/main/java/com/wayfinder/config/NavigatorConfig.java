package com.wayfinder.config;

import com.wayfinder.tree.PopBehavior;

import java.util.Objects;

/**
 * Settings of a {@code Navigator}.
 *
 * @param defaultPopBehavior empty-stack policy of plain pops
 * @param compactLayout whether one pane is visible at a time
 * @param keyLength length of generated node keys
 * @param validateOnUpdate validate every new tree before publishing it
 * @param maxDepth deepest container nesting accepted by validation
 * @param maxNodeCount largest tree accepted by validation
 */
public record NavigatorConfig(
    PopBehavior defaultPopBehavior,
    boolean compactLayout,
    int keyLength,
    boolean validateOnUpdate,
    int maxDepth,
    int maxNodeCount
) {

    public static final int MIN_KEY_LENGTH = 4;
    public static final int MAX_KEY_LENGTH = 32;

    public NavigatorConfig {
        Objects.requireNonNull(defaultPopBehavior, "Default pop behavior cannot be null");
        if (keyLength < MIN_KEY_LENGTH || keyLength > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Key length must be between %d and %d, got %d", MIN_KEY_LENGTH, MAX_KEY_LENGTH, keyLength)
            );
        }
        if (maxDepth < 1 || maxNodeCount < 1) {
            throw new IllegalArgumentException("Validation limits must be positive");
        }
    }

    /**
     * Configuration with every field at its default.
     */
    public static NavigatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder starting from the defaults.
     */
    public static class Builder {
        private PopBehavior defaultPopBehavior = PopBehavior.PRESERVE_EMPTY;
        private boolean compactLayout = true;
        private int keyLength = 8;
        private boolean validateOnUpdate = false;
        private int maxDepth = 64;
        private int maxNodeCount = 10_000;

        public Builder defaultPopBehavior(PopBehavior defaultPopBehavior) {
            this.defaultPopBehavior = defaultPopBehavior;
            return this;
        }

        public Builder compactLayout(boolean compactLayout) {
            this.compactLayout = compactLayout;
            return this;
        }

        public Builder keyLength(int keyLength) {
            this.keyLength = keyLength;
            return this;
        }

        public Builder validateOnUpdate(boolean validateOnUpdate) {
            this.validateOnUpdate = validateOnUpdate;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxNodeCount(int maxNodeCount) {
            this.maxNodeCount = maxNodeCount;
            return this;
        }

        public NavigatorConfig build() {
            return new NavigatorConfig(defaultPopBehavior, compactLayout, keyLength,
                validateOnUpdate, maxDepth, maxNodeCount);
        }
    }
}
