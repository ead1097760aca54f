package com.e2eq.composite.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Maps the {@code quantum.composite} configuration properties.
 */
@ConfigMapping(prefix = "quantum.composite")
public interface CompositeConfig {

    /**
     * Deepest nesting of referenced documents expanded in one resolution.
     * @return the maximum depth
     */
    @WithDefault("32")
    int maxDepth();

    /**
     * Total referenced documents expanded in one resolution.
     * @return the expansion budget
     */
    @WithDefault("1000")
    int maxExpansions();

    Context context();

    Store store();

    interface Context {
        /**
         * Approximate token budget of an assembled prompt context.
         * @return the token budget
         */
        @WithDefault("100000")
        int maxTokens();

        /**
         * Maximum number of related documents added to a prompt context.
         * @return the related document limit
         */
        @WithDefault("5")
        int relatedLimit();
    }

    interface Store {
        /**
         * Classpath JSON resource loaded into the default in-memory store at startup.
         * @return the seed resource, if any
         */
        Optional<String> seed();
    }
}
