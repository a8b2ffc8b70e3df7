package com.cymonides.grid.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Maps the {@code grid.*} configuration properties. Every property has a default so an
 * application only needs {@code quarkus.mongodb.connection-string} to start.
 */
@StaticInitSafe
@ConfigMapping(prefix = "grid")
public interface GridConfig {

    Store store();

    View view();

    Mutation mutation();

    Operators operators();

    interface Store {
        /**
         * Database holding one node collection per project.
         * @return the database name
         */
        @WithDefault("cymonides")
        String database();

        /**
         * Prepended to the project id to form the collection name.
         * @return the collection prefix
         */
        @WithDefault("cymonides-1-")
        String collectionPrefix();
    }

    interface View {
        @WithDefault("2000")
        int maxPageSize();

        @WithDefault("1000")
        int defaultLimit();
    }

    interface Mutation {
        /**
         * How many times the second side of an edge pair is attempted before the first side
         * is rolled back.
         * @return attempt count, at least 1
         */
        @WithDefault("2")
        int pairWriteAttempts();
    }

    interface Operators {
        /**
         * Classpath resource of the operator registry, JSON or YAML by extension.
         * @return the resource path
         */
        @WithDefault("/operators.json")
        String resource();
    }
}
