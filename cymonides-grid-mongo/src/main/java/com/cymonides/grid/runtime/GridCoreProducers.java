package com.cymonides.grid.runtime;

import com.cymonides.grid.config.GridConfig;
import com.cymonides.grid.exec.GridExecutor;
import com.cymonides.grid.mongo.MongoNodeStore;
import com.cymonides.grid.mutation.GraphMutator;
import com.cymonides.grid.operators.OperatorRegistry;
import com.cymonides.grid.operators.OperatorRegistryLoader;
import com.cymonides.grid.store.NodeStore;
import com.cymonides.grid.syntax.GridSyntaxParser;
import com.cymonides.grid.view.CellSelector;
import com.cymonides.grid.view.RowMapper;
import com.cymonides.grid.view.ViewComposer;
import com.mongodb.client.MongoClient;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

/**
 * Wires the store-neutral grid core to Mongo. Every bean is a {@link DefaultBean} so an
 * application can replace any single piece, most commonly the {@link NodeStore}.
 */
@ApplicationScoped
public class GridCoreProducers {

    @Inject
    MongoClient mongoClient;

    @Inject
    GridConfig config;

    @Produces
    @DefaultBean
    @Singleton
    public NodeStore nodeStore() {
        Log.infof("GridCoreProducers: node store on database %s, collection prefix %s",
                config.store().database(), config.store().collectionPrefix());
        return new MongoNodeStore(mongoClient, config.store().database(), config.store().collectionPrefix());
    }

    @Produces
    @DefaultBean
    @Singleton
    public Clock gridClock() {
        return Clock.systemUTC();
    }

    @Produces
    @DefaultBean
    @Singleton
    public GridSyntaxParser gridSyntaxParser() {
        return new GridSyntaxParser();
    }

    @Produces
    @DefaultBean
    @Singleton
    public ViewComposer viewComposer(NodeStore store) {
        return new ViewComposer(store, config.view().maxPageSize(), config.view().defaultLimit());
    }

    @Produces
    @DefaultBean
    @Singleton
    public RowMapper rowMapper(Clock clock) {
        return new RowMapper(clock);
    }

    @Produces
    @DefaultBean
    @Singleton
    public CellSelector cellSelector() {
        return new CellSelector();
    }

    @Produces
    @DefaultBean
    @Singleton
    public GraphMutator graphMutator(NodeStore store, Clock clock) {
        return new GraphMutator(store, clock, config.mutation().pairWriteAttempts());
    }

    @Produces
    @DefaultBean
    @Singleton
    public GridExecutor gridExecutor(GridSyntaxParser parser,
                                     ViewComposer composer,
                                     RowMapper rowMapper,
                                     CellSelector selector,
                                     GraphMutator mutator,
                                     NodeStore store) {
        return new GridExecutor(parser, composer, rowMapper, selector, mutator, store,
                config.view().defaultLimit());
    }

    @Produces
    @DefaultBean
    @Singleton
    public OperatorRegistry operatorRegistry() {
        String resource = config.operators().resource();
        try {
            OperatorRegistry registry = new OperatorRegistryLoader().loadFromClasspath(resource);
            Log.infof("GridCoreProducers: %d operators registered from %s", registry.total(), resource);
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read operator registry " + resource, e);
        }
    }
}
