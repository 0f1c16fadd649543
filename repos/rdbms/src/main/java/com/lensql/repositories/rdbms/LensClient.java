package com.lensql.repositories.rdbms;

import com.lensql.core.Row;
import com.lensql.core.config.ClientConfig;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.where.ConditionResolver;
import com.lensql.repositories.rdbms.fetch.CompositeRegistry;
import com.lensql.repositories.rdbms.fetch.FetcherRegistry;
import com.lensql.repositories.rdbms.fetch.TableFetcher;
import com.lensql.repositories.rdbms.query.BatchQuery;
import com.lensql.repositories.rdbms.query.BatchResult;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import com.lensql.repositories.rdbms.sql.SqlParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runtime client for one database. Holds the entity registry, the fetcher registry and the executor
 * that runs query futures. Close it to stop the executor; the data source belongs to the caller.
 */
public class LensClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LensClient.class);

    private final QueryContext context;
    private final ExecutorService executor;

    public LensClient(DataSource dataSource, Dialect dialect, EntityRegistry entities) {
        this(dataSource, dialect, entities, ClientConfig.defaults());
    }

    public LensClient(DataSource dataSource, Dialect dialect, EntityRegistry entities, ClientConfig config) {
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.threads(), runnable -> {
            Thread thread = new Thread(runnable, "lensql-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        FetcherRegistry fetchers = new FetcherRegistry();
        ColumnCodec codec = new ColumnCodec(dialect, config.converters());
        this.context = new QueryContext(
                entities,
                new CompositeRegistry(entities, fetchers),
                dialect,
                codec,
                new ConditionResolver(entities),
                new StatementExecutor(dialect),
                new TransactionManager(dataSource),
                executor);

        if (config.registerTableFetchers()) {
            for (EntityMetadata entity : entities.entities()) {
                fetchers.register(entity.name(), new TableFetcher(context, entity));
            }
        }
        logger.info("Created {} client for {} entities", dialect.name(), entities.entities().size());
    }

    public EntityClient entity(String name) {
        return new EntityClient(context, context.entities().require(name));
    }

    public FetcherRegistry fetchers() {
        return context.registry().fetchers();
    }

    public CompositeRegistry registry() {
        return context.registry();
    }

    public QueryContext context() {
        return context;
    }

    /**
     * Runs {@code work} in one transaction on the client's executor. Builders passed the transaction
     * through {@code execIn} commit or roll back together.
     */
    public <T> CompletableFuture<T> transaction(Function<Transaction, T> work) {
        return CompletableFuture.supplyAsync(() -> context.transactions().inTransaction(work), executor);
    }

    /**
     * Executes the writes in order in one transaction. The first failure rolls back all of them.
     */
    public CompletableFuture<List<BatchResult>> batch(List<BatchQuery> queries) {
        List<BatchQuery> ordered = List.copyOf(queries);
        return transaction(tx -> {
            List<BatchResult> results = new ArrayList<>();
            for (BatchQuery query : ordered) {
                results.add(query.execIn(tx));
            }
            logger.debug("Batch of {} writes executed", results.size());
            return results;
        });
    }

    /**
     * Runs a native query. Rows are keyed by column label with the driver's own value types.
     */
    public CompletableFuture<List<Row>> queryRaw(String sql, Object... params) {
        SqlFragment statement = raw(sql, params);
        return CompletableFuture.supplyAsync(() -> context.transactions().withConnection(tx ->
                context.statements().query(tx, statement, rs -> context.codec().readRaw(rs))), executor);
    }

    /**
     * Runs a native statement and returns the affected row count.
     */
    public CompletableFuture<Long> executeRaw(String sql, Object... params) {
        SqlFragment statement = raw(sql, params);
        return CompletableFuture.supplyAsync(() -> context.transactions().inTransaction(tx ->
                context.statements().update(tx, statement)), executor);
    }

    private SqlFragment raw(String sql, Object... params) {
        List<SqlParam> bound = new ArrayList<>();
        for (Object param : params) {
            bound.add(context.codec().param(param));
        }
        return new SqlFragment(sql, bound);
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
