package com.lensql.repos.certification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.lensql.core.ContractViolationException;
import com.lensql.core.Key;
import com.lensql.core.LensException;
import com.lensql.core.NotFoundException;
import com.lensql.core.QueryValidationException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.where.IncludeBuilder;
import com.lensql.core.where.JsonNullFilter;
import com.lensql.core.where.OrderBy;
import com.lensql.core.where.QueryMode;
import com.lensql.core.where.SetParam;
import com.lensql.core.where.UniqueWhere;
import com.lensql.core.where.Where;
import com.lensql.generator.analyze.SchemaCompiler;
import com.lensql.repositories.rdbms.EntityClient;
import com.lensql.repositories.rdbms.LensClient;
import com.lensql.repositories.rdbms.query.AggregateResult;
import com.lensql.repositories.rdbms.query.BatchQuery;
import com.lensql.repositories.rdbms.query.BatchResult;
import com.lensql.repositories.rdbms.query.FindManyQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.lensql.core.where.SetParam.assign;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every database backend must show, run against the blog schema (users, posts, comments).
 * Backends supply a client on a database holding nothing but the tables from {@link #ddl()}.
 */
public abstract class ClientCertification {
    protected LensClient lens;
    protected EntityClient users;
    protected EntityClient posts;
    protected EntityClient comments;

    /**
     * A client on an empty database.
     */
    protected abstract LensClient createClient(EntityRegistry registry);

    /**
     * Statements creating the users, posts and comments tables, dropping earlier ones first if
     * the database outlives a test.
     */
    protected abstract List<String> ddl();

    @BeforeEach
    public void setUp() {
        EntityRegistry registry = new SchemaCompiler()
                .compile(ClientCertification.class.getResourceAsStream("/blog-schema.json"))
                .registry();
        lens = createClient(registry);
        for (String statement : ddl()) {
            await(lens.executeRaw(statement));
        }
        users = lens.entity("User");
        posts = lens.entity("Post");
        comments = lens.entity("Comment");
    }

    @AfterEach
    public void closeClient() {
        lens.close();
    }

    protected static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    protected Row user(String email, String name, Integer age) {
        return await(users.create(assign("email", email), assign("name", name), assign("age", age)).exec());
    }

    protected Row post(Row author, String title, int views, boolean published) {
        return await(posts.create(
                assign("title", title),
                assign("views", views),
                assign("published", published),
                assign("author_id", author.get("id"))).exec());
    }

    private static UniqueWhere id(Row row) {
        return UniqueWhere.of("id", row.get("id"));
    }

    private long count(EntityClient client) {
        return await(client.count().exec());
    }

    // create

    @Test
    public void createReturnsTheStoredRowWithItsGeneratedKey() {
        Row alice = user("alice@x.com", "Alice", 30);

        assertNotNull(alice.get("id"));
        assertEquals("alice@x.com", alice.getString("email"));
        assertEquals(30, alice.getInt("age"));
        assertNull(alice.get("profile"));
        assertEquals(1, count(users));
    }

    @Test
    public void createGeneratesMissingUuidPrimaryKeys() {
        Row author = user("a@x.com", "A", null);
        Row post = post(author, "Hello", 0, true);

        Row comment = await(comments.create(assign("body", "First"), assign("post_id", post.get("id"))).exec());

        assertInstanceOf(UUID.class, comment.get("id"));
        assertTrue(await(comments.findUnique(UniqueWhere.of("id", comment.get("id"))).exec()).isPresent());
    }

    @Test
    public void createConnectsARelationThroughAUniqueField() {
        Row author = user("a@x.com", "A", null);

        Row post = await(posts.create(
                assign("title", "Connected"),
                assign("views", 1),
                assign("published", false),
                SetParam.connect("author", UniqueWhere.of("email", "a@x.com"))).exec());

        assertEquals(author.getLong("id"), post.getLong("author_id"));
    }

    @Test
    public void createConnectingAMissingRowFailsAndWritesNothing() {
        CompletableFuture<Row> create = posts.create(
                assign("title", "Orphan"),
                assign("views", 0),
                assign("published", false),
                SetParam.connect("author", UniqueWhere.of("email", "a@x.com"))).exec();

        assertThrows(NotFoundException.class, () -> await(create));
        assertEquals(0, count(posts));
    }

    @Test
    public void createRejectsArithmetic() {
        assertThrows(ContractViolationException.class, () -> await(posts.create(
                assign("title", "T"), SetParam.increment("views", 1)).exec()));
    }

    @Test
    public void nestedCreateWritesChildrenWithTheParentKey() {
        Row alice = await(users.create(
                assign("email", "alice@x.com"),
                assign("name", "Alice"),
                SetParam.create("posts", List.of(
                        List.of(assign("title", "One"), assign("views", 1), assign("published", true)),
                        List.of(assign("title", "Two"), assign("views", 2), assign("published", false))))).exec());

        List<Row> written = await(posts.findMany(Where.field("author_id").eq(alice.get("id"))).exec());
        assertEquals(2, written.size());
    }

    @Test
    public void createManyReturnsTheNumberOfRows() {
        long created = await(users.createMany(List.of(
                List.of(assign("email", "a@x.com"), assign("name", "A")),
                List.of(assign("email", "b@x.com"), assign("name", "B")),
                List.of(assign("email", "c@x.com"), assign("name", "C")))).exec());

        assertEquals(3, created);
        assertEquals(3, count(users));
    }

    @Test
    public void buildersRunOnlyOnce() {
        FindManyQuery query = users.findMany();
        await(query.exec());

        assertThrows(IllegalStateException.class, query::exec);
    }

    // reads

    @Test
    public void findUniqueReturnsEmptyForAMissingRow() {
        user("alice@x.com", "Alice", 30);

        assertTrue(await(users.findUnique(UniqueWhere.of("email", "alice@x.com")).exec()).isPresent());
        assertTrue(await(users.findUnique(UniqueWhere.of("email", "bob@x.com")).exec()).isEmpty());
    }

    @Test
    public void isNullAndIsNotNullPartitionANullableField() {
        user("a@x.com", "A", 20);
        user("b@x.com", "B", null);
        user("c@x.com", "C", 40);
        user("d@x.com", "D", null);

        List<Row> nulls = await(users.findMany(Where.field("age").isNull()).exec());
        List<Row> values = await(users.findMany(Where.field("age").isNotNull()).exec());

        assertEquals(2, nulls.size());
        assertEquals(2, values.size());
        List<Object> ids = new ArrayList<>();
        nulls.forEach(r -> ids.add(r.get("id")));
        values.forEach(r -> assertFalse(ids.contains(r.get("id"))));
        assertEquals(count(users), nulls.size() + values.size());
    }

    @Test
    public void stringModesControlCaseSensitivity() {
        user("alice@x.com", "Alice", null);

        assertEquals(0, await(users.findMany(Where.field("name").contains("ali")).exec()).size());
        assertEquals(1, await(users.findMany(
                Where.field("name").contains("ali"),
                Where.field("name").mode(QueryMode.INSENSITIVE)).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("name").startsWith("Al")).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("name").endsWith("ice")).exec()).size());
    }

    @Test
    public void wildcardCharactersMatchLiterally() {
        user("a@x.com", "100%_done*", null);
        user("b@x.com", "100 done", null);

        assertEquals(1, await(users.findMany(Where.field("name").contains("%_")).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("name").endsWith("*")).exec()).size());
    }

    @Test
    public void logicalOperatorsCombinePredicates() {
        user("a@x.com", "A", 20);
        user("b@x.com", "B", 30);
        user("c@x.com", "C", 40);

        assertEquals(2, await(users.findMany(Where.or(
                Where.field("age").lt(25), Where.field("age").gt(35))).exec()).size());
        assertEquals(2, await(users.findMany(Where.not(Where.field("age").eq(30))).exec()).size());
        assertEquals(0, await(users.findMany(Where.field("age").in(List.of())).exec()).size());
        assertEquals(3, await(users.findMany(Where.field("age").notIn(List.of())).exec()).size());
        assertEquals(2, await(users.findMany(Where.field("age").in(List.of(20, 40))).exec()).size());
    }

    @Test
    public void nestedLogicalOperatorsKeepTheirGrouping() {
        user("a@x.com", "A", 20);
        user("b@x.com", "B", 30);
        user("c@x.com", "C", 40);

        List<Row> grouped = await(users.findMany(Where.or(
                Where.and(Where.field("name").eq("A"), Where.field("age").gt(25)))).exec());
        assertEquals(0, grouped.size());

        List<Row> either = await(users.findMany(Where.or(
                Where.and(Where.field("name").eq("A"), Where.field("age").lt(25)),
                Where.field("name").eq("C"))).exec());
        assertEquals(2, either.size());

        List<Row> neither = await(users.findMany(Where.not(Where.or(
                Where.and(Where.field("name").eq("A"), Where.field("age").lt(25)),
                Where.field("name").eq("C")))).exec());
        assertEquals(1, neither.size());
        assertEquals("B", neither.get(0).getString("name"));
    }

    @Test
    public void relationQuantifiersAreVacuouslyTrueWithoutRelatedRows() {
        user("lonely@x.com", "Lonely", null);

        assertEquals(0, await(users.findMany(Where.relation("posts").some(Where.field("published").eq(true))).exec()).size());
        assertEquals(1, await(users.findMany(Where.relation("posts").every(Where.field("published").eq(true))).exec()).size());
        assertEquals(1, await(users.findMany(Where.relation("posts").none(Where.field("published").eq(true))).exec()).size());
    }

    @Test
    public void noneExcludesAParentOnceARelatedRowMatches() {
        Row alice = user("alice@x.com", "Alice", null);
        post(alice, "Hello world", 1, true);
        post(alice, "Second post", 2, true);

        assertEquals(1, await(users.findMany(Where.relation("posts").none(Where.field("title").contains("spam"))).exec()).size());

        post(alice, "Buy spam now", 3, true);

        assertEquals(0, await(users.findMany(Where.relation("posts").none(Where.field("title").contains("spam"))).exec()).size());
    }

    @Test
    public void belongsToQuantifierFiltersOnTheParent() {
        Row alice = user("alice@x.com", "Alice", 30);
        Row bob = user("bob@x.com", "Bob", 50);
        post(alice, "A", 1, true);
        post(bob, "B", 1, true);

        List<Row> found = await(posts.findMany(Where.relation("author").some(Where.field("age").gt(40))).exec());

        assertEquals(1, found.size());
        assertEquals("B", found.get(0).getString("title"));
    }

    @Test
    public void paginationTakesSkipsAndReadsBackwards() {
        Row author = user("a@x.com", "A", null);
        for (int i = 1; i <= 5; i++) {
            post(author, "P" + i, i, true);
        }

        List<Row> page = await(posts.findMany().orderBy(OrderBy.asc("views")).take(2).skip(1).exec());
        assertEquals(List.of(2, 3), page.stream().map(r -> r.getInt("views")).toList());

        List<Row> last = await(posts.findMany().orderBy(OrderBy.asc("views")).take(-2).exec());
        assertEquals(List.of(4, 5), last.stream().map(r -> r.getInt("views")).toList());

        assertTrue(await(posts.findMany().take(0).exec()).isEmpty());
        assertThrows(QueryValidationException.class, () -> await(posts.findMany().skip(-1).exec()));

        Optional<Row> highest = await(posts.findFirst().orderBy(OrderBy.desc("views")).exec());
        assertEquals(5, highest.orElseThrow().getInt("views"));
    }

    @Test
    public void cursorContinuesAfterTheCursorRow() {
        Row author = user("a@x.com", "A", null);
        List<Row> created = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            created.add(post(author, "P" + i, i, true));
        }

        List<Row> after = await(posts.findMany()
                .orderBy(OrderBy.asc("id"))
                .cursor(id(created.get(1)))
                .take(5)
                .exec());

        assertEquals(List.of("P3", "P4"), after.stream().map(r -> r.getString("title")).toList());
    }

    @Test
    public void selectAndDistinctProjectRows() {
        user("a@x.com", "Same", 1);
        user("b@x.com", "Same", 2);

        List<Row> names = await(users.findMany().select("name").distinct().exec());

        assertEquals(1, names.size());
        assertEquals(List.of("name"), new ArrayList<>(names.get(0).keySet()));
    }

    @Test
    public void includesLoadRelationsAndCounts() {
        Row alice = user("alice@x.com", "Alice", null);
        Row first = post(alice, "First", 1, true);
        post(alice, "Second", 2, false);
        await(comments.create(assign("body", "Nice"), assign("post_id", first.get("id"))).exec());

        Row loaded = await(users.findUnique(id(alice))
                .include(IncludeBuilder.of("posts")
                        .where(Where.field("published").eq(true))
                        .include(IncludeBuilder.of("comments"))
                        .withCount())
                .exec()).orElseThrow();

        List<Row> included = loaded.getRows("posts");
        assertEquals(1, included.size());
        assertEquals(1, included.get(0).getRows("comments").size());
        assertEquals(1L, loaded.count("posts"));

        Row post = await(posts.findUnique(id(first)).include(IncludeBuilder.of("author")).exec()).orElseThrow();
        assertEquals("Alice", post.getRow("author").getString("name"));
        Row reviewed = await(posts.findUnique(id(first)).include(IncludeBuilder.of("reviewer")).exec()).orElseThrow();
        assertTrue(reviewed.containsKey("reviewer"));
        assertNull(reviewed.get("reviewer"));
    }

    @Test
    public void jsonPredicatesInspectDocuments() {
        JsonNodeFactory json = JsonNodeFactory.instance;
        JsonNode profile = json.objectNode()
                .put("city", "Oslo")
                .putNull("nick")
                .set("tags", json.arrayNode().add("java").add("sql"));
        await(users.create(assign("email", "a@x.com"), assign("name", "A"), assign("profile", profile)).exec());
        user("b@x.com", "B", null);

        assertEquals(1, await(users.findMany(Where.field("profile").path("city"),
                Where.field("profile").eq(json.textNode("Oslo"))).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("profile").path("city"),
                Where.field("profile").stringStartsWith("Os")).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("profile").path("tags"),
                Where.field("profile").arrayContains(json.textNode("sql"))).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("profile").path("tags"),
                Where.field("profile").arrayStartsWith(json.textNode("java"))).exec()).size());
        assertEquals(0, await(users.findMany(Where.field("profile").path("tags"),
                Where.field("profile").arrayEndsWith(json.textNode("java"))).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("profile").objectContains("city")).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("profile").path("nick"),
                Where.field("profile").jsonNull(JsonNullFilter.JSON_NULL)).exec()).size());
        assertEquals(1, await(users.findMany(Where.field("profile").jsonNull(JsonNullFilter.DB_NULL)).exec()).size());

        Row stored = await(users.findUnique(UniqueWhere.of("email", "a@x.com")).exec()).orElseThrow();
        assertEquals(profile, stored.get("profile"));
    }

    @Test
    public void instantsRoundTrip() {
        Row author = user("a@x.com", "A", null);
        Instant publishedAt = Instant.ofEpochMilli(1_700_000_000_123L);

        Row post = await(posts.create(
                assign("title", "Dated"),
                assign("views", 0),
                assign("published", true),
                assign("published_at", publishedAt),
                assign("author_id", author.get("id"))).exec());

        assertEquals(publishedAt, post.get("published_at"));
        assertEquals(1, await(posts.findMany(Where.field("published_at").gte(publishedAt)).exec()).size());
    }

    // updates

    @Test
    public void updateAppliesChangesInOrder() {
        Row author = user("a@x.com", "A", null);
        Row post = post(author, "T", 1, true);

        Row updated = await(posts.update(id(post),
                assign("views", 10),
                SetParam.increment("views", 5),
                SetParam.multiply("views", 2),
                assign("title", "Renamed")).exec());

        assertEquals(30, updated.getInt("views"));
        assertEquals("Renamed", updated.getString("title"));
    }

    @Test
    public void arithmeticAfterAnAssignmentUsesTheConvertedValue() {
        Row author = user("a@x.com", "A", null);
        Row post = post(author, "T", 1, true);

        Row fromKey = await(posts.update(id(post),
                assign("views", Key.of(10)),
                SetParam.increment("views", 5)).exec());
        assertEquals(15, fromKey.getInt("views"));

        Row fromText = await(posts.update(id(post),
                assign("views", "7"),
                SetParam.decrement("views", 2)).exec());
        assertEquals(5, fromText.getInt("views"));
    }

    @Test
    public void updateWithoutChangesReturnsTheRowUnchanged() {
        Row alice = user("alice@x.com", "Alice", 30);

        Row updated = await(users.update(id(alice)).exec());

        assertEquals(alice, updated);
        assertEquals(alice, await(users.findUnique(id(alice)).exec()).orElseThrow());
    }

    @Test
    public void updateAndDeleteOfAMissingRowAreNotFound() {
        assertThrows(NotFoundException.class, () -> await(users.update(UniqueWhere.of("id", 99L), assign("name", "X")).exec()));
        assertThrows(NotFoundException.class, () -> await(users.delete(UniqueWhere.of("id", 99L)).exec()));
    }

    @Test
    public void divisionByZeroIsRejected() {
        Row author = user("a@x.com", "A", null);
        Row post = post(author, "T", 4, true);

        assertThrows(QueryValidationException.class, () -> await(posts.update(id(post), SetParam.divide("views", 0)).exec()));
        assertEquals(4, await(posts.findUnique(id(post)).exec()).orElseThrow().getInt("views"));
    }

    @Test
    public void updateConnectsAndDisconnectsRelations() {
        Row author = user("a@x.com", "A", null);
        Row reviewer = user("r@x.com", "R", null);
        Row post = post(author, "T", 1, true);

        Row connected = await(posts.update(id(post), SetParam.connect("reviewer", UniqueWhere.of("email", "r@x.com"))).exec());
        assertEquals(reviewer.getLong("id"), connected.getLong("reviewer_id"));

        Row disconnected = await(posts.update(id(post), SetParam.disconnect("reviewer")).exec());
        assertNull(disconnected.get("reviewer_id"));

        assertThrows(ContractViolationException.class, () -> await(posts.update(id(post), SetParam.disconnect("author")).exec()));
    }

    @Test
    public void hasManySetDetachesNullableChildrenAndIsIdempotent() {
        Row author = user("a@x.com", "A", null);
        Row reviewer = user("r@x.com", "R", null);
        List<Row> all = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            all.add(post(author, "P" + i, i, true));
        }
        for (Row p : all.subList(0, 3)) {
            await(posts.update(id(p), assign("reviewer_id", reviewer.get("id"))).exec());
        }

        List<UniqueWhere> targets = List.of(id(all.get(0)), id(all.get(3)));
        await(users.update(id(reviewer), SetParam.set("reviews", targets)).exec());
        List<Row> once = await(posts.findMany(Where.field("reviewer_id").eq(reviewer.get("id"))).orderBy(OrderBy.asc("id")).exec());

        await(users.update(id(reviewer), SetParam.set("reviews", targets)).exec());
        List<Row> twice = await(posts.findMany(Where.field("reviewer_id").eq(reviewer.get("id"))).orderBy(OrderBy.asc("id")).exec());

        assertEquals(List.of("P1", "P4"), once.stream().map(r -> r.getString("title")).toList());
        assertEquals(once, twice);
        assertEquals(4, count(posts));
    }

    @Test
    public void hasManySetDeletesRequiredChildrenOutsideTheSet() {
        Row author = user("a@x.com", "A", null);
        Row post = post(author, "T", 1, true);
        Row keep = await(comments.create(assign("body", "keep"), assign("post_id", post.get("id"))).exec());
        await(comments.create(assign("body", "drop"), assign("post_id", post.get("id"))).exec());

        await(posts.update(id(post), SetParam.set("comments", List.of(id(keep)))).exec());

        List<Row> left = await(comments.findMany().exec());
        assertEquals(1, left.size());
        assertEquals("keep", left.get(0).getString("body"));
    }

    @Test
    public void updateManyAndDeleteManyReturnAffectedCounts() {
        Row author = user("a@x.com", "A", null);
        post(author, "P1", 1, true);
        post(author, "P2", 2, true);
        post(author, "P3", 3, false);

        long updated = await(posts.updateMany(List.of(Where.field("published").eq(true)),
                List.of(SetParam.increment("views", 10))).exec());
        assertEquals(2, updated);
        assertEquals(12, await(posts.findFirst(Where.field("title").eq("P2")).exec()).orElseThrow().getInt("views"));

        assertEquals(1, await(posts.deleteMany(Where.field("published").eq(false)).exec()));
        assertEquals(2, count(posts));
    }

    @Test
    public void deleteReturnsTheDeletedRow() {
        Row alice = user("alice@x.com", "Alice", null);

        Row deleted = await(users.delete(UniqueWhere.of("email", "alice@x.com")).exec());

        assertEquals(alice, deleted);
        assertEquals(0, count(users));
    }

    @Test
    public void upsertCreatesThenUpdates() {
        UniqueWhere where = UniqueWhere.of("email", "u@x.com");
        List<SetParam> create = List.of(assign("email", "u@x.com"), assign("name", "Created"));
        List<SetParam> update = List.of(assign("name", "Updated"));

        Row created = await(users.upsert(where, create, update).exec());
        Row updated = await(users.upsert(where, create, update).exec());

        assertEquals("Created", created.getString("name"));
        assertEquals("Updated", updated.getString("name"));
        assertEquals(created.get("id"), updated.get("id"));
        assertEquals(1, count(users));
    }

    // aggregates

    @Test
    public void aggregateComputesStatistics() {
        Row author = user("a@x.com", "A", null);
        post(author, "P1", 2, true);
        post(author, "P2", 4, true);
        post(author, "P3", 9, false);

        AggregateResult result = await(posts.aggregate(Where.field("published").eq(true))
                .sum("views").avg("views").min("views").max("views").exec());

        assertEquals(2, result.count());
        assertEquals(6L, ((Number) result.sum().get("views")).longValue());
        assertEquals(3.0, ((Number) result.avg().get("views")).doubleValue(), 0.0001);
        assertEquals(2, ((Number) result.min().get("views")).intValue());
        assertEquals(4, ((Number) result.max().get("views")).intValue());
    }

    @Test
    public void groupByAggregatesPerGroup() {
        Row author = user("a@x.com", "A", null);
        post(author, "P1", 1, true);
        post(author, "P2", 2, true);
        post(author, "P3", 3, true);
        post(author, "P4", 10, false);

        List<Row> groups = await(posts.groupBy(List.of("published"))
                .count()
                .sum("views")
                .orderBy(OrderBy.desc("_count"))
                .exec());

        assertEquals(2, groups.size());
        assertTrue(groups.get(0).getBoolean("published"));
        assertEquals(3L, groups.get(0).getLong("_count"));
        assertEquals(6L, groups.get(0).getLong("_sum_views"));

        List<Row> large = await(posts.groupBy(List.of("published")).count().havingCountGt(1).exec());
        assertEquals(1, large.size());
    }

    @Test
    public void sumRequiresANumericField() {
        assertThrows(QueryValidationException.class, () -> posts.aggregate().sum("title"));
    }

    // batches and raw statements

    @Test
    public void batchRunsWritesInOrder() {
        Row alice = user("alice@x.com", "Alice", null);

        List<BatchResult> results = await(lens.batch(List.of(
                BatchQuery.insert(users.create(assign("email", "bob@x.com"), assign("name", "Bob"))),
                BatchQuery.update(users.update(id(alice), assign("name", "Alicia"))),
                BatchQuery.delete(users.delete(UniqueWhere.of("email", "bob@x.com"))))));

        assertEquals(List.of(BatchQuery.Kind.INSERT, BatchQuery.Kind.UPDATE, BatchQuery.Kind.DELETE),
                results.stream().map(BatchResult::kind).toList());
        assertEquals("Alicia", results.get(1).row().getString("name"));
        assertEquals(1, count(users));
    }

    @Test
    public void batchFailingAtAnyStepLeavesNothingBehind() {
        user("taken@x.com", "Taken", null);

        for (int failing = 0; failing < 3; failing++) {
            List<BatchQuery> batch = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                String email = i == failing ? "taken@x.com" : "new" + i + "@x.com";
                batch.add(BatchQuery.insert(users.create(assign("email", email), assign("name", "N" + i))));
            }

            assertThrows(LensException.class, () -> await(lens.batch(batch)));
            assertEquals(1, count(users));
        }
    }

    @Test
    public void rawStatementsPassThrough() {
        user("alice@x.com", "Alice", 30);

        long changed = await(lens.executeRaw("UPDATE users SET age = ? WHERE email = ?", 31, "alice@x.com"));
        List<Row> rows = await(lens.queryRaw("SELECT email, age FROM users WHERE age > ?", 30));

        assertEquals(1, changed);
        assertEquals(1, rows.size());
        assertEquals("alice@x.com", rows.get(0).get("email"));
        assertEquals(31, ((Number) rows.get(0).get("age")).intValue());
    }
}
