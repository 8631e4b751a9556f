package io.github.cyfko.entityql.core;

import io.github.cyfko.entityql.core.api.Condition;
import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.api.GroupHandle;
import io.github.cyfko.entityql.core.api.Op;
import io.github.cyfko.entityql.core.config.CachePolicy;
import io.github.cyfko.entityql.core.config.EngineConfig;
import io.github.cyfko.entityql.core.exception.InvalidConditionException;
import io.github.cyfko.entityql.core.exception.InvalidQueryException;
import io.github.cyfko.entityql.core.impl.InMemoryEntityStore;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.MapReduce;
import io.github.cyfko.entityql.core.model.QueryPlan;
import io.github.cyfko.entityql.core.model.SortBy;
import io.github.cyfko.entityql.core.spi.QueryExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("EntityQuery Tests")
class EntityQueryTest {

    @Nested
    @DisplayName("Predicate composition")
    class Composition {

        @Test
        @DisplayName("Empty query matches everything")
        void emptyQuery() {
            assertEquals(ConditionGroup.matchAll(), new EntityQuery("players").compile().predicate());
        }

        @Test
        @DisplayName("Root conditions, OR branches and AND groups compose in order")
        void rootBranchesAndGroups() {
            // Given
            EntityQuery query = new EntityQuery("players");
            query.whereKeyGreaterThanOrEqualTo("score", 5);
            query.or().whereKeyEqualTo("team", "red");
            GroupHandle blue = query.or();
            blue.whereKeyEqualTo("team", "blue");
            blue.whereKeyExists("nickname");
            query.and().whereKeyNotEqualTo("banned", true);

            // When
            ConditionGroup predicate = query.compile().predicate();

            // Then
            ConditionGroup expected = ConditionGroup.and(List.of(
                    Condition.of("score", Op.GTE, 5),
                    ConditionGroup.or(List.of(
                            ConditionGroup.and(List.of(Condition.of("team", Op.EQ, "red"))),
                            ConditionGroup.and(List.of(
                                    Condition.of("team", Op.EQ, "blue"),
                                    Condition.exists("nickname"))))),
                    ConditionGroup.and(List.of(Condition.of("banned", Op.NE, true)))));
            assertEquals(expected, predicate);
        }

        @Test
        @DisplayName("Groups nest to arbitrary depth")
        void nestedGroups() {
            EntityQuery query = new EntityQuery("players");
            GroupHandle outer = query.or();
            outer.whereKeyEqualTo("team", "red");
            outer.or().whereKeyLessThan("score", 3);
            outer.or().whereKeyGreaterThan("score", 8);

            ConditionGroup expected = ConditionGroup.and(List.of(
                    ConditionGroup.or(List.of(
                            ConditionGroup.and(List.of(
                                    Condition.of("team", Op.EQ, "red"),
                                    ConditionGroup.or(List.of(
                                            ConditionGroup.and(List.of(Condition.of("score", Op.LT, 3))),
                                            ConditionGroup.and(List.of(Condition.of("score", Op.GT, 8)))))))))));
            assertEquals(expected, query.compile().predicate());
        }

        @Test
        @DisplayName("Groups left empty do not constrain the query")
        void emptyGroupsSkipped() {
            EntityQuery query = new EntityQuery("players");
            query.whereKeyEqualTo("team", "red");
            query.or();
            query.and().or();

            assertEquals(ConditionGroup.and(List.of(Condition.of("team", Op.EQ, "red"))), query.compile().predicate());
        }

        @Test
        @DisplayName("Invalid operator pairings fail when the condition is added")
        void invalidConditionRejectedEagerly() {
            EntityQuery query = new EntityQuery("players");

            assertThrows(InvalidConditionException.class, () -> query.whereKeyLessThan("tags", List.of(1, 2)));
            assertThrows(InvalidConditionException.class, () -> query.whereKeyMatchesRegex("name", "(unclosed"));
            assertEquals(ConditionGroup.matchAll(), query.compile().predicate());
        }
    }

    @Nested
    @DisplayName("Compilation")
    class Compilation {

        @Test
        @DisplayName("Plan captures ordering, pagination and cache policy")
        void planCapturesState() {
            EntityQuery query = new EntityQuery("players");
            query.orderDescendingByKey("score");
            query.setLimit(10);
            query.setSkip(20);
            query.setCachePolicy(CachePolicy.CACHE_ELSE_NETWORK);

            QueryPlan plan = query.compile();

            assertEquals("players", plan.entityName());
            assertEquals(SortBy.descending("score"), plan.order());
            assertEquals(10, plan.limit());
            assertEquals(20, plan.skip());
            assertEquals(CachePolicy.CACHE_ELSE_NETWORK, plan.cachePolicy());
        }

        @Test
        @DisplayName("A compiled plan is unaffected by later mutation")
        void planIsSnapshot() {
            EntityQuery query = new EntityQuery("players");
            query.whereKeyEqualTo("team", "red");
            QueryPlan plan = query.compile();
            String fingerprint = plan.fingerprint();

            query.whereKeyGreaterThan("score", 3);
            query.setLimit(5);

            assertEquals(1, plan.predicate().members().size());
            assertEquals(0, plan.limit());
            assertEquals(fingerprint, plan.fingerprint());
            assertNotEquals(fingerprint, query.compile().fingerprint());
        }

        @Test
        @DisplayName("reset() then rebuilding yields an identical plan")
        void resetAndRebuild() {
            // Given
            EntityQuery query = new EntityQuery("players", null, CachePolicy.CACHE_ELSE_NETWORK);
            query.whereKeyContainedIn("team", List.of("red", "blue"));
            query.or().whereKeyHasPrefix("name", "A");
            query.orderAscendingByKey("name");
            QueryPlan before = query.compile();

            // When
            query.setCachePolicy(CachePolicy.NO_CACHE);
            query.setMapReduce(MapReduce.of("map", "reduce"));
            query.reset();
            query.whereKeyContainedIn("team", List.of("red", "blue"));
            query.or().whereKeyHasPrefix("name", "A");
            query.orderAscendingByKey("name");
            QueryPlan after = query.compile();

            // Then
            assertEquals(before, after);
            assertEquals(before.fingerprint(), after.fingerprint());
            assertEquals(CachePolicy.CACHE_ELSE_NETWORK, after.cachePolicy());
            assertNull(after.mapReduce());
        }

        @Test
        @DisplayName("Handles obtained before reset() are stale")
        void staleHandle() {
            EntityQuery query = new EntityQuery("players");
            GroupHandle branch = query.or();
            assertTrue(branch.isValid());

            query.reset();

            assertFalse(branch.isValid());
            assertThrows(IllegalStateException.class, () -> branch.whereKeyEqualTo("team", "red"));
            assertThrows(IllegalStateException.class, branch::or);
        }

        @Test
        @DisplayName("Queries do not share conditions")
        void independentQueries() {
            EntityQuery first = new EntityQuery("players");
            EntityQuery second = new EntityQuery("players");
            GroupHandle handle = first.or();

            handle.whereKeyEqualTo("team", "red");

            assertEquals(ConditionGroup.matchAll(), second.compile().predicate());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Blank entity name fails to compile")
        void blankEntityName(String name) {
            assertThrows(InvalidQueryException.class, () -> new EntityQuery(name).compile());
        }

        @Test
        @DisplayName("Negative limit or skip is rejected")
        void negativeBounds() {
            EntityQuery query = new EntityQuery("players");

            assertThrows(IllegalArgumentException.class, () -> query.setLimit(-1));
            assertThrows(IllegalArgumentException.class, () -> query.setSkip(-1));
            assertEquals(0, query.getLimit());
            assertEquals(0, query.getSkip());
        }

        @Test
        @DisplayName("Executing without an executor fails")
        void noExecutor() {
            EntityQuery query = new EntityQuery("players");

            assertThrows(IllegalStateException.class, query::findAll);
            assertThrows(IllegalStateException.class, query::countAll);
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        private InMemoryEntityStore store;
        private EntityQueryFactory factory;

        @BeforeEach
        void setUp() {
            store = new InMemoryEntityStore();
            store.save("players", Map.of("id", 1, "name", "Alice", "score", 5, "team", "red"));
            store.save("players", Map.of("id", 2, "name", "Bob", "score", 9, "team", "blue"));
            store.save("players", Map.of("id", 3, "name", "Carol", "score", 9, "team", "red"));
            store.save("players", Map.of("id", 4, "name", "Dave", "score", 2, "team", "blue"));
            factory = EntityQueryFactory.of(store, EngineConfig.defaults());
        }

        @AfterEach
        void tearDown() {
            factory.close();
        }

        @Test
        @DisplayName("Top scorers, descending, limited")
        void topScorers() {
            EntityQuery query = factory.query("players");
            query.whereKeyGreaterThanOrEqualTo("score", 5);
            query.orderDescendingByKey("score");
            query.setLimit(2);

            List<EntityRecord> top = query.findAll();

            assertEquals(2, top.size());
            assertTrue(top.stream().allMatch(r -> r.get("score").equals(9)));
            assertEquals(3L, query.countAll());
        }

        @Test
        @DisplayName("OR branches select either team")
        void orBranches() {
            EntityQuery query = factory.query("players");
            query.whereKeyLessThan("score", 6);
            query.or().whereKeyEqualTo("name", "Alice");
            query.or().whereKeyEqualTo("name", "Dave");
            query.orderAscendingByKey("name");

            List<Object> names = new ArrayList<>();
            query.findAll().forEach(r -> names.add(r.get("name")));

            assertEquals(List.of("Alice", "Dave"), names);
        }

        @Test
        @DisplayName("Contradictory conditions compile and match nothing")
        void contradictoryConditions() {
            EntityQuery query = factory.query("players");
            query.whereKeyEqualTo("team", "red");
            query.whereKeyEqualTo("team", "blue");

            assertEquals(List.of(), query.findAll());
            assertEquals(0L, query.countAll());
            assertEquals(Optional.empty(), query.findOne());
        }

        @Test
        @DisplayName("findById ignores the query conditions")
        void findById() {
            EntityQuery query = factory.query("players");
            query.whereKeyEqualTo("team", "red");

            Optional<EntityRecord> bob = query.findById(2);

            assertTrue(bob.isPresent());
            assertEquals("Bob", bob.get().get("name"));
            assertTrue(query.findById(42).isEmpty());
        }

        @Test
        @DisplayName("Background lookup delivers the result")
        void background() throws Exception {
            EntityQuery query = factory.query("players");
            query.whereKeyEqualTo("team", "blue");
            CompletableFuture<Long> count = new CompletableFuture<>();

            query.countAllInBackground((result, error) -> {
                if (error != null) {
                    count.completeExceptionally(error);
                } else {
                    count.complete(result);
                }
            });

            assertEquals(2L, count.get(10, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Blank entity name is delivered inline, before anything is scheduled")
        void blankNameInBackground() {
            QueryExecutor executor = mock(QueryExecutor.class);
            EntityQuery query = new EntityQuery(" ", executor);
            List<Throwable> errors = new ArrayList<>();

            query.findAllInBackground((records, error) -> errors.add(error));

            assertEquals(1, errors.size());
            assertInstanceOf(InvalidQueryException.class, errors.get(0));
            verifyNoInteractions(executor);
        }
    }
}
