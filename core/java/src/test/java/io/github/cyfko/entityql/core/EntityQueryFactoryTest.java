package io.github.cyfko.entityql.core;

import io.github.cyfko.entityql.core.cache.ResultCache;
import io.github.cyfko.entityql.core.config.CachePolicy;
import io.github.cyfko.entityql.core.config.EngineConfig;
import io.github.cyfko.entityql.core.impl.InMemoryEntityStore;
import io.github.cyfko.entityql.core.model.EntityRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("EntityQueryFactory Tests")
class EntityQueryFactoryTest {

    @Test
    @DisplayName("Queries inherit the configured default cache policy")
    void defaultPolicyFromConfig() {
        EngineConfig config = EngineConfig.builder()
                .defaultCachePolicy(CachePolicy.NETWORK_ELSE_CACHE)
                .build();

        try (EntityQueryFactory factory = EntityQueryFactory.of(new InMemoryEntityStore(), config)) {
            EntityQuery query = factory.query("players");

            assertEquals(CachePolicy.NETWORK_ELSE_CACHE, query.getCachePolicy());
            query.setCachePolicy(CachePolicy.NO_CACHE);
            query.reset();
            assertEquals(CachePolicy.NETWORK_ELSE_CACHE, query.getCachePolicy());
        }
    }

    @Test
    @DisplayName("fromClasspath() reads entityql.properties")
    void fromClasspath() {
        InMemoryEntityStore store = new InMemoryEntityStore("_id", true, true);
        store.save("players", Map.of("_id", "a1", "name", "Alice"));

        try (EntityQueryFactory factory = EntityQueryFactory.fromClasspath(store)) {
            assertEquals(CachePolicy.CACHE_ELSE_NETWORK, factory.getConfig().getDefaultCachePolicy());
            assertEquals(CachePolicy.CACHE_ELSE_NETWORK, factory.query("players").getCachePolicy());
            assertEquals("Alice", factory.query("players").findById("a1").orElseThrow().get("name"));
        }
    }

    @Test
    @DisplayName("Cached results are shared across queries of one factory")
    void sharedCache() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        store.save("players", Map.of("id", 1, "team", "red"));
        EngineConfig config = EngineConfig.builder().defaultCachePolicy(CachePolicy.CACHE_ELSE_NETWORK).build();

        try (EntityQueryFactory factory = EntityQueryFactory.of(store, config)) {
            EntityQuery first = factory.query("players");
            first.whereKeyEqualTo("team", "red");
            List<EntityRecord> before = first.findAll();

            store.save("players", Map.of("id", 2, "team", "red"));
            EntityQuery second = factory.query("players");
            second.whereKeyEqualTo("team", "red");

            assertEquals(before, second.findAll());
            assertEquals(1, factory.getCache().stats().hits());
        }
    }

    @Test
    @DisplayName("A supplied cache is used as is")
    void suppliedCache() {
        ResultCache cache = mock(ResultCache.class);

        try (EntityQueryFactory factory = EntityQueryFactory.of(new InMemoryEntityStore(), cache, EngineConfig.defaults())) {
            assertSame(cache, factory.getCache());
            assertNotNull(factory.getExecutor());
        }
    }

    @Test
    @DisplayName("Null collaborators are rejected")
    void nullArguments() {
        assertThrows(NullPointerException.class, () -> EntityQueryFactory.of(null, EngineConfig.defaults()));
        assertThrows(NullPointerException.class, () -> EntityQueryFactory.of(new InMemoryEntityStore(), null));
    }
}
