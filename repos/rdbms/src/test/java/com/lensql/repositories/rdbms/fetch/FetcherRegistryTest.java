package com.lensql.repositories.rdbms.fetch;

import com.lensql.core.QueryValidationException;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class FetcherRegistryTest {

    @Test
    public void namesAreNormalised() {
        FetcherRegistry registry = new FetcherRegistry();
        EntityFetcher fetcher = mock(EntityFetcher.class);

        registry.register("blog::BlogPost", fetcher);

        assertSame(fetcher, registry.lookup("blog_post").orElseThrow());
        assertSame(fetcher, registry.lookup("BLOGPOST").orElseThrow());
        assertTrue(registry.contains("BlogPost"));
        assertFalse(registry.contains("Comment"));
        assertTrue(registry.lookup(null).isEmpty());
    }

    @Test
    public void laterRegistrationReplacesEarlier() {
        FetcherRegistry registry = new FetcherRegistry();
        EntityFetcher first = mock(EntityFetcher.class);
        EntityFetcher second = mock(EntityFetcher.class);

        registry.register("User", first);
        registry.register("user", second);

        assertSame(second, registry.lookup("User").orElseThrow());
    }

    @Test
    public void compositeRegistryConvertsKeysToColumnTypes() {
        EntityMetadata comment = new EntityMetadata("Comment", "comments",
                List.of(
                        new FieldMetadata("id", "id", ScalarType.UUID, "Uuid", false, false, true),
                        new FieldMetadata("post_id", "post_id", ScalarType.I64, "i64", false, false, false),
                        new FieldMetadata("extra", "extra", ScalarType.JSON, "Json", true, false, false)),
                List.of());
        CompositeRegistry registry = new CompositeRegistry(new EntityRegistry(List.of(comment)), new FetcherRegistry());
        UUID id = UUID.randomUUID();

        assertEquals(id, registry.primaryKeyValue("Comment", id.toString()));
        assertEquals(7L, registry.fieldValue("Comment", "post_id", "7"));
        assertTrue(registry.fieldType("Comment", "extra").isEmpty());
        assertNull(registry.fieldValue("Comment", "post_id", null));
    }

    @Test
    public void missingFetcherIsAValidationError() {
        CompositeRegistry registry = new CompositeRegistry(new EntityRegistry(List.of()), new FetcherRegistry());

        assertThrows(QueryValidationException.class, () -> registry.fetcher("Ghost"));
    }
}
