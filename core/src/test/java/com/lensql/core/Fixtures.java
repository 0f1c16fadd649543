package com.lensql.core;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.core.meta.ScalarType;

import java.util.List;

public final class Fixtures {
    private Fixtures() {
    }

    public static final EntityMetadata USER = new EntityMetadata("User", "users",
            List.of(
                    new FieldMetadata("id", "id", ScalarType.I64, "i64", false, false, true),
                    new FieldMetadata("email", "email", ScalarType.STRING, "String", false, true, false),
                    new FieldMetadata("name", "name", ScalarType.STRING, "String", false, false, false),
                    new FieldMetadata("age", "age", ScalarType.I32, "i32", true, false, false),
                    new FieldMetadata("profile", "profile", ScalarType.JSON, "Json", true, false, false)),
            List.of(
                    new RelationMetadata("posts", RelationKind.HAS_MANY, "Post", "posts",
                            "author_id", "author_id", "id", "id", ScalarType.I64, false)));

    public static final EntityMetadata POST = new EntityMetadata("Post", "posts",
            List.of(
                    new FieldMetadata("id", "id", ScalarType.I64, "i64", false, false, true),
                    new FieldMetadata("title", "title", ScalarType.STRING, "String", false, false, false),
                    new FieldMetadata("views", "views", ScalarType.I32, "i32", false, false, false),
                    new FieldMetadata("published", "published", ScalarType.BOOL, "bool", false, false, false),
                    new FieldMetadata("author_id", "author_id", ScalarType.I64, "i64", false, false, false)),
            List.of(
                    new RelationMetadata("author", RelationKind.BELONGS_TO, "User", "users",
                            "author_id", "author_id", "id", "id", ScalarType.I64, false)));

    public static final EntityRegistry REGISTRY = new EntityRegistry(List.of(USER, POST));
}
