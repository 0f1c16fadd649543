package com.lensql.core.meta;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NamingTest {

    @Test
    void snakeCasesColumnReferences() {
        assertEquals("author_id", Naming.snakeCase("AuthorId"));
        assertEquals("author_id", Naming.snakeCase("author_id"));
        assertEquals("http_server", Naming.snakeCase("HTTPServer"));
        assertEquals("post2_id", Naming.snakeCase("Post2Id"));
    }

    @Test
    void pascalAndCamelCase() {
        assertEquals("BlogPost", Naming.pascalCase("blog_post"));
        assertEquals("BlogPost", Naming.pascalCase("BlogPost"));
        assertEquals("authorId", Naming.camelCase("author_id"));
    }

    @Test
    void lastSegmentHandlesBothSeparators() {
        assertEquals("Entity", Naming.lastSegment("super::user::Entity"));
        assertEquals("Post", Naming.lastSegment("com.acme.Post"));
        assertEquals("Post", Naming.lastSegment("Post"));
    }
}
