package com.lensql.repositories.rdbms;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Statement skeletons every dialect renders. A dialect may override any of them by shipping
 * {@code sql/<dialect>/<name>.sql}; the rest come from {@code sql/<name>.sql}.
 */
public record SqlTemplates(
        Template select,
        Template count,
        Template insert,
        Template update,
        Template delete,
        Template aggregate,
        Template groupBy
) {
    private static final Logger logger = LoggerFactory.getLogger(SqlTemplates.class);

    public static SqlTemplates load(String dialect) {
        Handlebars handlebars = new Handlebars();
        return new SqlTemplates(
                loadTemplate(handlebars, dialect, "select"),
                loadTemplate(handlebars, dialect, "count"),
                loadTemplate(handlebars, dialect, "insert"),
                loadTemplate(handlebars, dialect, "update"),
                loadTemplate(handlebars, dialect, "delete"),
                loadTemplate(handlebars, dialect, "aggregate"),
                loadTemplate(handlebars, dialect, "groupBy"));
    }

    public static String apply(Template template, Map<String, Object> context) {
        try {
            return template.apply(context);
        } catch (IOException e) {
            logger.error("Failed to apply template: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to apply template", e);
        }
    }

    private static Template loadTemplate(Handlebars handlebars, String dialect, String name) {
        ClassLoader loader = SqlTemplates.class.getClassLoader();
        String path = "sql/" + dialect + "/" + name + ".sql";
        if (loader.getResource(path) == null) {
            path = "sql/" + name + ".sql";
        }
        try (InputStream is = loader.getResourceAsStream(path)) {
            if (is == null) {
                throw new FileNotFoundException("Template not found: " + path);
            }
            try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                String templateContent = new BufferedReader(reader)
                        .lines()
                        .collect(Collectors.joining("\n"));
                return handlebars.compileInline(templateContent.strip());
            }
        } catch (IOException e) {
            logger.error("Failed to load template: {}", path, e);
            throw new IllegalStateException("Failed to load template: " + path, e);
        }
    }
}
