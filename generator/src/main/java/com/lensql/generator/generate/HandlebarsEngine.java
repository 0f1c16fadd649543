package com.lensql.generator.generate;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;
import com.lensql.core.meta.Naming;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlebars template engine with the case-conversion and literal helpers the source templates use.
 */
public class HandlebarsEngine {
    private final Handlebars handlebars;
    private final Map<String, Template> compiled = new ConcurrentHashMap<>();

    public HandlebarsEngine() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/templates");
        loader.setSuffix(".hbs");
        this.handlebars = new Handlebars(loader).prettyPrint(true);
        registerHelpers();
    }

    private void registerHelpers() {
        handlebars.registerHelper("pascalCase", (Helper<String>) (value, options) -> Naming.pascalCase(value));

        handlebars.registerHelper("camelCase", (Helper<String>) (value, options) -> Naming.camelCase(value));

        // Java string literal, quotes included
        handlebars.registerHelper("literal", (Helper<Object>) (value, options) -> {
            if (value == null) return "null";
            return "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        });
    }

    public Template compile(String templateName) throws IOException {
        Template template = compiled.get(templateName);
        if (template == null) {
            template = handlebars.compile(templateName);
            compiled.put(templateName, template);
        }
        return template;
    }

    public String render(String templateName, Object context) throws IOException {
        return compile(templateName).apply(context);
    }
}
