package de.bsommerfeld.nestedsets.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches SQL templates from classpath resource files under
 * {@code sql/}, and renders their {@code ${name}} placeholders.
 *
 * <p>
 * Templates refer to the mapped table and its columns through placeholders
 * ({@code ${table}}, {@code ${id}}, {@code ${left}}, {@code ${right}}, ...)
 * so one set of statements serves every {@link TableMapping}. Values are
 * substituted verbatim; {@link TableMapping} only admits plain identifiers.
 * Each file is read once and cached for the lifetime of the JVM.
 *
 * @see TableMapping#sql(String)
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([a-z]+)}");

    private SqlLoader() {
    }

    /**
     * Returns the raw template from {@code sql/<name>.sql} on the classpath,
     * trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Loads {@code name} and replaces every {@code ${key}} with its value.
     *
     * @throws IllegalStateException if the template uses a key without a value
     */
    public static String render(String name, Map<String, String> values) {
        String template = load(name);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sql = new StringBuilder(template.length());
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            if (value == null) {
                throw new IllegalStateException("No value for ${" + matcher.group(1) + "} in sql/" + name + ".sql");
            }
            matcher.appendReplacement(sql, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sql);
        return sql.toString();
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
