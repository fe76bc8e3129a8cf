package de.bsommerfeld.nestedsets.db;

import com.google.common.base.Preconditions;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Names the table that holds a tree and the columns inside it. Passed to a
 * store explicitly; nothing is discovered at runtime.
 *
 * <pre>
 * TableMapping&lt;Category&gt; mapping = TableMapping.builder("category", new CategoryMapper())
 *         .idColumn("id")
 *         .leftColumn("lft")
 *         .rightColumn("rgt")
 *         .build();
 * </pre>
 *
 * Rendered statements are cached per mapping.
 *
 * @param <T> the caller's record type
 */
public final class TableMapping<T> {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String table;
    private final String idColumn;
    private final String leftColumn;
    private final String rightColumn;
    private final PayloadMapper<T> payloadMapper;
    private final Map<String, String> placeholders;
    private final ConcurrentHashMap<String, String> statements = new ConcurrentHashMap<>();

    private TableMapping(Builder<T> builder) {
        this.table = identifier(builder.table);
        this.idColumn = identifier(builder.idColumn);
        this.leftColumn = identifier(builder.leftColumn);
        this.rightColumn = identifier(builder.rightColumn);
        this.payloadMapper = builder.payloadMapper;

        StringBuilder columns = new StringBuilder();
        StringBuilder markers = new StringBuilder();
        StringBuilder definitions = new StringBuilder();
        for (PayloadColumn column : payloadMapper.columns()) {
            columns.append(", ").append(identifier(column.name()));
            markers.append(", ?");
            definitions.append(",\n    ").append(column.name()).append(' ').append(column.definition());
        }

        Map<String, String> values = new HashMap<>();
        values.put("table", table);
        values.put("id", idColumn);
        values.put("left", leftColumn);
        values.put("right", rightColumn);
        values.put("columns", columns.toString());
        values.put("placeholders", markers.toString());
        values.put("definitions", definitions.toString());
        this.placeholders = Map.copyOf(values);
    }

    public static <T> Builder<T> builder(String table, PayloadMapper<T> payloadMapper) {
        return new Builder<>(table, payloadMapper);
    }

    public String table() {
        return table;
    }

    public String idColumn() {
        return idColumn;
    }

    public String leftColumn() {
        return leftColumn;
    }

    public String rightColumn() {
        return rightColumn;
    }

    public PayloadMapper<T> payloadMapper() {
        return payloadMapper;
    }

    public List<PayloadColumn> payloadColumns() {
        return payloadMapper.columns();
    }

    /** Returns {@code sql/<name>.sql} rendered for this table. */
    public String sql(String name) {
        return statements.computeIfAbsent(name, n -> SqlLoader.render(n, placeholders));
    }

    private static String identifier(String name) {
        Preconditions.checkArgument(name != null && IDENTIFIER.matcher(name).matches(),
                "Not a plain SQL identifier: %s", name);
        return name;
    }

    public static final class Builder<T> {

        private final String table;
        private final PayloadMapper<T> payloadMapper;
        private String idColumn = "id";
        private String leftColumn = "lft";
        private String rightColumn = "rgt";

        private Builder(String table, PayloadMapper<T> payloadMapper) {
            this.table = table;
            this.payloadMapper = Preconditions.checkNotNull(payloadMapper, "payloadMapper");
        }

        public Builder<T> idColumn(String idColumn) {
            this.idColumn = idColumn;
            return this;
        }

        public Builder<T> leftColumn(String leftColumn) {
            this.leftColumn = leftColumn;
            return this;
        }

        public Builder<T> rightColumn(String rightColumn) {
            this.rightColumn = rightColumn;
            return this;
        }

        public TableMapping<T> build() {
            return new TableMapping<>(this);
        }
    }
}
