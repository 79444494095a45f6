package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One projected expression, tagged with the alias of the table instance that owns it.
 */
public final class SelectItem {
    /**
     * Output names are emitted unquoted, so they must be plain identifiers.
     */
    public static final String NAME_PATTERN = "[A-Za-z_][A-Za-z0-9_]*";

    private static final Pattern NAME = Pattern.compile(NAME_PATTERN);

    public enum Kind {
        METRIC,
        DIMENSION
    }

    private final String expression;
    private final String name;
    private final String ownerAlias;
    private final Kind kind;

    public SelectItem(String expression, String name, String ownerAlias, Kind kind) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.name = Objects.requireNonNull(name, "name");
        this.ownerAlias = Objects.requireNonNull(ownerAlias, "ownerAlias");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    public String getExpression() {
        return expression;
    }

    public String getName() {
        return name;
    }

    @JsonProperty("owner_alias")
    public String getOwnerAlias() {
        return ownerAlias;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * {@code expression AS name}, or the bare column reference when it already carries the name.
     */
    @JsonIgnore
    public String sql() {
        if (expression.equals(ownerAlias + "." + name)) {
            return expression;
        }
        return expression + " AS " + name;
    }
}
