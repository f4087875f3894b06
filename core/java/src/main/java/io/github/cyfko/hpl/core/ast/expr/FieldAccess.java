package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read of a message field.
 * <p>
 * Without alias, the field belongs to the message of the event the predicate is attached to.
 * With an alias, it belongs to the message bound to that alias, which may be the event's own
 * alias (a self reference as well) or the alias of an earlier event.
 * </p>
 *
 * <pre>{@code
 * FieldAccess.self("pose.x");      // pose.x
 * FieldAccess.of("goal", "pose.x"); // @goal.pose.x
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FieldAccess extends Expression {

    private final String alias;
    private final List<String> path;

    /**
     * @param alias the alias of the accessed message, {@code null} for the event's own message
     * @param path  the field path, outermost field first
     */
    public FieldAccess(String alias, List<String> path) {
        if (alias != null && alias.isBlank()) {
            throw new AstConstructionException(ConstructionError.BLANK_ALIAS, alias, "A field access alias cannot be blank");
        }
        Objects.requireNonNull(path, "path is required");
        if (path.isEmpty()) {
            throw new AstConstructionException(ConstructionError.EMPTY_FIELD_PATH, alias,
                    "A field access needs at least one field");
        }
        for (String segment : path) {
            if (segment == null || segment.isBlank()) {
                throw new AstConstructionException(ConstructionError.EMPTY_FIELD_PATH, String.join(".", path),
                        "Field path '" + path + "' contains a blank segment");
            }
        }
        this.alias = alias;
        this.path = List.copyOf(path);
    }

    public static FieldAccess self(String dottedPath) {
        return new FieldAccess(null, split(dottedPath));
    }

    public static FieldAccess of(String alias, String dottedPath) {
        Objects.requireNonNull(alias, "alias is required");
        return new FieldAccess(alias, split(dottedPath));
    }

    private static List<String> split(String dottedPath) {
        Objects.requireNonNull(dottedPath, "path is required");
        if (dottedPath.isBlank()) {
            return List.of();
        }
        return Arrays.asList(dottedPath.split("\\.", -1));
    }

    public Optional<String> alias() {
        return Optional.ofNullable(alias);
    }

    public List<String> path() {
        return path;
    }

    public String dottedPath() {
        return String.join(".", path);
    }

    /**
     * @param ownAlias the alias of the enclosing event, may be {@code null}
     * @return {@code true} if this access reads the message of the enclosing event
     */
    public boolean readsOwnMessage(String ownAlias) {
        return alias == null || alias.equals(ownAlias);
    }

    @Override
    public Set<ValueType> possibleTypes(TypingContext context) {
        return context.fieldTypes(this);
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    @Override
    public FieldAccess duplicate() {
        return new FieldAccess(alias, path);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof FieldAccess f && Objects.equals(alias, f.alias) && path.equals(f.path);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        throw notAChild(oldId);
    }

    @Override
    public List<String> missingSlots() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFieldAccess(this);
    }

    @Override
    public String toString() {
        return alias == null ? dottedPath() : "@" + alias + "." + dottedPath();
    }
}
