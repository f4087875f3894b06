package io.github.cyfko.hpl.core.ast;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered group of independent properties, typically one specification file.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Specification extends AbstractAstNode {

    private final List<Property> properties = new ArrayList<>();

    public Specification(List<Property> properties) {
        Objects.requireNonNull(properties, "properties are required");
        requireDistinctInstances(properties, "properties");
        for (Property property : List.copyOf(properties)) {
            addProperty(property);
        }
    }

    private Specification(Specification source) {
        for (Property property : source.properties) {
            addProperty(property.duplicate());
        }
    }

    public List<Property> properties() {
        return Collections.unmodifiableList(properties);
    }

    public void addProperty(Property property) {
        checkMutable();
        Objects.requireNonNull(property, "property is required");
        attach(property, removalFrom(properties, property));
        properties.add(property);
    }

    @Override
    public List<AstNode> children() {
        return List.copyOf(properties);
    }

    @Override
    public Specification duplicate() {
        return new Specification(this);
    }

    @Override
    public boolean structurallyEquals(AstNode other) {
        return other instanceof Specification s && sameNodes(properties, s.properties);
    }

    @Override
    public void replaceChild(NodeId oldId, AstNode newNode) {
        checkMutable();
        if (!replaceIn(properties, oldId, requireKind(newNode, Property.class, "property"))) {
            throw notAChild(oldId);
        }
    }

    @Override
    public List<String> missingSlots() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSpecification(this);
    }

    @Override
    public String toString() {
        return properties.stream().map(String::valueOf).collect(Collectors.joining("\n"));
    }
}
