package com.localization.generator.codegen.model.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

import lombok.Getter;
import lombok.ToString;

/**
 * Mutable node of an ordered tree.
 *
 * Children keep insertion order until {@link #sort(Comparator)} reorders them.
 * Children are owned exclusively by their parent; there are no back-pointers.
 */
@Getter
@ToString
public final class Node<T extends TreeValue> {

    private T value;

    @ToString.Exclude
    private final List<Node<T>> children = new ArrayList<>();

    public Node(T value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public List<Node<T>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void setValue(T value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Appends a child, even if an equal sibling already exists.
     */
    public Node<T> addChild(Node<T> child) {
        Objects.requireNonNull(child, "child");
        if (!value.isContainer()) {
            throw new IllegalStateException("Node " + value + " cannot have children");
        }
        children.add(child);
        return child;
    }

    /**
     * Returns the first container child whose value equals {@code childValue},
     * appending a new one when none exists.
     */
    public Node<T> findOrAddContainer(T childValue) {
        for (Node<T> child : children) {
            if (child.value.isContainer() && child.value.equals(childValue)) {
                return child;
            }
        }
        return addChild(new Node<>(childValue));
    }

    /**
     * Recursively reorders every child list. The sort is stable.
     */
    public void sort(Comparator<? super T> order) {
        children.sort((left, right) -> order.compare(left.value, right.value));
        for (Node<T> child : children) {
            child.sort(order);
        }
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Depth-first, pre-order traversal including this node.
     */
    public Stream<Node<T>> stream() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(Node::stream));
    }
}
