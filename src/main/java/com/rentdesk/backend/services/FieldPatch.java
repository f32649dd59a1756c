package com.rentdesk.backend.services;

import java.util.Objects;
import java.util.Optional;

/**
 * Partial update of one field: leave it unchanged, clear it, or set a value.
 */
public final class FieldPatch<T> {

    private enum State {
        OMITTED,
        CLEARED,
        SET
    }

    private static final FieldPatch<?> OMITTED = new FieldPatch<>(State.OMITTED, null);
    private static final FieldPatch<?> CLEARED = new FieldPatch<>(State.CLEARED, null);

    private final State state;
    private final T value;

    private FieldPatch(State state, T value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldPatch<T> omitted() {
        return (FieldPatch<T>) OMITTED;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldPatch<T> cleared() {
        return (FieldPatch<T>) CLEARED;
    }

    public static <T> FieldPatch<T> set(T value) {
        return new FieldPatch<>(State.SET, Objects.requireNonNull(value, "value"));
    }

    /**
     * Maps a request field: {@code null} when the property was absent, empty when it was an explicit null.
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static <T> FieldPatch<T> fromRequest(Optional<T> field) {
        if (field == null) {
            return omitted();
        }
        return field.map(FieldPatch::set).orElseGet(FieldPatch::cleared);
    }

    public boolean isSet() {
        return state == State.SET;
    }

    public T value() {
        return value;
    }

    public T applyTo(T current) {
        return switch (state) {
            case OMITTED -> current;
            case CLEARED -> null;
            case SET -> value;
        };
    }

    @Override
    public String toString() {
        return state == State.SET ? "SET(" + value + ")" : state.name();
    }
}
