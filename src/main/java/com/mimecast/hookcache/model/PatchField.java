package com.mimecast.hookcache.model;

import java.util.Objects;

/**
 * Single field of a partial update.
 *
 * <p>A field is in one of three states:
 * <ul>
 *   <li><b>unset</b>: the update does not mention it, the cached value is kept.</li>
 *   <li><b>set</b>: the cached value is replaced with the carried value.</li>
 *   <li><b>cleared</b>: the cached value is removed.</li>
 * </ul>
 * <p>Null is never used as a carried value.
 *
 * @param <T> Value type.
 */
public final class PatchField<T> {
    private static final PatchField<?> UNSET = new PatchField<>(State.UNSET, null);
    private static final PatchField<?> CLEARED = new PatchField<>(State.CLEARED, null);

    /**
     * Field states.
     */
    public enum State {
        UNSET,
        SET,
        CLEARED
    }

    private final State state;
    private final T value;

    private PatchField(State state, T value) {
        this.state = state;
        this.value = value;
    }

    /**
     * Gets a field that leaves the cached value alone.
     *
     * @param <T> Value type.
     * @return PatchField instance.
     */
    @SuppressWarnings("unchecked")
    public static <T> PatchField<T> unset() {
        return (PatchField<T>) UNSET;
    }

    /**
     * Gets a field that replaces the cached value.
     *
     * @param value New value, not null.
     * @param <T>   Value type.
     * @return PatchField instance.
     */
    public static <T> PatchField<T> set(T value) {
        return new PatchField<>(State.SET, Objects.requireNonNull(value, "use cleared() to remove a value"));
    }

    /**
     * Gets a field that removes the cached value.
     *
     * @param <T> Value type.
     * @return PatchField instance.
     */
    @SuppressWarnings("unchecked")
    public static <T> PatchField<T> cleared() {
        return (PatchField<T>) CLEARED;
    }

    /**
     * Gets field state.
     *
     * @return State.
     */
    public State getState() {
        return state;
    }

    public boolean isUnset() {
        return state == State.UNSET;
    }

    public boolean isSet() {
        return state == State.SET;
    }

    public boolean isCleared() {
        return state == State.CLEARED;
    }

    /**
     * Applies this field to a current value.
     *
     * @param current Current value, may be null.
     * @return Resulting value, null when cleared.
     */
    public T apply(T current) {
        switch (state) {
            case SET:
                return value;
            case CLEARED:
                return null;
            default:
                return current;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatchField)) return false;
        PatchField<?> that = (PatchField<?>) o;
        return state == that.state && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        return state == State.SET ? "set(" + value + ")" : state.name().toLowerCase();
    }
}
