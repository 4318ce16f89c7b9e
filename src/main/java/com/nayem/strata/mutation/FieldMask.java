package com.nayem.strata.mutation;

import com.nayem.strata.model.FieldPath;

import java.util.Arrays;
import java.util.List;

/**
 * The field paths a {@link PatchMutation} touches, in the order they are applied.
 * <ul>
 * <li>{@code foo} overwrites {@code foo} entirely, or deletes it if the patch carries
 * no value for it.</li>
 * <li>{@code foo.bar} overwrites only {@code bar} inside {@code foo}. If {@code foo} is
 * not an object it is replaced by one.</li>
 * </ul>
 * Paths are kept as given: not sorted, not deduplicated. Equality is order-sensitive.
 */
public final class FieldMask {

    private final List<FieldPath> mask;

    private FieldMask(List<FieldPath> mask) {
        this.mask = List.copyOf(mask);
    }

    public static FieldMask of(FieldPath... paths) {
        return new FieldMask(Arrays.asList(paths));
    }

    public static FieldMask of(List<FieldPath> paths) {
        return new FieldMask(paths);
    }

    public List<FieldPath> getMask() {
        return mask;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FieldMask other && mask.equals(other.mask));
    }

    @Override
    public int hashCode() {
        return mask.hashCode();
    }

    @Override
    public String toString() {
        return "FieldMask{mask=" + mask + "}";
    }
}
