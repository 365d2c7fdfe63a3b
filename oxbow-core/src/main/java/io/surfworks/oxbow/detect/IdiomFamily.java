package io.surfworks.oxbow.detect;

import io.surfworks.oxbow.ir.IrAst.Expr;

/**
 * Families of unsafe C idioms that have a safe Rust replacement.
 */
public enum IdiomFamily {

    /** {@code T *p = malloc(size)} owning a single object, replaced by {@code Box<T>}. */
    HEAP_ALLOCATION("Box<T>"),

    /** {@code T *p = malloc(n * sizeof(T))} or {@code calloc(n, size)}, replaced by {@code Vec<T>}. */
    ARRAY_ALLOCATION("Vec<T>"),

    /** {@code T *p = NULL}, replaced by {@code Option<Box<T>>}. */
    NULLABLE_POINTER("Option<Box<T>>"),

    /** {@code char buf[N]} filled only by {@code strcpy} from literals, replaced by {@code String}. */
    STRING_COPY("String");

    private final String safeForm;

    IdiomFamily(String safeForm) {
        this.safeForm = safeForm;
    }

    /**
     * Returns the Rust type shape the idiom is rewritten into.
     */
    public String safeForm() {
        return safeForm;
    }

    /**
     * True when the matched declaration allocates, so a later {@code free} can be elided.
     */
    public boolean allocates() {
        return this == HEAP_ALLOCATION || this == ARRAY_ALLOCATION;
    }

    /**
     * True when a later {@code variable = value;} can be expressed in the safe form.
     */
    public boolean canHold(Expr value) {
        boolean single = AllocationShapes.isAllocation(value) && !AllocationShapes.isArrayAllocation(value);
        return switch (this) {
            case HEAP_ALLOCATION -> single;
            case ARRAY_ALLOCATION -> AllocationShapes.isArrayAllocation(value);
            case NULLABLE_POINTER -> single || AllocationShapes.isNullLiteral(value);
            case STRING_COPY -> false;
        };
    }
}
