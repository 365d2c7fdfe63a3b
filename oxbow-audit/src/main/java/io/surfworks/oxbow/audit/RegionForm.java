package io.surfworks.oxbow.audit;

/**
 * How an unsafe region is introduced.
 */
public enum RegionForm {
    /** An {@code unsafe { ... }} block. */
    BLOCK,
    /** A whole {@code unsafe fn}. */
    FUNCTION
}
