package io.surfworks.oxbow.audit;

/**
 * What an unsafe region most likely does, in decreasing order of classification priority.
 */
public enum RiskKind {
    RAW_POINTER_DEREF,
    TRANSMUTE,
    INLINE_ASSEMBLY,
    FFI_CALL,
    UNION_OR_MUTABLE_GLOBAL,
    OTHER
}
