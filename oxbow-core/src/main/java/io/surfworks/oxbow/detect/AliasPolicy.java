package io.surfworks.oxbow.detect;

/**
 * How much data-flow evidence the detector requires before proposing an ownership upgrade.
 */
public enum AliasPolicy {

    /**
     * Match one declaration at a time with no aliasing check.
     *
     * <p>A pointer that is later copied or handed to another function is still proposed;
     * the generated code may then fail to compile, which the differential tester surfaces.
     */
    STRUCTURAL,

    /**
     * Reject candidates whose variable escapes the declaring function body: copied into
     * another variable, returned, passed to any call other than {@code free}, or
     * address-taken.
     */
    CONSERVATIVE
}
