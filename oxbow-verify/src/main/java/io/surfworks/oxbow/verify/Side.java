package io.surfworks.oxbow.verify;

/**
 * The two programs compared by a differential test.
 */
public enum Side {
    ORIGINAL("C", "input.c", "c_binary"),
    TRANSLATED("Rust", "input.rs", "rust_binary");

    private final String label;
    private final String sourceFileName;
    private final String binaryFileName;

    Side(String label, String sourceFileName, String binaryFileName) {
        this.label = label;
        this.sourceFileName = sourceFileName;
        this.binaryFileName = binaryFileName;
    }

    /** Language name used in messages and divergence reports. */
    public String label() {
        return label;
    }

    public String sourceFileName() {
        return sourceFileName;
    }

    public String binaryFileName() {
        return binaryFileName;
    }
}
