package io.surfworks.oxbow.audit;

import java.util.Set;

/**
 * Names declared in the audited file that make a use risky.
 *
 * @param externFunctions functions declared in {@code extern} blocks
 * @param mutableStatics  names declared {@code static mut}
 * @param unions          union type names
 */
public record FileSymbols(Set<String> externFunctions, Set<String> mutableStatics, Set<String> unions) {

    public FileSymbols {
        externFunctions = Set.copyOf(externFunctions);
        mutableStatics = Set.copyOf(mutableStatics);
        unions = Set.copyOf(unions);
    }

    public static FileSymbols empty() {
        return new FileSymbols(Set.of(), Set.of(), Set.of());
    }
}
