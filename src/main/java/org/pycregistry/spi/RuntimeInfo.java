package org.pycregistry.spi;

import java.util.List;

/**
 * Identity of a live runtime as reported by an {@link IRuntimeProbe}.
 *
 * @param versionComponents  numeric version components, e.g. {@code [3, 8, 5]}.
 * @param releaseLevel       the release level.
 * @param serial             the pre-release serial, ignored for {@link ReleaseLevel#FINAL}.
 * @param implementationName the implementation name (e.g. "CPython", "PyPy"), or {@code null}.
 */
public record RuntimeInfo(List<Integer> versionComponents,
                          ReleaseLevel releaseLevel,
                          int serial,
                          String implementationName) {

    public RuntimeInfo {
        if (versionComponents == null || versionComponents.isEmpty()) {
            throw new IllegalArgumentException("Runtime version must have at least one component");
        }
        if (releaseLevel == null) {
            throw new IllegalArgumentException("Release level must not be null");
        }
        versionComponents = List.copyOf(versionComponents);
    }
}
