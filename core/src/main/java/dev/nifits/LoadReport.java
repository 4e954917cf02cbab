/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import dev.nifits.extension.ExtensionKind;
import dev.nifits.extension.StructuralException;

/**
 * Outcome of a load: which kinds were found, missing, or rejected as structurally invalid.
 */
public final class LoadReport {

    /**
     * Load status of one kind.
     */
    public enum Status {
        PRESENT,
        MISSING,
        FAILED
    }

    private final Set<ExtensionKind> present = EnumSet.noneOf(ExtensionKind.class);
    private final Set<ExtensionKind> missing = EnumSet.noneOf(ExtensionKind.class);
    private final Map<ExtensionKind, StructuralException> failures = new EnumMap<>(ExtensionKind.class);

    LoadReport() {
    }

    static LoadReport of(Set<ExtensionKind> populated) {
        LoadReport report = new LoadReport();
        for (ExtensionKind kind : ExtensionKind.values()) {
            if (populated.contains(kind)) {
                report.present.add(kind);
            }
            else {
                report.missing.add(kind);
            }
        }
        return report;
    }

    void recordPresent(ExtensionKind kind) {
        present.add(kind);
    }

    void recordMissing(ExtensionKind kind) {
        missing.add(kind);
    }

    void recordFailure(ExtensionKind kind, StructuralException failure) {
        failures.put(kind, failure);
    }

    public Set<ExtensionKind> present() {
        return Collections.unmodifiableSet(present);
    }

    public Set<ExtensionKind> missing() {
        return Collections.unmodifiableSet(missing);
    }

    public Set<ExtensionKind> failed() {
        return Collections.unmodifiableSet(failures.keySet());
    }

    public Map<ExtensionKind, StructuralException> failures() {
        return Collections.unmodifiableMap(failures);
    }

    public Status status(ExtensionKind kind) {
        if (present.contains(kind)) {
            return Status.PRESENT;
        }
        return failures.containsKey(kind) ? Status.FAILED : Status.MISSING;
    }

    /**
     * @return whether all kinds were present and valid
     */
    public boolean isComplete() {
        return missing.isEmpty() && failures.isEmpty();
    }

    @Override
    public String toString() {
        return "LoadReport[present=" + present + ", missing=" + missing + ", failed=" + failures.keySet() + "]";
    }
}
