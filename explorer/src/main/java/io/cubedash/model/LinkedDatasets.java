package io.cubedash.model;

import java.util.List;
import java.util.UUID;

/**
 * A limited page of source or derived datasets.
 *
 * @param remaining how many more exist beyond {@code datasets}
 */
public record LinkedDatasets(List<Ref> datasets, long remaining) {

    public record Ref(UUID id, String productName) {
    }

    public static LinkedDatasets empty() {
        return new LinkedDatasets(List.of(), 0);
    }
}
