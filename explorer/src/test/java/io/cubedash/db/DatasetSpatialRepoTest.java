package io.cubedash.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DatasetSpatialRepoTest {

    @Test
    void plainKeysAreQuoted() {
        assertThat(DatasetSpatialRepo.jsonPath(List.of("properties", "eo:cloud_cover")))
                .isEqualTo("'{\"properties\",\"eo:cloud_cover\"}'");
    }

    @Test
    void separatorsStayInsideTheKey() {
        assertThat(DatasetSpatialRepo.jsonPath(List.of("a,b", "c}d", "with space")))
                .isEqualTo("'{\"a,b\",\"c}d\",\"with space\"}'");
    }

    @Test
    void quotesAndBackslashesAreEscaped() {
        assertThat(DatasetSpatialRepo.jsonPath(List.of("say \"hi\"", "back\\slash", "it's")))
                .isEqualTo("'{\"say \\\"hi\\\"\",\"back\\\\slash\",\"it''s\"}'");
    }
}
