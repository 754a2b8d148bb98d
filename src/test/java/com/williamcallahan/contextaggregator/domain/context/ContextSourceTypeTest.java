package com.williamcallahan.contextaggregator.domain.context;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for source and task identifier resolution.
 */
class ContextSourceTypeTest {

    @Test
    void fromIdAcceptsWireIdsAndRelaxedVariants() {
        assertThat(ContextSourceType.fromId("vector_db")).isEqualTo(ContextSourceType.VECTOR_DB);
        assertThat(ContextSourceType.fromId("vector-db")).isEqualTo(ContextSourceType.VECTOR_DB);
        assertThat(ContextSourceType.fromId("VECTORDB")).isEqualTo(ContextSourceType.VECTOR_DB);
        assertThat(ContextSourceType.fromId(" Web_Search ")).isEqualTo(ContextSourceType.WEB_SEARCH);
    }

    @Test
    void fromIdRejectsUnknownAndBlankIdentifiers() {
        assertThatThrownBy(() -> ContextSourceType.fromId("ftp"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ftp");
        assertThatThrownBy(() -> ContextSourceType.fromId(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringIsTheWireId() {
        assertThat(ContextSourceType.LIVE_API).hasToString("live_api");
    }

    @Test
    void taskTypeResolvesCaseInsensitively() {
        assertThat(TaskType.fromId("Documentation")).isEqualTo(TaskType.DOCUMENTATION);
        assertThat(TaskType.IMPLEMENTATION.wireId()).isEqualTo("implementation");
        assertThatThrownBy(() -> TaskType.fromId("deploy")).isInstanceOf(IllegalArgumentException.class);
    }
}
