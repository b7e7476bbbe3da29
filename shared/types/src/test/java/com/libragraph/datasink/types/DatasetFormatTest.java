package com.libragraph.datasink.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DatasetFormatTest {

    @Test
    void shouldListStructuredFormatsInPriorityOrder() {
        assertThat(DatasetFormat.structured())
                .startsWith(DatasetFormat.JSON_LD, DatasetFormat.TURTLE)
                .doesNotContain(DatasetFormat.RAW);
    }

    @Test
    void shouldResolveTagIgnoringCase() {
        assertThat(DatasetFormat.fromTag("Turtle")).isEqualTo(DatasetFormat.TURTLE);
        assertThat(DatasetFormat.fromTag("raw")).isEqualTo(DatasetFormat.RAW);
    }

    @Test
    void shouldRejectUnknownTag() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> DatasetFormat.fromTag("yaml"))
                .withMessageContaining("yaml");
    }

    @Test
    void rawIsNotStructured() {
        assertThat(DatasetFormat.RAW.isStructured()).isFalse();
        assertThat(DatasetFormat.RAW.mediaType()).isEqualTo("application/octet-stream");
    }

    @Test
    void shouldMapCatalogItemTypeFromIri() {
        assertThat(CatalogItemType.fromTypeIri("http://www.w3.org/ns/dcat#Dataset"))
                .isEqualTo(CatalogItemType.DATASET);
        assertThatIllegalArgumentException()
                .isThrownBy(() -> CatalogItemType.fromTypeIri("urn:x"));
    }
}
