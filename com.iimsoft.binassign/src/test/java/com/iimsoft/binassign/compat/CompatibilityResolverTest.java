package com.iimsoft.binassign.compat;

import com.iimsoft.binassign.domain.Catalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.iimsoft.binassign.TestCatalogs.bin;
import static com.iimsoft.binassign.TestCatalogs.material;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CompatibilityResolverTest {

    private final CompatibilityResolver resolver = new CompatibilityResolver();

    @Test
    void shouldResolveMatrixByCatalogIndex() {
        Catalog catalog = Catalog.load(
                List.of(material("M1", 3, 5, "fragile"),
                        material("M2", 5, 4, "regular"),
                        material("M3", 1, 6, "hazardous")),
                List.of(bin("B1", 15, 1, "safe"),
                        bin("B2", 8, 2, "regular"),
                        bin("B3", 10, 3, "special")));

        CompatibilityMatrix matrix = resolver.resolve(catalog, CompatibilityRuleSet.warehouseDefaults());

        assertThat(matrix.materialCount()).isEqualTo(3);
        assertThat(matrix.binCount()).isEqualTo(3);
        assertThat(matrix.isCompatible(0, 0)).isTrue();
        assertThat(matrix.isCompatible(0, 1)).isFalse();
        assertThat(matrix.isCompatible(0, 2)).isFalse();
        assertThat(matrix.compatibleBinCount(1)).isEqualTo(3);
        assertThat(matrix.isCompatible(2, 2)).isTrue();
        assertThat(matrix.compatibleBinCount(2)).isEqualTo(1);
        assertThat(matrix.compatiblePairCount()).isEqualTo(5);
        assertThat(matrix.density()).isCloseTo(5.0 / 9.0, within(1e-12));
    }

    @Test
    void emptyCatalogGivesEmptyMatrix() {
        Catalog catalog = Catalog.load(List.of(), List.of());
        CompatibilityMatrix matrix = resolver.resolve(catalog, CompatibilityRuleSet.warehouseDefaults());

        assertThat(matrix.compatiblePairCount()).isZero();
        assertThat(matrix.density()).isZero();
    }
}
