package com.iimsoft.binassign.domain;

import com.iimsoft.binassign.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.iimsoft.binassign.TestCatalogs.bin;
import static com.iimsoft.binassign.TestCatalogs.material;
import static com.iimsoft.binassign.TestCatalogs.regular;
import static com.iimsoft.binassign.TestCatalogs.regularBin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogTest {

    @Test
    @DisplayName("should keep input order and look up by id")
    void shouldKeepOrderAndLookUp() {
        Catalog catalog = Catalog.load(
                List.of(regular("M2", 1, 1), regular("M1", 2, 2)),
                List.of(regularBin("B9", 5, 0), regularBin("B1", 5, 1)));

        assertThat(catalog.getMaterials()).extracting(Material::getId).containsExactly("M2", "M1");
        assertThat(catalog.getBins()).extracting(Bin::getId).containsExactly("B9", "B1");
        assertThat(catalog.findMaterial("M1").getFrequency()).isEqualTo(2);
        assertThat(catalog.findBin("B1").getCost()).isEqualTo(1.0);
        assertThat(catalog.findMaterial("nope")).isNull();
        assertThat(catalog.indexOfBin("B1")).isEqualTo(1);
        assertThat(catalog.indexOfMaterial("nope")).isEqualTo(-1);
    }

    @Test
    @DisplayName("should not be affected by later changes to the input lists")
    void shouldCopyInput() {
        List<Material> materials = new ArrayList<>(List.of(regular("M1", 1, 1)));
        Catalog catalog = Catalog.load(materials, List.of(regularBin("B1", 5, 0)));
        materials.add(regular("M2", 1, 1));

        assertThat(catalog.materialCount()).isEqualTo(1);
        assertThatThrownBy(() -> catalog.getMaterials().add(regular("M3", 1, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should accept zero cost bins")
    void shouldAcceptZeroCost() {
        Catalog catalog = Catalog.load(List.of(regular("M1", 1, 1)), List.of(regularBin("B1", 5, 0)));
        assertThat(catalog.findBin("B1").getCost()).isZero();
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void duplicateMaterialId() {
            assertThatThrownBy(() -> Catalog.load(
                    List.of(regular("M1", 1, 1), regular("M1", 2, 2)),
                    List.of(regularBin("B1", 5, 1))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("M1")
                    .extracting("subjectId").isEqualTo("M1");
        }

        @Test
        void duplicateBinId() {
            assertThatThrownBy(() -> Catalog.load(
                    List.of(regular("M1", 1, 1)),
                    List.of(regularBin("B1", 5, 1), regularBin("B1", 6, 1))))
                    .isInstanceOf(ValidationException.class)
                    .extracting("subjectId").isEqualTo("B1");
        }

        @Test
        void nonPositiveFrequency() {
            assertThatThrownBy(() -> Catalog.load(List.of(regular("M1", 0, 1)), List.of(regularBin("B1", 5, 1))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("frequency");
        }

        @Test
        void nonPositiveSize() {
            assertThatThrownBy(() -> Catalog.load(List.of(regular("M1", 1, 0)), List.of(regularBin("B1", 5, 1))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("size");
        }

        @Test
        void nonPositiveCapacity() {
            assertThatThrownBy(() -> Catalog.load(List.of(regular("M1", 1, 1)), List.of(regularBin("B1", -5, 1))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("capacity");
        }

        @Test
        void negativeCost() {
            assertThatThrownBy(() -> Catalog.load(List.of(regular("M1", 1, 1)), List.of(regularBin("B1", 5, -0.5))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("cost");
        }

        @Test
        void notANumber() {
            assertThatThrownBy(() -> Catalog.load(List.of(regular("M1", 1, Double.NaN)), List.of(regularBin("B1", 5, 1))))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void unknownCategory() {
            assertThatThrownBy(() -> Catalog.load(
                    List.of(material("M1", 1, 1, "frozen")),
                    List.of(regularBin("B1", 5, 1))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("frozen");
        }

        @Test
        void unknownSlotType() {
            assertThatThrownBy(() -> Catalog.load(
                    List.of(regular("M1", 1, 1)),
                    List.of(bin("B1", 5, 1, "cold"))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("cold");
        }

        @Test
        void blankId() {
            assertThatThrownBy(() -> Catalog.load(List.of(regular(" ", 1, 1)), List.of(regularBin("B1", 5, 1))))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void extendedCategoriesAreConfigurable() {
            CatalogRules rules = new CatalogRules(Set.of("frozen"), Set.of("cold"));
            Catalog catalog = Catalog.load(List.of(material("M1", 1, 1, "frozen")), List.of(bin("B1", 5, 1, "cold")), rules);
            assertThat(catalog.materialCount()).isEqualTo(1);
        }
    }
}
