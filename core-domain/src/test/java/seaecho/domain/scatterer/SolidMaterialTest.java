package seaecho.domain.scatterer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolidMaterialTest {

    @Test
    @DisplayName("fromName acepta variantes de mayúsculas, guiones y espacios")
    void fromName_shouldNormalizeInput() {
        assertThat(SolidMaterial.fromName("tungsten-carbide")).isEqualTo(SolidMaterial.TUNGSTEN_CARBIDE);
        assertThat(SolidMaterial.fromName("Stainless Steel")).isEqualTo(SolidMaterial.STAINLESS_STEEL);
        assertThat(SolidMaterial.fromName("copper")).isEqualTo(SolidMaterial.COPPER);
    }

    @Test
    @DisplayName("Un material desconocido produce un error que lista el catálogo")
    void fromName_unknown_shouldListAvailable() {
        assertThatThrownBy(() -> SolidMaterial.fromName("unobtainium"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unobtainium")
                .hasMessageContaining("TUNGSTEN_CARBIDE");
    }

    @Test
    @DisplayName("Las velocidades del catálogo cumplen c_L > c_T > 0")
    void catalog_shouldBePhysicallyConsistent() {
        for (SolidMaterial material : SolidMaterial.values()) {
            assertThat(material.density()).isPositive();
            assertThat(material.longitudinalSpeed()).isGreaterThan(material.transverseSpeed());
            assertThat(material.transverseSpeed()).isPositive();
        }
    }
}
