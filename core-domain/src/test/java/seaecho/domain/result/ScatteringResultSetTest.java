package seaecho.domain.result;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import seaecho.config.ScatteringParameterSet;
import seaecho.domain.scatterer.SolidMaterial;
import seaecho.domain.scatterer.SolidSphere;
import seaecho.domain.water.SeawaterState;
import seaecho.physics.model.EmpiricalSeawaterModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScatteringResultSetTest {

    private ScatteringParameterSet params;
    private SeawaterState water;
    private SolidSphere sphere;

    @BeforeEach
    void setUp() {
        params = ScatteringParameterSet.builder()
                .frequencies(new double[]{10.0, 20.0})
                .diameter(0.02)
                .models(List.of("A", "B"))
                .temperature(10.0)
                .salinity(35.0)
                .depth(100.0)
                .build();
        water = new EmpiricalSeawaterModel().derive(10.0, 100.0, 35.0, 8.0);
        sphere = new SolidSphere(0.01, SolidMaterial.COPPER);
    }

    private ScatteringResultSet buildResult(double[] tsA) {
        Map<String, double[]> ts = new LinkedHashMap<>();
        ts.put("B", new double[]{-40.0, -41.0});
        ts.put("A", tsA);
        return new ScatteringResultSet(params, SweepAxis.FREQUENCY,
                new double[]{10.0, 20.0}, new double[]{0.02, 0.02}, new double[]{0.4, 0.8},
                ts, water, sphere, 12L);
    }

    @Test
    @DisplayName("Las filas de exportación se agrupan por modelo en el orden de solicitud")
    void toExportRows_shouldBeModelMajor() {
        // ARRANGE
        ScatteringResultSet result = buildResult(new double[]{-50.0, -51.0});

        // ACT
        List<TsExportRow> rows = result.toExportRows();

        // ASSERT
        assertThat(rows).hasSize(4);
        assertThat(rows).extracting(TsExportRow::model).containsExactly("B", "B", "A", "A");
        assertThat(rows.get(2).frequencyKhz()).isEqualTo(10.0);
        assertThat(rows.get(2).tsDb()).isEqualTo(-50.0);
        assertThat(rows.get(3).frequencyKhz()).isEqualTo(20.0);
        assertThat(rows.get(0).scattererDiameter()).isEqualTo(0.02);
        assertThat(rows.get(0).salinity()).isEqualTo(35.0);
        assertThat(rows.get(0).soundSpeed()).isEqualTo(water.soundSpeed());
        assertThat(result.getModelNames()).containsExactly("B", "A");
    }

    @Test
    @DisplayName("El resultado es inmutable: ni el array de entrada ni el devuelto lo alteran")
    void resultSet_shouldBeImmutable() {
        // ARRANGE
        double[] tsA = {-50.0, -51.0};
        ScatteringResultSet result = buildResult(tsA);

        // ACT
        tsA[0] = 0.0;
        result.getTs("A")[1] = 0.0;
        result.getKa()[0] = 0.0;
        result.getTs().get("B")[0] = 0.0;

        // ASSERT
        assertThat(result.getTs("A")).containsExactly(-50.0, -51.0);
        assertThat(result.getTs("B")).containsExactly(-40.0, -41.0);
        assertThat(result.getKa()).containsExactly(0.4, 0.8);
        assertThat(result.getPointCount()).isEqualTo(2);
        assertThat(result.getComputationTime()).isEqualTo(12L);
    }

    @Test
    @DisplayName("Series desalineadas o modelos inexistentes se rechazan")
    void resultSet_misalignedOrUnknown_shouldThrow() {
        assertThatThrownBy(() -> buildResult(new double[]{-50.0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("A");

        ScatteringResultSet result = buildResult(new double[]{-50.0, -51.0});
        assertThatThrownBy(() -> result.getTs("Modal"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Modal");
    }
}
