package seaecho.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import seaecho.config.ScatteringParameterSet;
import seaecho.domain.result.ScatteringResultSet;
import seaecho.domain.result.SweepAxis;
import seaecho.domain.result.TsExportRow;
import seaecho.domain.scatterer.BubbleState;
import seaecho.domain.scatterer.GasProperties;
import seaecho.domain.scatterer.GasSpecies;
import seaecho.domain.scatterer.ScattererType;
import seaecho.domain.scatterer.SolidMaterial;
import seaecho.domain.water.SeawaterState;
import seaecho.physics.model.EmpiricalSeawaterModel;
import seaecho.physics.model.IdealGasBubbleModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas de {@link JsonFileHandler}: conjuntos de parámetros y filas exportadas.
 */
class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    @Test
    @DisplayName("Debería escribir un conjunto de parámetros en JSON, creando los directorios intermedios")
    void writeParameterSet_shouldCreateAndWriteJsonFile() throws IOException {
        // --- 1. Arrange ---
        ScatteringParameterSet parameters = ScatteringParameterSet.getReferenceBubbleSweep()
                .withFrequencies(new double[]{1.0, 4.5});
        Path outputFile = tempDir.resolve("salida").resolve("barrido.json");

        // --- 2. Act ---
        jsonFileHandler.writeParameterSet(parameters, outputFile.toString());

        // --- 3. Assert ---
        assertThat(outputFile).exists();
        String fileContent = Files.readString(outputFile);
        assertThat(fileContent)
                .contains("\"frequencies\" : [ 1.0, 4.5 ]")
                .contains("\"models\" : [ \"Medwin_Clay\" ]")
                .contains("\"scattererType\" : \"GAS_BUBBLE\"");
    }

    @Test
    @DisplayName("Debería lanzar IOException al intentar leer un archivo que no existe")
    void readParameterSet_whenFileDoesNotExist_shouldThrowIOException() {
        Path nonExistentFile = tempDir.resolve("imaginary.json");

        IOException exception = assertThrows(IOException.class,
                () -> jsonFileHandler.readParameterSet(nonExistentFile.toString()));

        assertThat(exception.getMessage()).contains("El archivo especificado no existe");
    }

    @Test
    @DisplayName("Debería lanzar IOException al leer un JSON mal formado")
    void readParameterSet_whenJsonIsMalformed_shouldThrowIOException() throws IOException {
        String malformedJson = """
        {
          "frequencies": [38.0],
          "diameter": 0.002,
        }
        """;
        Path inputFile = tempDir.resolve("malformed.json");
        Files.writeString(inputFile, malformedJson);

        assertThrows(IOException.class, () -> jsonFileHandler.readParameterSet(inputFile.toString()));
    }

    // --------------------------------------------------------------------------
    // Conjuntos de parámetros
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Debería leer un conjunto de parámetros de esfera sólida con valores por defecto")
    void readParameterSet_shouldParseAndApplyDefaults() throws IOException {
        // --- 1. Arrange ---
        String jsonContent = """
        {
          "frequencies": [18.0, 38.0, 70.0],
          "diameter": 0.0381,
          "models": ["Elastic_Sphere_Modal"],
          "temperature": 10.0,
          "salinity": 35.0,
          "depth": 100.0,
          "scattererType": "SOLID_SPHERE",
          "material": "tungsten-carbide"
        }
        """;
        Path inputFile = tempDir.resolve("sphere.json");
        Files.writeString(inputFile, jsonContent);

        // --- 2. Act ---
        ScatteringParameterSet parameters = jsonFileHandler.readParameterSet(inputFile.toString());

        // --- 3. Assert ---
        assertThat(parameters.frequencies()).containsExactly(18.0, 38.0, 70.0);
        assertThat(parameters.models()).containsExactly("Elastic_Sphere_Modal");
        assertThat(parameters.scattererType()).isEqualTo(ScattererType.SOLID_SPHERE);
        assertThat(parameters.material()).isEqualTo(SolidMaterial.TUNGSTEN_CARBIDE);
        assertThat(parameters.ph()).isEqualTo(ScatteringParameterSet.DEFAULT_PH);
        assertThat(parameters.gasSpecies()).isEqualTo(GasSpecies.AIR);
    }

    @Test
    @DisplayName("Un conjunto de parámetros escrito y releído es igual al original")
    void parameterSet_writeAndRead_shouldResultInEqualObjects() throws IOException {
        ScatteringParameterSet original = ScatteringParameterSet.getReferenceBubbleSweep()
                .withGasSpecies(GasSpecies.METHANE)
                .withPh(7.6);
        Path testFile = tempDir.resolve("reference.json");

        jsonFileHandler.writeParameterSet(original, testFile.toString());
        ScatteringParameterSet readBack = jsonFileHandler.readParameterSet(testFile.toString());

        assertThat(readBack).isEqualTo(original);
    }

    @Test
    @DisplayName("Un conjunto de parámetros sin frecuencias no supera la validación")
    void readParameterSet_invalidContent_shouldThrowIllegalArgument() throws IOException {
        String jsonContent = """
        {
          "frequencies": [],
          "diameter": 0.002,
          "models": ["Medwin_Clay"],
          "temperature": 20.0,
          "salinity": 0.0,
          "depth": 10.0
        }
        """;
        Path inputFile = tempDir.resolve("empty.json");
        Files.writeString(inputFile, jsonContent);

        assertThrows(IllegalArgumentException.class, () -> jsonFileHandler.readParameterSet(inputFile.toString()));
    }

    @Test
    @DisplayName("Un material desconocido se rechaza al leer")
    void readParameterSet_unknownMaterial_shouldFail() throws IOException {
        String jsonContent = """
        {
          "frequencies": [38.0],
          "diameter": 0.0381,
          "models": ["Elastic_Sphere_Modal"],
          "temperature": 10.0,
          "salinity": 35.0,
          "depth": 100.0,
          "scattererType": "SOLID_SPHERE",
          "material": "unobtainium"
        }
        """;
        Path inputFile = tempDir.resolve("unknown.json");
        Files.writeString(inputFile, jsonContent);

        // Jackson envuelve la excepción del @JsonCreator en una IOException
        IOException exception = assertThrows(IOException.class,
                () -> jsonFileHandler.readParameterSet(inputFile.toString()));
        assertThat(exception.getMessage()).contains("unobtainium");
    }

    // --------------------------------------------------------------------------
    // Exportación tabular
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Las filas exportadas se releen agrupadas por modelo")
    void exportRows_writeAndRead_shouldKeepModelMajorOrder() throws IOException {
        // --- 1. Arrange ---
        SeawaterState water = new EmpiricalSeawaterModel().derive(20.0, 10.0, 0.0, 8.0);
        BubbleState bubble = new IdealGasBubbleModel().derive(2e-3, GasProperties.AIR, water);
        Map<String, double[]> ts = new LinkedHashMap<>();
        ts.put("Medwin_Clay", new double[]{-70.0, -30.5});
        ts.put("Breathing", new double[]{-71.0, -31.5});
        ScatteringResultSet result = new ScatteringResultSet(
                ScatteringParameterSet.getReferenceBubbleSweep().withFrequencies(new double[]{1.0, 4.5}),
                SweepAxis.FREQUENCY,
                new double[]{1.0, 4.5},
                new double[]{2e-3, 2e-3},
                new double[]{0.004, 0.019},
                ts, water, bubble, 12L);
        Path testFile = tempDir.resolve("export.json");

        // --- 2. Act ---
        jsonFileHandler.writeExportRows(result, testFile.toString());
        List<TsExportRow> rows = jsonFileHandler.readExportRows(testFile.toString());

        // --- 3. Assert ---
        assertThat(rows).hasSize(4);
        assertThat(rows).extracting(TsExportRow::model)
                .containsExactly("Medwin_Clay", "Medwin_Clay", "Breathing", "Breathing");
        assertThat(rows).extracting(TsExportRow::tsDb).containsExactly(-70.0, -30.5, -71.0, -31.5);
        assertThat(rows.get(1).frequencyKhz()).isEqualTo(4.5);
        assertThat(rows.get(0).soundSpeed()).isEqualTo(water.soundSpeed());
        assertThat(rows).isEqualTo(result.toExportRows());
    }
}
