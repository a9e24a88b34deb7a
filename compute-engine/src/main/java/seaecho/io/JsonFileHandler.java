package seaecho.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import seaecho.config.ScatteringParameterSet;
import seaecho.domain.result.ScatteringResultSet;
import seaecho.domain.result.TsExportRow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Persistencia en JSON de las entradas y salidas del motor.
 * <p>
 * Entradas: conjuntos de parámetros de barrido, siempre validados al leerse.
 * Salidas: la forma tabular plana del resultado ({@link TsExportRow}), una fila por
 * par punto-modelo agrupada por modelo.
 */
@Slf4j
public class JsonFileHandler {

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Guarda un conjunto de parámetros para poder repetir el barrido. Sobrescribe el archivo.
     */
    public void writeParameterSet(ScatteringParameterSet parameters, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Guardando conjunto de parámetros ({} frecuencias, modelos {}) en {}",
                parameters.frequencyCount(), parameters.models(), path);
        write(parameters, path);
    }

    /**
     * Lee y valida un conjunto de parámetros de barrido.
     *
     * @throws IOException              Si el archivo no existe o no es JSON válido.
     * @throws IllegalArgumentException Si el contenido no supera la validación.
     */
    public ScatteringParameterSet readParameterSet(String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Cargando conjunto de parámetros desde {}", path);
        ScatteringParameterSet parameters = read(path, ScatteringParameterSet.class);
        parameters.validate();
        return parameters;
    }

    /**
     * Escribe la forma tabular plana del resultado (agrupada por modelo).
     */
    public void writeExportRows(ScatteringResultSet result, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        List<TsExportRow> rows = result.toExportRows();
        log.info("Exportando {} filas de {} modelos a {}", rows.size(), result.getModelNames().size(), path);
        write(rows, path);
    }

    /**
     * Lee filas exportadas previamente, en el orden en que se escribieron.
     */
    public List<TsExportRow> readExportRows(String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Cargando filas exportadas desde {}", path);
        return List.of(read(path, TsExportRow[].class));
    }

    private static void write(Object data, Path path) throws IOException {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("No se pudo escribir {}", path, e);
            throw e;
        }
    }

    private static <T> T read(Path path, Class<T> type) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("No se pudo leer {} como {}", path, type.getSimpleName(), e);
            throw e;
        }
    }
}
