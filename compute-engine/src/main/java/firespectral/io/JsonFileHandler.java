package firespectral.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import firespectral.config.SolverConfig;
import firespectral.domain.dto.ExperimentReportDTO;
import firespectral.domain.simulation.ExperimentResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Gestiona la serialización (escritura) y deserialización (lectura) de objetos
 * hacia y desde archivos JSON: informes de experimentos y configuraciones del solver.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe y costoso de crear: una única instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON en la ruta especificada.
     * Si el archivo ya existe, será sobrescrito.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath La ruta completa del archivo de destino (ej: "out/experimento_n24.json").
     * @param <T>      El tipo del objeto a serializar.
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path);

        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON para reconstruir un objeto de un tipo específico.
     *
     * @param filePath   La ruta del archivo JSON a leer.
     * @param objectType El tipo de clase al que se debe convertir el JSON (ej: SolverConfig.class).
     * @param <T>        El tipo del objeto a deserializar.
     * @return Una nueva instancia del objeto reconstruido desde el JSON.
     * @throws IOException Si el archivo no se encuentra o hay un error de lectura o formato.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Deserializando archivo {} a un objeto de tipo {}", path, objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path, e);
            throw e;
        }
    }

    /**
     * Exporta el informe de un experimento (parámetros, coste y trayectoria completa).
     */
    public void writeExperimentReport(ExperimentResult result, String filePath) throws IOException {
        writeToFile(ExperimentReportDTO.from(result), filePath);
    }

    /**
     * Lee la configuración del integrador desde disco. Los campos ausentes toman su valor por defecto.
     */
    public SolverConfig readSolverConfig(String filePath) throws IOException {
        return readFromFile(filePath, SolverConfig.class);
    }
}
