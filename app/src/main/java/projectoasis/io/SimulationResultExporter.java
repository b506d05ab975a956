package projectoasis.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import projectoasis.domain.simulation.SimulationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exporta e importa resultados de simulación en JSON.
 * <p>
 * Las fechas se escriben con el módulo JSR-310 registrado automáticamente. Un acuífero
 * que nunca se agota aparece con {@code "yearsRemaining": null}.
 */
@Slf4j
public class SimulationResultExporter {

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Escribe el resultado en {@code path}, sobrescribiendo el archivo si ya existe.
     *
     * @throws IOException si no se puede crear el directorio o escribir el archivo.
     */
    public void writeToFile(SimulationResult result, Path path) throws IOException {
        log.info("Exportando resultado {}..{} a {}", result.startDate(), result.endDate(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), result);
            log.debug("Exportación completada.");
        } catch (IOException e) {
            log.error("Error al escribir el resultado en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public SimulationResult readFromFile(Path path) throws IOException {
        log.info("Leyendo resultado desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), SimulationResult.class);
        } catch (IOException e) {
            log.error("Error al leer o parsear el resultado desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public String toJson(SimulationResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }
}
