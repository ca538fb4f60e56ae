package projectapogee.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import projectapogee.config.DesignConfig;
import projectapogee.domain.design.DesignResult;
import projectapogee.domain.flight.FlightSample;
import projectapogee.domain.flight.TrajectoryResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Lectura de la configuración de diseño y escritura de resultados en JSON.
 * <p>
 * La capa de presentación persiste con esta clase; el motor numérico nunca toca el disco.
 */
@Slf4j
public class DesignFileHandler {

    // El ObjectMapper es costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Los campos derivados que aparecen al escribir se ignoran al volver a leer
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Lee una configuración de diseño. Los bloques numéricos omitidos toman sus valores por defecto.
     *
     * @param filePath Ruta del JSON.
     * @return La configuración (sin validar; la valida el diseñador).
     * @throws IOException Si el archivo no existe o no es un JSON válido.
     */
    public DesignConfig readConfig(Path filePath) throws IOException {
        log.info("Leyendo configuración de diseño desde {}", filePath.toAbsolutePath());
        if (!Files.exists(filePath)) {
            throw new IOException("El archivo especificado no existe: " + filePath.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(filePath.toFile(), DesignConfig.class);
        } catch (IOException e) {
            log.error("Error al leer o parsear la configuración desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Escribe una configuración (útil para generar plantillas editables).
     */
    public void writeConfig(DesignConfig config, Path filePath) throws IOException {
        write(config, filePath);
    }

    /**
     * Escribe el diseño completo. Si el archivo existe se sobrescribe.
     */
    public void writeResult(DesignResult result, Path filePath) throws IOException {
        write(result, filePath);
    }

    /**
     * Escribe sólo la tabla de muestras de una trayectoria, para graficar.
     */
    public void writeTrajectory(TrajectoryResult trajectory, Path filePath) throws IOException {
        List<FlightSample> samples = trajectory.getSamples();
        write(samples, filePath);
    }

    /**
     * Lee una tabla de muestras escrita por {@link #writeTrajectory}.
     */
    public List<FlightSample> readTrajectory(Path filePath) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("El archivo especificado no existe: " + filePath.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(filePath.toFile(),
                    objectMapper.getTypeFactory().constructCollectionType(List.class, FlightSample.class));
        } catch (IOException e) {
            log.error("Error al leer la trayectoria desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    private void write(Object data, Path filePath) throws IOException {
        log.info("Serializando {} a {}", data.getClass().getSimpleName(), filePath.toAbsolutePath());
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(filePath.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }
}
