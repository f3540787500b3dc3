package aquiferflow.io;

import aquiferflow.config.ModelDefinition;
import aquiferflow.domain.model.GroundwaterModel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de objetos en archivos JSON, y en particular de las definiciones de
 * modelo ({@link ModelDefinition}).
 */
@Slf4j
public class JsonFileHandler {

    // Reutilizable y seguro entre hilos.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto en la ruta indicada, sobrescribiendo el archivo si ya existe.
     *
     * @throws IOException si no se puede escribir el archivo.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Reconstruye un objeto del tipo indicado a partir de un archivo JSON.
     *
     * @throws IOException si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Carga un modelo. Un directorio de trabajo relativo se resuelve contra la carpeta del archivo.
     *
     * @throws IllegalArgumentException si la definición no describe una malla válida.
     */
    public GroundwaterModel loadModel(Path path) throws IOException {
        ModelDefinition definition = readFromFile(path, ModelDefinition.class);
        return definition.toModel(path.toAbsolutePath().getParent());
    }

    public void saveModel(GroundwaterModel model, Path path) throws IOException {
        writeToFile(ModelDefinition.of(model), path);
    }
}
