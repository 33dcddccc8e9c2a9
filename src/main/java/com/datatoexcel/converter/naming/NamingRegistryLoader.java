package com.datatoexcel.converter.naming;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loads a {@link NamingRegistry} from YAML with two top-level maps:
 *
 * <pre>
 * columns:
 *   afd: afdrukken
 * tables:
 *   TradbegrotingIbis.mst: meetstaten
 * </pre>
 *
 * A missing section is read as an empty map.
 */
public class NamingRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(NamingRegistryLoader.class);

    public static final String DEFAULT_RESOURCE = "/naming-registry.yml";

    private final ObjectMapper mapper = YAMLMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * Loads the registry bundled with the application.
     */
    public NamingRegistry loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public NamingRegistry loadResource(String resource) {
        try (InputStream in = NamingRegistryLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new NamingRegistryException("Naming registry resource not found: " + resource);
            }
            return read(in, resource);
        } catch (IOException e) {
            throw new NamingRegistryException("Failed to read naming registry " + resource + ": " + e.getMessage(), e);
        }
    }

    public NamingRegistry load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new NamingRegistryException("Failed to read naming registry " + file + ": " + e.getMessage(), e);
        }
    }

    private NamingRegistry read(InputStream in, String source) throws IOException {
        RegistryDocument document = mapper.readValue(in, RegistryDocument.class);
        if (document == null) {
            document = new RegistryDocument();
        }
        NamingRegistry registry = new NamingRegistry(nonNull(document.getColumns()), nonNull(document.getTables()));
        log.debug("Loaded naming registry {} with {} column labels and {} table labels",
                source, registry.columnCount(), registry.tableCount());
        return registry;
    }

    private static Map<String, String> nonNull(Map<String, String> labels) {
        if (labels == null) {
            return Map.of();
        }
        Map<String, String> present = new LinkedHashMap<>();
        labels.forEach((code, label) -> {
            if (code == null || label == null) {
                log.warn("Ignoring naming registry entry without label: {}", code);
            } else {
                present.put(code, label);
            }
        });
        return present;
    }

    @Data
    @NoArgsConstructor
    static class RegistryDocument {
        private Map<String, String> columns = new LinkedHashMap<>();
        private Map<String, String> tables = new LinkedHashMap<>();
    }
}
