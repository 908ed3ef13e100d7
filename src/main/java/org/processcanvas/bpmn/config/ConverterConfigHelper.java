package org.processcanvas.bpmn.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.config.models.ConverterConfig;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;

/**
 * Loads and validates the converter configuration.
 */
@Slf4j
public class ConverterConfigHelper {
    private static final String DEFAULTS_RESOURCE = "converter-defaults.json";
    private static final String SCHEMA_RESOURCE = "schema/converter_config_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper().setDefaultMergeable(true);
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads the configuration shipped on the classpath.
     *
     * @return a fresh configuration instance
     * @throws UncheckedIOException if the defaults cannot be read
     */
    public static ConverterConfig loadDefaults() {
        try (InputStream in = openResource(DEFAULTS_RESOURCE)) {
            return mapper.readValue(in, ConverterConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read converter defaults: " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Loads a user configuration file on top of the defaults.
     * The file is validated against the configuration schema first.
     *
     * @param configFilePath path of a JSON configuration file
     * @return the defaults overridden by the values of the file
     * @throws IllegalArgumentException if the file does not match the schema
     */
    public static ConverterConfig loadConfigFile(String configFilePath) throws IOException {
        validateConfigFile(configFilePath);
        ConverterConfig config = loadDefaults();
        return mapper.readerForUpdating(config).readValue(new File(configFilePath));
    }

    /**
     * Validates a configuration file against {@code schema/converter_config_schema.json}.
     *
     * @param configFilePath path of a JSON configuration file
     * @return the (empty) set of validation messages
     * @throws IllegalArgumentException if the file is not valid
     */
    public static Set<ValidationMessage> validateConfigFile(String configFilePath) throws IOException {
        JsonSchema schema;
        try (InputStream schemaStream = openResource(SCHEMA_RESOURCE)) {
            JsonNode schemaNode = mapper.readTree(schemaStream);
            schema = factory.getSchema(schemaNode);
        }

        JsonNode configNode = mapper.readTree(new File(configFilePath));
        Set<ValidationMessage> result = schema.validate(configNode);
        if (!result.isEmpty()) {
            result.forEach(message -> log.warn("Invalid converter config {}: {}", configFilePath, message.getMessage()));
            throw new IllegalArgumentException("Converter config is invalid: " + configFilePath + " " + result);
        }
        log.debug("Converter config {} is valid", configFilePath);
        return result;
    }

    /**
     * Picks the colour for the lane discovered at the given index, cycling through the palette.
     */
    public static String laneColor(ConverterConfig config, int index) {
        return pick(config.lanes.palette, index);
    }

    /**
     * Picks the colour for the pool discovered at the given index, cycling through the palette.
     */
    public static String poolColor(ConverterConfig config, int index) {
        return pick(config.pools.palette, index);
    }

    private static String pick(List<String> palette, int index) {
        if (palette == null || palette.isEmpty()) {
            return null;
        }
        return palette.get(index % palette.size());
    }

    private static InputStream openResource(String resourcePath) {
        InputStream in = ConverterConfigHelper.class.getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) {
            throw new IllegalArgumentException("Resource not found on classpath: " + resourcePath);
        }
        return in;
    }
}
