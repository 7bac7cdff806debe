package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.config.SheetGenProperties;
import com.example.demo.sheetgen.exception.DefinitionNotFoundException;
import com.example.demo.sheetgen.exception.InvalidRequestException;
import com.example.demo.sheetgen.exception.SheetGenerationException;
import com.example.demo.sheetgen.model.WorkbookRequest;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Pattern;

/**
 * Loads bundled workbook definitions: {@link WorkbookRequest}s stored as YAML or
 * JSON under {@code sheetgen.definitions.location}.
 *
 * A definition named {@code balance-sheet} is looked up as
 * {@code balance-sheet.yaml}, then {@code .yml}, then {@code .json}.
 */
@Slf4j
@Service
public class WorkbookDefinitionLoader {
    private static final String[] EXTENSIONS = {".yaml", ".yml", ".json"};
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final ResourceLoader resourceLoader;
    private final SheetGenProperties properties;

    public WorkbookDefinitionLoader(ResourceLoader resourceLoader, SheetGenProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    public WorkbookRequest load(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new InvalidRequestException("Invalid workbook definition name '" + name + "'");
        }
        String location = properties.getDefinitions().getLocation();
        String base = location.endsWith("/") ? location : location + "/";
        for (String ext : EXTENSIONS) {
            Resource resource = resourceLoader.getResource(base + name + ext);
            if (resource.exists()) {
                log.info("Loading workbook definition '{}' from {}", name, resource.getDescription());
                return parse(resource, ext.equals(".json") ? jsonMapper : yamlMapper);
            }
        }
        log.debug("No workbook definition '{}' under {}", name, base);
        throw new DefinitionNotFoundException(name);
    }

    private WorkbookRequest parse(Resource resource, ObjectMapper mapper) {
        try (InputStream in = resource.getInputStream()) {
            return mapper.readValue(in, WorkbookRequest.class);
        } catch (IOException e) {
            log.error("Failed to parse workbook definition: {}", resource.getDescription(), e);
            throw new SheetGenerationException("DEFINITION_PARSE_ERROR",
                    "Failed to parse workbook definition: " + resource.getDescription(), e);
        }
    }
}
