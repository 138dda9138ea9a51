package com.tba3.mock.parser;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tba3.mock.booklet.BookletCatalog;
import com.tba3.mock.config.ConfigModels.*;
import com.tba3.mock.config.ConfigStore;
import com.tba3.mock.error.ConfigValidationException;
import com.tba3.mock.validation.ConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

@Component
public class ConfigYamlParser {
    private static final Logger log = LoggerFactory.getLogger(ConfigYamlParser.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ConfigValidator validator;

    public ConfigYamlParser(ConfigValidator validator) {
        this.validator = validator;
    }

    public ConfigStore load(Path configDir, BookletCatalog catalog) {
        GroupsFile groups = read(configDir.resolve("groups.yml"), GroupsFile.class, GroupsFile::empty);
        SchoolsFile schools = read(configDir.resolve("schools.yml"), SchoolsFile.class, SchoolsFile::empty);
        StatesFile states = read(configDir.resolve("states.yml"), StatesFile.class, StatesFile::empty);
        EquivalenceTablesFile tables = read(configDir.resolve("equivalence_tables.yml"),
                EquivalenceTablesFile.class, EquivalenceTablesFile::empty);

        ConfigStore store = ConfigStore.of(groups, schools, states, tables, catalog, validator);
        log.info("Loaded {} groups, {} schools, {} states, {} equivalence tables from {}",
                store.groups().size(), store.schools().size(), store.states().size(),
                store.equivalenceTableCount(), configDir);
        return store;
    }

    <T> T read(Path file, Class<T> type, Supplier<T> missing) {
        if (!Files.isRegularFile(file)) {
            log.warn("Config file not found: {}", file);
            return missing.get();
        }
        try {
            T value = mapper.readValue(file.toFile(), type);
            return value != null ? value : missing.get();
        } catch (JacksonException e) {
            throw new ConfigValidationException(file.getFileName().toString(), e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }
}
