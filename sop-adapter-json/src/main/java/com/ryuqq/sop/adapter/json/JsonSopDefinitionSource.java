package com.ryuqq.sop.adapter.json;

import com.ryuqq.sop.core.exception.DefinitionException;
import com.ryuqq.sop.core.model.SopDefinition;
import com.ryuqq.sop.core.spi.SopDefinitionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON document backed implementation of {@link SopDefinitionSource}.
 *
 * <p>A definition named {@code X} is read from {@code X.json} under either a classpath
 * prefix or a filesystem directory. Parsed definitions are cached; failed loads are not,
 * so a corrected document is picked up on the next call.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * SopDefinitionSource source = JsonSopDefinitionSource.fromClasspath("sops");
 * SopDefinition sop = source.load("emergency_maintenance");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonSopDefinitionSource implements SopDefinitionSource {

    private static final Logger log = LoggerFactory.getLogger(JsonSopDefinitionSource.class);

    private static final String EXTENSION = ".json";

    private final DocumentLocator locator;
    private final SopDefinitionParser parser;
    private final ConcurrentHashMap<String, SopDefinition> cache = new ConcurrentHashMap<>();

    private JsonSopDefinitionSource(DocumentLocator locator, SopDefinitionParser parser) {
        this.locator = locator;
        this.parser = parser;
    }

    /**
     * Reads documents from the classpath.
     *
     * @param prefix resource prefix such as {@code "sops"} (empty for the root)
     * @return the source
     */
    public static JsonSopDefinitionSource fromClasspath(String prefix) {
        return fromClasspath(prefix, new SopDefinitionParser());
    }

    public static JsonSopDefinitionSource fromClasspath(String prefix, SopDefinitionParser parser) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        String base = prefix.isEmpty() || prefix.endsWith("/") ? prefix : prefix + "/";
        ClassLoader loader = JsonSopDefinitionSource.class.getClassLoader();
        return new JsonSopDefinitionSource(
            name -> loader.getResourceAsStream(base + name + EXTENSION), requireParser(parser));
    }

    /**
     * Reads documents from a directory.
     *
     * @param directory the directory holding {@code *.json} documents
     * @return the source
     */
    public static JsonSopDefinitionSource fromDirectory(Path directory) {
        return fromDirectory(directory, new SopDefinitionParser());
    }

    public static JsonSopDefinitionSource fromDirectory(Path directory, SopDefinitionParser parser) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        return new JsonSopDefinitionSource(name -> {
            Path file = directory.resolve(name + EXTENSION);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            try {
                return Files.newInputStream(file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, requireParser(parser));
    }

    @Override
    public SopDefinition load(String sopName) {
        if (sopName == null || sopName.isBlank()) {
            throw new DefinitionException("SOP name cannot be null or blank");
        }
        if (sopName.contains("/") || sopName.contains("\\") || sopName.contains("..")) {
            throw new DefinitionException("Invalid SOP name: " + sopName);
        }
        return cache.computeIfAbsent(sopName, this::read);
    }

    /**
     * Names of the definitions parsed so far.
     *
     * @return cached SOP names
     */
    public Set<String> cachedNames() {
        return Set.copyOf(cache.keySet());
    }

    private SopDefinition read(String sopName) {
        InputStream in;
        try {
            in = locator.open(sopName);
        } catch (UncheckedIOException e) {
            throw new DefinitionException("Failed to open SOP document: " + sopName, e.getCause());
        }
        if (in == null) {
            throw new DefinitionException("Unknown SOP definition: " + sopName);
        }
        try (InputStream document = in) {
            SopDefinition definition = parser.parse(document);
            log.info("Loaded SOP definition {} ({} steps) from {}{}",
                definition.name(), definition.steps().size(), sopName, EXTENSION);
            return definition;
        } catch (IOException e) {
            throw new DefinitionException("Failed to read SOP document: " + sopName, e);
        }
    }

    private static SopDefinitionParser requireParser(SopDefinitionParser parser) {
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        return parser;
    }

    @FunctionalInterface
    private interface DocumentLocator {

        InputStream open(String sopName);
    }
}
