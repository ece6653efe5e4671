package io.routedoc.standalone.app;

import io.routedoc.core.engine.DocumentCompiler;
import io.routedoc.core.model.ApiDocument;
import io.routedoc.core.model.Info;
import io.routedoc.core.spec.OpenApiWriter;
import io.routedoc.core.spec.RouteSpec;
import io.routedoc.core.spec.RouteSpecParser;
import io.routedoc.standalone.config.RouteDocConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one generation: parse the route description, compile it, apply the configured
 * document-level overrides and write the OpenAPI JSON.
 *
 * <p>
 * Relative {@code input} and {@code output} paths resolve against the base directory, which
 * is the directory holding the configuration file.
 */
public final class DocumentGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentGenerator.class);

    private final RouteSpecParser parser;

    public DocumentGenerator() {
        this(new RouteSpecParser());
    }

    DocumentGenerator(RouteSpecParser parser) {
        this.parser = parser;
    }

    /** Builds the document described by {@code config} without writing it. */
    public ApiDocument build(RouteDocConfig config, Path baseDir) {
        RouteSpec spec = parser.parse(baseDir.resolve(config.input()));
        ApiDocument document = DocumentCompiler.compile(spec.tree());
        return document.withInfo(overrideInfo(spec.info(), config))
                .withServers(config.servers().isEmpty() ? spec.servers() : config.servers());
    }

    /**
     * Builds the document and writes it to the configured output file, creating parent
     * directories as needed.
     *
     * @return the path written
     */
    public Path generate(RouteDocConfig config, Path baseDir) {
        long start = System.nanoTime();
        ApiDocument document = build(config, baseDir);
        Path output = baseDir.resolve(config.output());
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, OpenApiWriter.toJson(document, config.pretty()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write OpenAPI document to " + output, e);
        }
        LOG.info(
                "openapi.written output={} operations={} schemas={} duration_ms={}",
                output,
                document.operationCount(),
                document.schemas().size(),
                (System.nanoTime() - start) / 1_000_000);
        return output;
    }

    static Info overrideInfo(Info declared, RouteDocConfig config) {
        Info info = declared;
        if (config.infoTitle() != null) info = info.withTitle(config.infoTitle());
        if (config.infoVersion() != null) info = info.withVersion(config.infoVersion());
        if (config.infoDescription() != null) info = info.withDescription(config.infoDescription());
        if (config.infoLicense() != null) info = info.withLicense(config.infoLicense());
        return info;
    }
}
