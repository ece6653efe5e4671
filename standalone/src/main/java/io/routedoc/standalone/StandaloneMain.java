package io.routedoc.standalone;

import io.routedoc.standalone.app.DocumentGenerator;
import io.routedoc.standalone.app.LogbackConfigurator;
import io.routedoc.standalone.config.ConfigLoader;
import io.routedoc.standalone.config.RouteDocConfig;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: {@code routedoc [--config path/to/routedoc.yaml]}.
 *
 * <p>
 * Loads the configuration, configures logging and writes the OpenAPI document. Any failure is
 * logged and ends the process with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            run(args);
        } catch (Exception e) {
            LOG.error("Generation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static Path run(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        RouteDocConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        Path baseDir = configPath.toAbsolutePath().getParent();
        return new DocumentGenerator().generate(config, baseDir);
    }
}
