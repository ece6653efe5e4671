package io.routedoc.standalone.config;

import java.util.List;

/**
 * Configuration for one run of the standalone generator.
 *
 * <p>
 * Only {@code input} is required. Info fields are overrides: a non-null value replaces the
 * corresponding field declared in the route description, null leaves it alone. An empty
 * {@code servers} list likewise keeps the servers of the route description.
 *
 * @param input           route description file
 * @param output          file the OpenAPI JSON is written to
 * @param pretty          indent the JSON output
 * @param infoTitle       title override, or null
 * @param infoVersion     version override, or null
 * @param infoDescription description override, or null
 * @param infoLicense     license name override, or null
 * @param servers         server URL overrides
 * @param loggingFormat   text or json
 * @param loggingLevel    root log level
 */
public record RouteDocConfig(
        String input,
        String output,
        boolean pretty,
        String infoTitle,
        String infoVersion,
        String infoDescription,
        String infoLicense,
        List<String> servers,
        String loggingFormat,
        String loggingLevel) {

    public RouteDocConfig {
        servers = servers != null ? List.copyOf(servers) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RouteDocConfig}. Every field but {@code input} has a default. */
    public static final class Builder {

        private String input;
        private String output = "openapi.json";
        private boolean pretty = true;
        private String infoTitle;
        private String infoVersion;
        private String infoDescription;
        private String infoLicense;
        private List<String> servers = List.of();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder pretty(boolean pretty) {
            this.pretty = pretty;
            return this;
        }

        public Builder infoTitle(String infoTitle) {
            this.infoTitle = infoTitle;
            return this;
        }

        public Builder infoVersion(String infoVersion) {
            this.infoVersion = infoVersion;
            return this;
        }

        public Builder infoDescription(String infoDescription) {
            this.infoDescription = infoDescription;
            return this;
        }

        public Builder infoLicense(String infoLicense) {
            this.infoLicense = infoLicense;
            return this;
        }

        public Builder servers(List<String> servers) {
            this.servers = servers;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws ConfigLoadException if {@code input} is missing or blank
         */
        public RouteDocConfig build() {
            if (input == null || input.isBlank()) {
                throw new ConfigLoadException("Missing required configuration key 'input' (or ROUTEDOC_INPUT)");
            }
            return new RouteDocConfig(
                    input,
                    output,
                    pretty,
                    infoTitle,
                    infoVersion,
                    infoDescription,
                    infoLicense,
                    servers,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
