package io.elicitor.scripted.config;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Configuration of a scripted survey run.
 *
 * @param script path of the YAML answer script (required)
 * @param maxAttempts how many candidate answers are tried per question before giving up
 * @param acceptSuggestions whether a suggested default answers a question the script leaves out
 * @param output format of the printed result
 * @param responsesOut file the collected answers are written to as JSON, or {@code null}
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel root log level
 */
public record ScriptedConfig(
        Path script,
        int maxAttempts,
        boolean acceptSuggestions,
        OutputFormat output,
        Path responsesOut,
        String loggingFormat,
        String loggingLevel) {

    /** How the reconstructed value is printed. */
    public enum OutputFormat {
        JSON,
        YAML;

        /**
         * Parses {@code json} or {@code yaml}, ignoring case.
         *
         * @throws ConfigLoadException for any other value
         */
        public static OutputFormat parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("Invalid output format '" + value + "' (expected json or yaml)", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ScriptedConfig}. Every field except {@code script} has a default. */
    public static final class Builder {
        private Path script;
        private int maxAttempts = 3;
        private boolean acceptSuggestions = true;
        private OutputFormat output = OutputFormat.JSON;
        private Path responsesOut;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder script(Path script) {
            this.script = script;
            return this;
        }

        public Builder script(String script) {
            return script(Path.of(script));
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder acceptSuggestions(boolean acceptSuggestions) {
            this.acceptSuggestions = acceptSuggestions;
            return this;
        }

        public Builder output(OutputFormat output) {
            this.output = output;
            return this;
        }

        public Builder output(String output) {
            return output(OutputFormat.parse(output));
        }

        public Builder responsesOut(String responsesOut) {
            this.responsesOut = responsesOut != null ? Path.of(responsesOut) : null;
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
         * @throws ConfigLoadException if {@code script} is missing or {@code maxAttempts} is below 1
         */
        public ScriptedConfig build() {
            if (script == null) {
                throw new ConfigLoadException("Missing required configuration: script (or ELICITOR_SCRIPT)");
            }
            if (maxAttempts < 1) {
                throw new ConfigLoadException("max-attempts must be at least 1, got " + maxAttempts);
            }
            return new ScriptedConfig(
                    script, maxAttempts, acceptSuggestions, output, responsesOut, loggingFormat, loggingLevel);
        }
    }
}
