package io.elicitor.scripted;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.elicitor.core.codec.ResponsesCodec;
import io.elicitor.core.error.SurveyCancelledException;
import io.elicitor.core.engine.Survey;
import io.elicitor.core.engine.SurveyResult;
import io.elicitor.scripted.config.ConfigLoader;
import io.elicitor.scripted.config.ScriptedConfig;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: runs the survey of a shape class against an answer script and prints
 * the reconstructed value.
 *
 * <pre>
 * java -cp app.jar:shapes.jar io.elicitor.scripted.ScriptedMain --shape com.example.Signup [--config file.yaml]
 * </pre>
 *
 * <p>
 * Exit status is 0 on success, 2 if the script cancels the survey and 1 on any other failure.
 */
public final class ScriptedMain {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptedMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CANCELLED = 2;

    private ScriptedMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args {@code --shape <class>} and optionally {@code --config <path>}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = run(args, System.out, System::getenv);
        } catch (Exception e) {
            LOG.error("Scripted run failed: {}", e.getMessage(), e);
            status = EXIT_FAILED;
        }
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one survey and prints the result to {@code out}.
     *
     * @return the exit status
     */
    static int run(String[] args, PrintStream out, Function<String, String> envLookup) throws IOException {
        String shapeName = option(args, "--shape");
        if (shapeName == null) {
            throw new IllegalArgumentException("--shape <fully.qualified.ClassName> is required");
        }
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ScriptedConfig config = Files.exists(configPath) || option(args, "--config") != null
                ? ConfigLoader.load(configPath, envLookup)
                : ConfigLoader.fromEnvironment(envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("scripted.starting shape={} script={}", shapeName, config.script());

        Survey<?> survey = Survey.of(loadShape(shapeName));
        ScriptedPresenter presenter =
                new ScriptedPresenter(AnswerScript.load(config.script()), config.maxAttempts(), config.acceptSuggestions());
        Object value;
        try {
            value = collect(survey, presenter, config.responsesOut());
        } catch (SurveyCancelledException e) {
            LOG.warn("scripted.cancelled shape={} path={}", shapeName, e.path());
            return EXIT_CANCELLED;
        }
        out.println(render(value, config.output()));
        return EXIT_OK;
    }

    private static <T> T collect(Survey<T> survey, ScriptedPresenter presenter, Path responsesOut)
            throws IOException {
        SurveyResult<T> result = survey.builder().collect(presenter);
        if (responsesOut != null) {
            Files.writeString(responsesOut, new ResponsesCodec().encode(result.responses()));
            LOG.info("scripted.responses-written file={} entries={}", responsesOut, result.responses().size());
        }
        return result.value();
    }

    private static Class<?> loadShape(String name) {
        try {
            return Class.forName(name, true, Thread.currentThread().getContextClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Shape class not found on the classpath: " + name, e);
        }
    }

    static String render(Object value, ScriptedConfig.OutputFormat format) throws JsonProcessingException {
        ObjectMapper mapper = format == ScriptedConfig.OutputFormat.YAML
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        mapper.registerModule(new Jdk8Module());
        // Unit variants are records without components.
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper.writeValueAsString(value).stripTrailing();
    }

    private static String option(String[] args, String name) {
        int i = Arrays.asList(args).indexOf(name);
        if (i < 0) {
            return null;
        }
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(name + " requires an argument");
        }
        return args[i + 1];
    }
}
