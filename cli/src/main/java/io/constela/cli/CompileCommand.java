package io.constela.cli;

import io.constela.cli.config.CliConfig;
import io.constela.cli.config.ConfigLoadException;
import io.constela.cli.config.ConfigLoader;
import io.constela.core.compiled.CompiledProgram;
import io.constela.core.compiled.CompiledProgramWriter;
import io.constela.core.engine.CompileResult;
import io.constela.core.engine.CompilerOptions;
import io.constela.core.engine.ConstelaCompiler;
import io.constela.core.error.ConstelaError;
import io.constela.core.evaluate.RouteContext;
import io.constela.core.model.Program;
import io.constela.core.parser.ProgramParser;
import io.constela.core.render.HtmlRenderer;
import io.constela.core.render.RenderOptions;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Compiles one program file and writes {@code <name>.compiled.json}, plus {@code <name>.html} when
 * rendering is enabled. Analysis errors are printed to the error stream as one JSON object per line.
 */
@Command(
        name = "compile",
        description = "Compile a JSON or YAML program file",
        mixinStandardHelpOptions = true)
final class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    static final String MDC_SOURCE = "constela.source";

    private final PrintStream err;
    private final Function<String, String> envLookup;

    @Parameters(index = "0", paramLabel = "<input>", description = "Program file (.json, .yaml or .yml)")
    private Path input;

    @Option(names = "--config", paramLabel = "<cfg.yaml>", description = "YAML configuration file")
    private Path configPath;

    @Option(names = "--out", paramLabel = "<dir>", description = "Output directory, overrides output.dir")
    private Path outDir;

    @Option(names = "--html", description = "Also render the program to <name>.html")
    private boolean html;

    @Option(names = "--layout", paramLabel = "<layout>", description = "Layout program whose slots receive the page")
    private Path layout;

    CompileCommand(PrintStream err, Function<String, String> envLookup) {
        this.err = err;
        this.envLookup = envLookup;
    }

    @Override
    public Integer call() {
        CliConfig config;
        try {
            config = effectiveConfig(ConfigLoader.load(configPath, envLookup));
        } catch (ConfigLoadException e) {
            err.println("Configuration error: " + e.getMessage());
            return ConstelaCli.EXIT_FAILURE;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        try {
            return execute(config);
        } catch (IOException e) {
            LOG.error("Failed to write output: {}", e.getMessage(), e);
            err.println("Failed to write output: " + e.getMessage());
            return ConstelaCli.EXIT_FAILURE;
        }
    }

    /** Command-line options win over the file and environment configuration. */
    private CliConfig effectiveConfig(CliConfig loaded) {
        CliConfig.Builder effective = loaded.toBuilder();
        if (outDir != null) {
            effective.outputDir(outDir.toString());
        }
        if (html) {
            effective.renderHtml(true);
        }
        return effective.build();
    }

    private int execute(CliConfig config) throws IOException {
        MDC.put(MDC_SOURCE, input.toString());
        try {
            if (!Files.isRegularFile(input)) {
                err.println("Input file not found: " + input);
                return ConstelaCli.EXIT_FAILURE;
            }
            ConstelaCompiler compiler = new ConstelaCompiler(CompilerOptions.builder()
                    .maxSuggestionDistance(config.maxSuggestionDistance())
                    .build());
            CompiledProgram compiled = compileOrReport(compiler, input);
            if (compiled == null) {
                return ConstelaCli.EXIT_FAILURE;
            }
            if (layout != null) {
                if (!Files.isRegularFile(layout)) {
                    err.println("Layout file not found: " + layout);
                    return ConstelaCli.EXIT_FAILURE;
                }
                CompiledProgram compiledLayout = compileOrReport(compiler, layout);
                if (compiledLayout == null) {
                    return ConstelaCli.EXIT_FAILURE;
                }
                compiled = compiler.composeLayout(compiledLayout, compiled);
            }
            Path target = outputDirectory(config);
            Files.createDirectories(target);
            String name = baseName(input);

            Path jsonOut = target.resolve(name + ".compiled.json");
            Files.writeString(
                    jsonOut, CompiledProgramWriter.toJsonString(compiled, config.outputPretty()), StandardCharsets.UTF_8);
            LOG.info("Wrote compiled program: {}", jsonOut);

            if (config.renderHtml()) {
                Path htmlOut = target.resolve(name + ".html");
                Files.writeString(htmlOut, render(compiled, config), StandardCharsets.UTF_8);
                LOG.info("Wrote rendered HTML: {}", htmlOut);
            }
            return ConstelaCli.EXIT_OK;
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    /** Returns the compiled program, or null after printing its errors. */
    private CompiledProgram compileOrReport(ConstelaCompiler compiler, Path file) {
        CompileResult result = compiler.compile(file);
        if (result instanceof CompileResult.Failure failure) {
            for (ConstelaError error : failure.errors()) {
                err.println(error.toJson().toString());
            }
            return null;
        }
        CompileResult.Success success = (CompileResult.Success) result;
        for (ConstelaError warning : success.warnings()) {
            LOG.warn("{}: {} at {}", warning.code(), warning.message(), warning.path());
        }
        return success.program();
    }

    private String render(CompiledProgram compiled, CliConfig config) {
        // style presets are not part of the compiled program, so they are read from the source
        Program program = ProgramParser.parse(input);
        RouteContext route = compiled.route() == null
                ? null
                : new RouteContext(Map.of(), Map.of(), compiled.route().path());
        return HtmlRenderer.renderToString(
                compiled,
                RenderOptions.builder()
                        .route(route)
                        .styles(program.styles())
                        .stateOverrides(config.stateOverrides())
                        .build());
    }

    private Path outputDirectory(CliConfig config) {
        if (config.outputDir() != null) {
            return Path.of(config.outputDir());
        }
        Path parent = input.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }

    static String baseName(Path input) {
        String file = input.getFileName().toString();
        for (String ext : new String[] {".json", ".yaml", ".yml"}) {
            if (file.endsWith(ext)) {
                return file.substring(0, file.length() - ext.length());
            }
        }
        return file;
    }
}
