package io.constela.cli;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code constela} command line.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile <input> [--config cfg.yaml] [--out dir] [--html]} - compile a program file
 *       and optionally render it to HTML</li>
 * </ul>
 *
 * <p>Exit status: 0 on success, 1 when the program has errors or output cannot be written, 2 on a
 * usage error.
 */
@Command(
        name = "constela",
        mixinStandardHelpOptions = true,
        version = "constela 0.1.0-SNAPSHOT",
        description = "Compiles declarative UI programs and renders them to HTML")
public final class ConstelaCli implements Runnable {

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_FAILURE = CommandLine.ExitCode.SOFTWARE;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing command");
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args, System.err, System::getenv));
    }

    /** Runs the CLI without exiting the JVM. */
    static int run(String[] args, PrintStream err, Function<String, String> envLookup) {
        CommandLine commandLine =
                new CommandLine(new ConstelaCli()).addSubcommand(new CompileCommand(err, envLookup));
        commandLine.setErr(new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true));
        return commandLine.execute(args);
    }
}
