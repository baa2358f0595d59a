package org.overf.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.overf.OverflowBlocks;
import org.overf.OverflowPolicy;
import org.overf.TransformOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "overf",
    mixinStandardHelpOptions = true,
    version = "overf 1.0",
    description = "Rewrites the arithmetic inside overflow-policy blocks (checked, overflowing, saturating, "
                  + "propagating) of Java sources into calls to the overflow runtime."
)
public class OverfCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger logger = LoggerFactory.getLogger(OverfCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-o", "--output-dir"}, description = "Directory for transformed files (default: standard output)")
    private Path outputDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file overriding the bundled defaults")
    private File configFile;

    @Option(names = {"-b", "--block"},
            description = "Treat each file as block statements under this policy: ${COMPLETION-CANDIDATES}")
    private OverflowPolicy blockPolicy;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Java sources to transform")
    private List<Path> files;

    @Override
    public Integer call() {
        if (configFile != null && !configFile.exists()) {
            spec.commandLine().getErr().println("overf: configuration file not found: " + configFile);
            return EXIT_USAGE;
        }
        TransformOptions options;
        try {
            options = TransformOptions.fromConfig(loadConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("overf: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        logger.debug("Using {}", options);

        SourceFileTransformer transformer = new SourceFileTransformer(new OverflowBlocks(options), blockPolicy, outputDir,
                                                                      spec.commandLine().getOut(), spec.commandLine().getErr());
        int exitCode = EXIT_OK;
        for (Path file : files) {
            exitCode = Math.max(exitCode, transformer.transform(file).getExitCode());
        }
        spec.commandLine().getOut().flush();
        spec.commandLine().getErr().flush();
        return exitCode;
    }

    // System properties > --config file > application.conf and reference.conf
    private Config loadConfig() {
        Config config = ConfigFactory.systemProperties();
        if (configFile != null) {
            logger.info("Using configuration file {}", configFile.getAbsolutePath());
            config = config.withFallback(ConfigFactory.parseFile(configFile));
        }
        return config.withFallback(ConfigFactory.load()).resolve();
    }

    public static CommandLine commandLine() {
        return new CommandLine(new OverfCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
