package org.propensa.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.propensa.cli.commands.CheckCommand;
import org.propensa.cli.commands.CompileCommand;
import org.propensa.cli.config.ConfigLoader;
import org.propensa.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "propensa",
    mixinStandardHelpOptions = true,
    version = "propensa 1.0",
    description = "Compiles reaction networks into stoichiometry, dependency graph and C propensity functions",
    subcommands = {
        CompileCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/propensa.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with all subcommands registered. Tests use this to run
     * commands exactly as the entry point does.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("propensa");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException If the requested configuration file does not exist.
     * @throws ConfigException          If the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        config = ConfigLoader.resolve(configFile, (level, message) -> {
            switch (level) {
                case INFO -> log.debug(message);
                case WARN -> log.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("propensa.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        return config;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
