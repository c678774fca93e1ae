package org.crosssection.tools;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main entry point for the cross-section command-line tools.
 */
@Command(
    name = "xsec",
    mixinStandardHelpOptions = true,
    version = "Cross Section Tools 1.0.0",
    description = "Absorption and emission cross sections of laser crystals",
    subcommands = {
        MaterialInfoCommand.class,
        AbsorptionCommand.class,
        FluorescenceCommand.class,
        CrossSectionCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CrossSectionMain implements Runnable {

    static final String LOGGER_ROOT = "org.crosssection";

    // JUL keeps loggers weakly referenced
    private static final Logger rootLogger = Logger.getLogger(LOGGER_ROOT);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CrossSectionMain()).execute(args);
        System.exit(exitCode);
    }

    @Option(names = {"-v", "--verbose"}, description = "Log processing details to stderr")
    void setVerbose(boolean verbose) {
        configureLogging(verbose ? Level.FINE : Level.INFO);
    }

    @Override
    public void run() {
        // When called without subcommand, show help
        CommandLine.usage(this, System.out);
    }

    static void configureLogging(Level level) {
        Logger logger = rootLogger;
        logger.setLevel(level);
        if (level.intValue() < Level.INFO.intValue()) {
            for (Handler handler : logger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(level);
                    return;
                }
            }
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(level);
            logger.addHandler(handler);
            logger.setUseParentHandlers(false);
        }
    }
}
