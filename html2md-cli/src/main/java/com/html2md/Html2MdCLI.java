package com.html2md;

import ch.qos.logback.classic.Level;
import com.html2md.cli.ConvertCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for html2md.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Convert an HTML file or standard input to Markdown</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert a file to stdout
 * html2md convert page.html
 *
 * # Convert stdin, keep data URIs, write JSON with the title
 * curl -s https://example.com | html2md convert --keep-data-uris -f json
 *
 * # Write page.md to a directory
 * html2md -v convert page.html -o out/page.md
 * }</pre>
 */
@Command(
    name = "html2md",
    mixinStandardHelpOptions = true,
    version = "html2md 1.0.0-SNAPSHOT",
    description = "Converts HTML documents into clean Markdown",
    subcommands = {
        ConvertCommand.class
    }
)
public class Html2MdCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Html2MdCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("html2md - HTML to Markdown converter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'html2md --help' to see available commands");
        System.out.println("Use 'html2md <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new Html2MdCLI()).execute(args);
        System.exit(exitCode);
    }
}
