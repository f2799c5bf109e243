package com.html2md.cli;

import com.html2md.Html2MdCLI;
import com.html2md.core.config.ConfigLoader;
import com.html2md.core.config.ConverterOptions;
import com.html2md.core.config.ProjectConfig;
import com.html2md.core.html.ConversionResult;
import com.html2md.core.html.HtmlDocumentConverter;
import com.html2md.core.html.StreamInfo;
import com.html2md.core.output.ConsoleOutputWriter;
import com.html2md.core.output.FileOutputWriter;
import com.html2md.core.output.OutputContext;
import com.html2md.core.output.OutputFormat;
import com.html2md.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to convert an HTML document to Markdown.
 *
 * <p>Reads a file, or standard input when the file is {@code -} or omitted. Writes to the
 * {@code --output} file, to the configured output directory when converting a file, or to
 * standard output otherwise. Command-line flags override {@code html2md.yaml}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Convert a file to stdout
 * html2md convert page.html
 *
 * # Convert stdin to a JSON file
 * html2md convert -f json -o page.json < page.html
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert an HTML document to Markdown",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    private static final String STDIN = "-";

    @ParentCommand
    private Html2MdCLI parent;

    @Parameters(
        index = "0",
        description = "HTML file to convert, '-' for standard input (default: -)",
        defaultValue = STDIN
    )
    private String input;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path outputFile;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: markdown or json (overrides config)",
        converter = OutputFormatConverter.class
    )
    private OutputFormat format;

    @Option(names = {"--keep-data-uris"}, description = "Keep data: image sources instead of truncating them")
    private Boolean keepDataUris;

    @Option(names = {"--max-depth"}, description = "Element nesting limit, 0 disables it (overrides config)")
    private Integer maxDepth;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: html2md.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    private final InputStream stdin;
    private final PrintStream stdout;
    private final HtmlDocumentConverter converter;

    public ConvertCommand() {
        this(System.in, System.out);
    }

    ConvertCommand(InputStream stdin, PrintStream stdout) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.converter = new HtmlDocumentConverter();
    }

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        try {
            ProjectConfig config = ConfigLoader.load(configPath);
            ConverterOptions options = resolveOptions(config);
            OutputFormat outputFormat = format != null ? format : OutputFormat.fromId(config.output().format());

            ConversionResult result;
            Path inputPath = null;
            if (STDIN.equals(input)) {
                log.debug("Reading HTML from standard input");
                result = converter.convert(stdin, StreamInfo.html(), options);
            } else {
                inputPath = Paths.get(input);
                result = converter.convertFile(inputPath, options);
            }

            Path target = resolveTarget(inputPath, config, outputFormat);
            OutputWriter writer = target == null ? new ConsoleOutputWriter(stdout) : new FileOutputWriter();
            writer.write(result, new OutputContext(target, outputFormat));
            return 0;

        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            log.error("Conversion failed: {}", e.getMessage());
            log.debug("Conversion failure details", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }

    private ConverterOptions resolveOptions(ProjectConfig config) {
        ConverterOptions options = config.converter();
        if (keepDataUris != null) {
            options = options.withKeepDataUris(keepDataUris);
        }
        if (maxDepth != null) {
            options = options.withMaxDepth(maxDepth);
        }
        return options;
    }

    private Path resolveTarget(Path inputPath, ProjectConfig config, OutputFormat outputFormat) {
        if (outputFile != null) {
            return outputFile;
        }
        String directory = config.output().directory();
        if (inputPath != null && directory != null && !directory.isBlank()) {
            return FileOutputWriter.targetFor(inputPath, Paths.get(directory), outputFormat);
        }
        return null;
    }

    /**
     * Parses {@code --format} case-insensitively, so an unknown value is a usage error.
     */
    public static class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {

        @Override
        public OutputFormat convert(String value) {
            try {
                return OutputFormat.fromId(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
