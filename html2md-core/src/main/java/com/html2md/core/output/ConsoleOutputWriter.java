package com.html2md.core.output;

import com.html2md.core.html.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes conversion results to a print stream, standard output by default.
 *
 * <p>Only the serialized result is written to the stream; diagnostics go to the log.
 */
public class ConsoleOutputWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleOutputWriter.class);

    private final PrintStream out;

    public ConsoleOutputWriter() {
        this(System.out);
    }

    public ConsoleOutputWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(ConversionResult result, OutputContext context) {
        String content = context.format().format(result);
        logger.debug("Writing {} characters of {} to console", content.length(), context.format().getId());

        out.print(content);
        if (!content.endsWith("\n")) {
            out.println();
        }
        out.flush();
    }
}
