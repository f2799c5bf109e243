package com.html2md.core.output;

import com.html2md.core.html.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes conversion results to a file.
 *
 * <p>Creates parent directories as needed and overwrites existing files.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * OutputContext context = new OutputContext(Paths.get("out/page.md"), OutputFormat.MARKDOWN);
 *
 * new FileOutputWriter().write(result, context);
 * // Creates: out/page.md
 * }</pre>
 */
public class FileOutputWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(FileOutputWriter.class);

    @Override
    public String getId() {
        return "file";
    }

    @Override
    public void write(ConversionResult result, OutputContext context) {
        Path target = context.target();
        if (target == null) {
            throw new IllegalStateException("File writer requires a target path");
        }

        String content = context.format().format(result);
        try {
            Path parentDir = target.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.writeString(target, content);
            logger.info("Wrote file: {} ({} characters)", target, content.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    /**
     * Derives the output path for an input file: same base name, extension of the format,
     * placed in {@code outputDir} or next to the input when no directory is given.
     *
     * @param input input file
     * @param outputDir output directory, may be null
     * @param format output format
     * @return output file path
     */
    public static Path targetFor(Path input, Path outputDir, OutputFormat format) {
        String fileName = input.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String baseName = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        String targetName = baseName + "." + format.getFileExtension();

        if (outputDir != null) {
            return outputDir.resolve(targetName);
        }
        Path parent = input.toAbsolutePath().getParent();
        return parent == null ? Path.of(targetName) : parent.resolve(targetName);
    }
}
