package org.overf.cli;

import org.overf.OverflowBlocks;
import org.overf.OverflowPolicy;
import org.overf.TransformResult;
import org.overf.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Transforms one source file at a time and reports diagnostics as
 * {@code file:line:column: severity: message}.
 */
class SourceFileTransformer {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileTransformer.class);

    enum Outcome {
        TRANSFORMED(OverfCommand.EXIT_OK),
        FAILED(OverfCommand.EXIT_DIAGNOSTICS),
        IO_ERROR(OverfCommand.EXIT_USAGE);

        private final int exitCode;

        Outcome(int exitCode) {
            this.exitCode = exitCode;
        }

        int getExitCode() {
            return exitCode;
        }
    }

    private final OverflowBlocks blocks;
    private final OverflowPolicy blockPolicy;
    private final Path outputDir;
    private final PrintWriter out;
    private final PrintWriter err;

    /**
     * @param blockPolicy policy for block input, or {@code null} to treat files as compilation units
     * @param outputDir   target directory, or {@code null} to print to {@code out}
     */
    SourceFileTransformer(OverflowBlocks blocks, OverflowPolicy blockPolicy, Path outputDir, PrintWriter out, PrintWriter err) {
        this.blocks = blocks;
        this.blockPolicy = blockPolicy;
        this.outputDir = outputDir;
        this.out = out;
        this.err = err;
    }

    Outcome transform(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println(file + ": cannot read: " + e.getMessage());
            return Outcome.IO_ERROR;
        }

        TransformResult result = blockPolicy == null
                ? blocks.transformCompilationUnit(source)
                : blocks.transform(source, blockPolicy);
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            err.println(file + ":" + diagnostic);
        }
        if (!result.isSuccessful()) {
            logger.info("{}: not transformed ({} diagnostics)", file, result.getDiagnostics().size());
            return Outcome.FAILED;
        }

        String transformed = result.getSourceOrThrow();
        if (outputDir == null) {
            out.println(transformed);
            return Outcome.TRANSFORMED;
        }
        Path target = outputDir.resolve(file.getFileName());
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, transformed, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println(target + ": cannot write: " + e.getMessage());
            return Outcome.IO_ERROR;
        }
        logger.info("{} -> {}", file, target);
        return Outcome.TRANSFORMED;
    }
}
