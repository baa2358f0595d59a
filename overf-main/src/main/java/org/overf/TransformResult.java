package org.overf;

import org.overf.diagnostics.Diagnostic;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outcome of one transform: the rewritten source, when one could be produced, and the
 * diagnostics reported on the way.
 */
public final class TransformResult {

    private final String source;
    private final List<Diagnostic> diagnostics;

    TransformResult(String source, List<Diagnostic> diagnostics) {
        this.source = source;
        this.diagnostics = List.copyOf(diagnostics);
    }

    static TransformResult failed(Diagnostic diagnostic) {
        return new TransformResult(null, List.of(diagnostic));
    }

    /**
     * @return the rewritten source; present even when errors were reported, unless the input
     * could not be parsed at all
     */
    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isSuccessful() {
        return source != null && !hasErrors();
    }

    /**
     * @throws BlockTransformException when the input could not be parsed or errors were reported
     */
    public String getSourceOrThrow() {
        if (!isSuccessful()) {
            String summary = diagnostics.stream()
                    .filter(Diagnostic::isError)
                    .map(Diagnostic::toString)
                    .collect(Collectors.joining("\n"));
            throw new BlockTransformException("Transform failed:\n" + summary, diagnostics);
        }
        return source;
    }

    @Override
    public String toString() {
        return "TransformResult{" +
               "successful=" + isSuccessful() +
               ", diagnostics=" + diagnostics +
               '}';
    }
}
