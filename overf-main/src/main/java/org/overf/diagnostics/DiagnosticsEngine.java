package org.overf.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one transform invocation.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportError(String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, line, column));
    }

    public void reportWarning(String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, line, column));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * @return an unmodifiable view, in reporting order
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
