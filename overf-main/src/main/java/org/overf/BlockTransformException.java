package org.overf;

import org.overf.diagnostics.Diagnostic;

import java.util.List;

public class BlockTransformException extends OverflowBlocksException {

    private final List<Diagnostic> diagnostics;

    public BlockTransformException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
