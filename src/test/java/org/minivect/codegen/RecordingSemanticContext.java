package org.minivect.codegen;

import org.minivect.astnode.Node;
import org.minivect.astnode.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Semantic context that renders every type by its string form and records disposal requests.
 */
class RecordingSemanticContext implements SemanticContext {
    final List<Node> disposalRequests = new ArrayList<>();
    final List<CodeWriter> disposalPoints = new ArrayList<>();

    @Override
    public String declareType(Type type) {
        return type.toString();
    }

    @Override
    public String initialValue(Type type) {
        return null;
    }

    @Override
    public boolean bodyMayError(Node node) {
        return false;
    }

    @Override
    public ErrorHandler errorHandler(CodeWriter code) {
        throw new UnsupportedOperationException("no error protection in this context");
    }

    @Override
    public void generateDisposalCode(CodeWriter code, Node node) {
        disposalRequests.add(node);
        disposalPoints.add(code);
        code.emitLine("/* dispose */");
    }
}
