package com.vidnyan.cga.domain.impact;

import com.vidnyan.cga.domain.graph.Sensitivity;
import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.DataOperation;

import java.util.List;

/**
 * Sensitive data an affected entry point reaches through the changed code.
 * {@code fullPath} runs entry point, changed function, accessor.
 */
public record AffectedDataPath(
    String entryPoint,
    String table,
    List<String> fields,
    DataOperation operation,
    Sensitivity sensitivity,
    List<CallPathNode> fullPath
) {

    public AffectedDataPath {
        fields = List.copyOf(fields);
        fullPath = List.copyOf(fullPath);
    }
}
