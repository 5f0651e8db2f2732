package com.vidnyan.cga.domain.impact;

import com.vidnyan.cga.domain.model.CallPathNode;
import com.vidnyan.cga.domain.model.EntryPointKind;

import java.util.List;

/**
 * A caller affected by a change, {@code depth} hops away from it.
 * {@code pathToChange} starts at this function and ends at the changed one.
 */
public record AffectedFunction(
    String id,
    String name,
    String qualifiedName,
    String file,
    int line,
    int depth,
    String hop,
    EntryPointKind entryPointKind,
    boolean accessesSensitiveData,
    List<CallPathNode> pathToChange
) {

    public static final String DIRECT = "direct";
    public static final String TRANSITIVE = "transitive";

    public AffectedFunction {
        pathToChange = List.copyOf(pathToChange);
    }

    public boolean entryPoint() {
        return entryPointKind != null;
    }

    public boolean test() {
        return entryPointKind == EntryPointKind.TEST;
    }
}
