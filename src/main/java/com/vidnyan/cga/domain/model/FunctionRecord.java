package com.vidnyan.cga.domain.model;

import java.util.List;

/**
 * A function or method defined in the analyzed project.
 * Created once per build by the assembler and never mutated afterwards.
 */
public record FunctionRecord(
    String id,
    String name,
    String qualifiedName,
    String file,
    int startLine,
    int endLine,
    Language language,
    String className,
    List<CallReference> calls,
    List<CallReference> calledBy,
    List<DataAccessFact> dataAccess,
    boolean exported,
    boolean constructor,
    boolean async,
    List<String> decorators,
    List<Parameter> parameters,
    String returnType,
    EntryPointKind entryPointKind
) {

    public FunctionRecord {
        calls = calls == null ? List.of() : List.copyOf(calls);
        calledBy = calledBy == null ? List.of() : List.copyOf(calledBy);
        dataAccess = dataAccess == null ? List.of() : List.copyOf(dataAccess);
        decorators = decorators == null ? List.of() : List.copyOf(decorators);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Stable id derived from file, qualified name and start line.
     */
    public static String idOf(String file, String qualifiedName, int startLine) {
        return file + ":" + qualifiedName + ":" + startLine;
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public boolean entryPoint() {
        return entryPointKind != null;
    }

    public boolean dataAccessor() {
        return !dataAccess.isEmpty();
    }

    public boolean hasDecorator(String simpleName) {
        return decorators.stream().anyMatch(d -> d.equals(simpleName) || d.endsWith("." + simpleName));
    }

    public FunctionRecord withCalls(List<CallReference> newCalls) {
        return new FunctionRecord(id, name, qualifiedName, file, startLine, endLine, language, className,
                newCalls, calledBy, dataAccess, exported, constructor, async, decorators, parameters,
                returnType, entryPointKind);
    }

    public FunctionRecord withCalledBy(List<CallReference> incoming) {
        return new FunctionRecord(id, name, qualifiedName, file, startLine, endLine, language, className,
                calls, incoming, dataAccess, exported, constructor, async, decorators, parameters,
                returnType, entryPointKind);
    }

    public FunctionRecord withDataAccess(List<DataAccessFact> facts) {
        return new FunctionRecord(id, name, qualifiedName, file, startLine, endLine, language, className,
                calls, calledBy, facts, exported, constructor, async, decorators, parameters,
                returnType, entryPointKind);
    }

    public FunctionRecord withEntryPointKind(EntryPointKind kind) {
        return new FunctionRecord(id, name, qualifiedName, file, startLine, endLine, language, className,
                calls, calledBy, dataAccess, exported, constructor, async, decorators, parameters,
                returnType, kind);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String qualifiedName;
        private String file;
        private int startLine;
        private int endLine;
        private Language language;
        private String className;
        private List<CallReference> calls = List.of();
        private List<CallReference> calledBy = List.of();
        private List<DataAccessFact> dataAccess = List.of();
        private boolean exported;
        private boolean constructor;
        private boolean async;
        private List<String> decorators = List.of();
        private List<Parameter> parameters = List.of();
        private String returnType;
        private EntryPointKind entryPointKind;

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder qualifiedName(String qualifiedName) { this.qualifiedName = qualifiedName; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder startLine(int line) { this.startLine = line; return this; }
        public Builder endLine(int line) { this.endLine = line; return this; }
        public Builder language(Language language) { this.language = language; return this; }
        public Builder className(String className) { this.className = className; return this; }
        public Builder calls(List<CallReference> calls) { this.calls = calls; return this; }
        public Builder calledBy(List<CallReference> calledBy) { this.calledBy = calledBy; return this; }
        public Builder dataAccess(List<DataAccessFact> facts) { this.dataAccess = facts; return this; }
        public Builder exported(boolean exported) { this.exported = exported; return this; }
        public Builder constructor(boolean constructor) { this.constructor = constructor; return this; }
        public Builder async(boolean async) { this.async = async; return this; }
        public Builder decorators(List<String> decorators) { this.decorators = decorators; return this; }
        public Builder parameters(List<Parameter> parameters) { this.parameters = parameters; return this; }
        public Builder returnType(String returnType) { this.returnType = returnType; return this; }
        public Builder entryPointKind(EntryPointKind kind) { this.entryPointKind = kind; return this; }

        public FunctionRecord build() {
            String effectiveQualified = qualifiedName != null ? qualifiedName : name;
            String effectiveId = id != null ? id : idOf(file, effectiveQualified, startLine);
            return new FunctionRecord(effectiveId, name, effectiveQualified, file, startLine, endLine, language,
                    className, calls, calledBy, dataAccess, exported, constructor, async, decorators, parameters,
                    returnType, entryPointKind);
        }
    }
}
