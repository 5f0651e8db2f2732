package com.vidnyan.cga.domain.extraction;

import com.vidnyan.cga.domain.model.Parameter;

import java.util.List;

/**
 * A function or method definition as seen by one extraction strategy.
 */
public record FunctionExtraction(
    String name,
    String qualifiedName,
    int startLine,
    int endLine,
    String className,
    List<Parameter> parameters,
    String returnType,
    boolean exported,
    boolean constructor,
    boolean async,
    List<String> decorators
) {

    public FunctionExtraction {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        decorators = decorators == null ? List.of() : List.copyOf(decorators);
        if (qualifiedName == null) {
            qualifiedName = className != null ? className + "." + name : name;
        }
    }

    public String mergeKey() {
        return name + ":" + startLine;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String qualifiedName;
        private int startLine;
        private int endLine;
        private String className;
        private List<Parameter> parameters = List.of();
        private String returnType;
        private boolean exported;
        private boolean constructor;
        private boolean async;
        private List<String> decorators = List.of();

        public Builder name(String name) { this.name = name; return this; }
        public Builder qualifiedName(String qualifiedName) { this.qualifiedName = qualifiedName; return this; }
        public Builder startLine(int line) { this.startLine = line; return this; }
        public Builder endLine(int line) { this.endLine = line; return this; }
        public Builder className(String className) { this.className = className; return this; }
        public Builder parameters(List<Parameter> parameters) { this.parameters = parameters; return this; }
        public Builder returnType(String returnType) { this.returnType = returnType; return this; }
        public Builder exported(boolean exported) { this.exported = exported; return this; }
        public Builder constructor(boolean constructor) { this.constructor = constructor; return this; }
        public Builder async(boolean async) { this.async = async; return this; }
        public Builder decorators(List<String> decorators) { this.decorators = decorators; return this; }

        public FunctionExtraction build() {
            return new FunctionExtraction(name, qualifiedName, startLine, endLine, className, parameters,
                    returnType, exported, constructor, async, decorators);
        }
    }
}
