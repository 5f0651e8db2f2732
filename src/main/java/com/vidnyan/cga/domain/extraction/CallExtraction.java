package com.vidnyan.cga.domain.extraction;

import com.vidnyan.cga.domain.model.UnresolvedReason;

/**
 * A call expression as written in the source.
 * {@code receiverType} is a best-effort static type hint for the receiver;
 * {@code dynamicHint} is set when the call shape can never be resolved statically.
 */
public record CallExtraction(
    String calleeName,
    String receiver,
    String receiverType,
    String fullExpression,
    int line,
    int column,
    int argumentCount,
    boolean methodCall,
    boolean constructorCall,
    UnresolvedReason dynamicHint
) {

    public String mergeKey() {
        return calleeName + ":" + line;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String calleeName;
        private String receiver;
        private String receiverType;
        private String fullExpression;
        private int line;
        private int column;
        private int argumentCount;
        private boolean methodCall;
        private boolean constructorCall;
        private UnresolvedReason dynamicHint;

        public Builder calleeName(String name) { this.calleeName = name; return this; }
        public Builder receiver(String receiver) { this.receiver = receiver; return this; }
        public Builder receiverType(String type) { this.receiverType = type; return this; }
        public Builder fullExpression(String expression) { this.fullExpression = expression; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder column(int column) { this.column = column; return this; }
        public Builder argumentCount(int count) { this.argumentCount = count; return this; }
        public Builder methodCall(boolean methodCall) { this.methodCall = methodCall; return this; }
        public Builder constructorCall(boolean constructorCall) { this.constructorCall = constructorCall; return this; }
        public Builder dynamicHint(UnresolvedReason hint) { this.dynamicHint = hint; return this; }

        public CallExtraction build() {
            String expression = fullExpression != null ? fullExpression
                    : (receiver != null ? receiver + "." + calleeName : calleeName);
            return new CallExtraction(calleeName, receiver, receiverType, expression, line, column,
                    argumentCount, methodCall || receiver != null, constructorCall, dynamicHint);
        }
    }
}
