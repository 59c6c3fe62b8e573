package org.scadfront.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional details attached to a {@link ParserError}. All fields may be null. The context is mutable so
 * recovery strategies can record their findings (see {@link #setSuggestions(List)}).
 */
public class ErrorContext {
    private Integer line;
    private Integer column;
    private Integer length;
    private String source;
    private String nodeType;
    private List<String> expected;
    private String found;
    private String suggestion;
    private List<String> suggestions;
    private String helpUrl;
    private String operation;
    private String leftType;
    private String rightType;
    private Object leftValue;
    private Object rightValue;
    private String functionName;
    private Integer paramIndex;
    private Object value;
    private ErrorLocation location;

    public ErrorContext() {
    }

    /**
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return A shallow copy; list fields are copied.
     */
    public ErrorContext copy() {
        ErrorContext copy = new ErrorContext();
        copy.line = line;
        copy.column = column;
        copy.length = length;
        copy.source = source;
        copy.nodeType = nodeType;
        copy.expected = expected != null ? new ArrayList<>(expected) : null;
        copy.found = found;
        copy.suggestion = suggestion;
        copy.suggestions = suggestions != null ? new ArrayList<>(suggestions) : null;
        copy.helpUrl = helpUrl;
        copy.operation = operation;
        copy.leftType = leftType;
        copy.rightType = rightType;
        copy.leftValue = leftValue;
        copy.rightValue = rightValue;
        copy.functionName = functionName;
        copy.paramIndex = paramIndex;
        copy.value = value;
        copy.location = location;
        return copy;
    }

    /**
     * @return True if both line and column are set.
     */
    public boolean hasPosition() {
        return line != null && column != null;
    }

    public Integer getLine() {
        return line;
    }

    public void setLine(Integer line) {
        this.line = line;
    }

    public Integer getColumn() {
        return column;
    }

    public void setColumn(Integer column) {
        this.column = column;
    }

    public Integer getLength() {
        return length;
    }

    public void setLength(Integer length) {
        this.length = length;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getNodeType() {
        return nodeType;
    }

    public void setNodeType(String nodeType) {
        this.nodeType = nodeType;
    }

    public List<String> getExpected() {
        return expected;
    }

    public void setExpected(List<String> expected) {
        this.expected = expected != null ? new ArrayList<>(expected) : null;
    }

    public String getFound() {
        return found;
    }

    public void setFound(String found) {
        this.found = found;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public void setSuggestion(String suggestion) {
        this.suggestion = suggestion;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(List<String> suggestions) {
        this.suggestions = suggestions != null ? new ArrayList<>(suggestions) : null;
    }

    public String getHelpUrl() {
        return helpUrl;
    }

    public void setHelpUrl(String helpUrl) {
        this.helpUrl = helpUrl;
    }

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public String getLeftType() {
        return leftType;
    }

    public void setLeftType(String leftType) {
        this.leftType = leftType;
    }

    public String getRightType() {
        return rightType;
    }

    public void setRightType(String rightType) {
        this.rightType = rightType;
    }

    public Object getLeftValue() {
        return leftValue;
    }

    public void setLeftValue(Object leftValue) {
        this.leftValue = leftValue;
    }

    public Object getRightValue() {
        return rightValue;
    }

    public void setRightValue(Object rightValue) {
        this.rightValue = rightValue;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public Integer getParamIndex() {
        return paramIndex;
    }

    public void setParamIndex(Integer paramIndex) {
        this.paramIndex = paramIndex;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public ErrorLocation getLocation() {
        return location;
    }

    public void setLocation(ErrorLocation location) {
        this.location = location;
    }

    /**
     * Fluent builder for {@link ErrorContext}.
     */
    public static final class Builder {
        private final ErrorContext context = new ErrorContext();

        private Builder() {
        }

        public Builder position(int line, int column) {
            context.line = line;
            context.column = column;
            return this;
        }

        public Builder line(Integer line) {
            context.line = line;
            return this;
        }

        public Builder column(Integer column) {
            context.column = column;
            return this;
        }

        public Builder length(Integer length) {
            context.length = length;
            return this;
        }

        public Builder source(String source) {
            context.source = source;
            return this;
        }

        public Builder nodeType(String nodeType) {
            context.nodeType = nodeType;
            return this;
        }

        public Builder expected(List<String> expected) {
            context.setExpected(expected);
            return this;
        }

        public Builder found(String found) {
            context.found = found;
            return this;
        }

        public Builder suggestion(String suggestion) {
            context.suggestion = suggestion;
            return this;
        }

        public Builder suggestions(List<String> suggestions) {
            context.setSuggestions(suggestions);
            return this;
        }

        public Builder helpUrl(String helpUrl) {
            context.helpUrl = helpUrl;
            return this;
        }

        public Builder operation(String operation) {
            context.operation = operation;
            return this;
        }

        public Builder leftType(String leftType) {
            context.leftType = leftType;
            return this;
        }

        public Builder rightType(String rightType) {
            context.rightType = rightType;
            return this;
        }

        public Builder leftValue(Object leftValue) {
            context.leftValue = leftValue;
            return this;
        }

        public Builder rightValue(Object rightValue) {
            context.rightValue = rightValue;
            return this;
        }

        public Builder functionName(String functionName) {
            context.functionName = functionName;
            return this;
        }

        public Builder paramIndex(Integer paramIndex) {
            context.paramIndex = paramIndex;
            return this;
        }

        public Builder value(Object value) {
            context.value = value;
            return this;
        }

        public Builder location(ErrorLocation location) {
            context.location = location;
            return this;
        }

        public ErrorContext build() {
            return context.copy();
        }
    }
}
