package org.carball.querycollector.model.query;

/**
 * One frame of the call stack that issued a statement.
 */
public record CallSiteFrame(
        String className,
        String methodName,
        String fileName,
        int lineNumber
) {

    public static CallSiteFrame from(StackTraceElement element) {
        return new CallSiteFrame(
                element.getClassName(),
                element.getMethodName(),
                element.getFileName(),
                element.getLineNumber());
    }

    /**
     * Source location, falling back to the class name when no file is recorded.
     */
    public String location() {
        String source = fileName != null ? fileName : className;
        return lineNumber >= 0 ? source + ":" + lineNumber : source;
    }

    @Override
    public String toString() {
        return location() + " in " + className + "." + methodName;
    }
}
