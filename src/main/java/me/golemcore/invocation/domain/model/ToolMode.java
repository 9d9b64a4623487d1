package me.golemcore.invocation.domain.model;

/**
 * Tool choice sent to the model.
 *
 * @param mode
 *            one of {@code auto}, {@code none} or {@code required}
 * @param requiredFunctionName
 *            the function the model must call, only for {@code required}
 */
public record ToolMode(String mode, String requiredFunctionName) {

    public static final ToolMode AUTO = new ToolMode("auto", null);
    public static final ToolMode NONE = new ToolMode("none", null);
    public static final ToolMode REQUIRED_ANY = new ToolMode("required", null);

    public ToolMode {
        if (!"auto".equals(mode) && !"none".equals(mode) && !"required".equals(mode)) {
            throw new IllegalArgumentException("Unknown tool mode: " + mode);
        }
        if (requiredFunctionName != null && !"required".equals(mode)) {
            throw new IllegalArgumentException("A required function name is only valid for the required mode");
        }
    }

    public static ToolMode required(String functionName) {
        return new ToolMode("required", functionName);
    }

    public boolean isNone() {
        return "none".equals(mode);
    }
}
