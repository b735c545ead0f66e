package uiscope;

/**
 * Unchecked exception raised when the engine configuration cannot be loaded
 * from the classpath.
 *
 * <p>The hierarchy and discovery engine never throw this for well-typed input;
 * they degrade to best-effort results instead.
 */
public class UiScopeException extends RuntimeException {

    public UiScopeException(String msg) {
        super(msg);
    }

    public UiScopeException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
