package org.tapline;

/**
 * Base class of the failures raised by the build pipeline itself.
 * <p>
 * Failures raised by plugins and collaborators are propagated unchanged and do not need to
 * extend this class. This is a RuntimeException because a build failure is reported through
 * the completion of the build future rather than by checked propagation.
 */
public class BuildException extends RuntimeException {

    /**
     * @param message Description of the failure
     */
    public BuildException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
