package org.tapline.compiler;

import org.tapline.BuildException;

/**
 * Thrown when plugins keep requesting additional passes beyond {@code maxAdditionalPasses}.
 */
public class AdditionalPassLimitException extends BuildException {

    private final int limit;

    public AdditionalPassLimitException(int limit) {
        super("Additional pass limit of " + limit + " exceeded; a plugin keeps requesting needAdditionalPass");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
