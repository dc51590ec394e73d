package org.tapline.compiler;

import org.tapline.BuildException;

/**
 * Thrown when a build is requested on a compiler that is already building or watching.
 */
public class ConcurrentCompilationException extends BuildException {

    public ConcurrentCompilationException() {
        super("You ran a build while another build or watch session of the same compiler was still running. "
                + "A compiler only supports a single concurrent compilation at a time.");
    }
}
