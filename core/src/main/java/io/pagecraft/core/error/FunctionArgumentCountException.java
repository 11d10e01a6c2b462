package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when a template function is called with the wrong number of arguments. */
public final class FunctionArgumentCountException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    public FunctionArgumentCountException(String signature, int expected, int actual, Location location) {
        super(
                "Function " + signature + " defined at " + location + " takes " + expected + " argument(s), "
                        + actual + " given.",
                location);
    }
}
