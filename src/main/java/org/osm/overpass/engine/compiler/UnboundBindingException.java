package org.osm.overpass.engine.compiler;

/**
 * Thrown when a statement reads a named set no earlier statement assigned.
 */
public class UnboundBindingException extends OverpassCompileException {

    private final String bindingName;

    public UnboundBindingException(String bindingName) {
        super("Set '." + bindingName + "' is read before it is assigned");
        this.bindingName = bindingName;
    }

    public String getBindingName() {
        return bindingName;
    }
}
