package org.catalogapi.export.marc;

/**
 * Outcome of running an action against one subfield via
 * {@link Field#doForEachSubfield(java.util.function.Function)}.
 */
public record SubfieldChange<T>(String tag, String dataBefore, T returnValue, String dataAfter) {

    public boolean changed() {
        return !dataBefore.equals(dataAfter);
    }
}
