package reducer.transforms;

/**
* Outcome of a transformation run.
*/
public enum TransError {

    /** The transformation was applied, or only counted. */
    NONE,

    /** The requested instance exceeds the number of valid instances. */
    MAX_INSTANCE,

    /** The transformed program has errors. */
    INTERNAL

}
