package reducer.transforms;

import reducer.hir.Program;

/**
* Base class of reduction transformations. A transformation either counts its
* valid instances (query mode) or applies the instance selected by the
* transformation counter, where instances are numbered from 1.
*/
public abstract class Transformation extends TransformPass {

    /** The registered name of the transformation */
    protected final String name;

    /** Human readable description */
    protected final String description;

    /** The 1-based index of the instance to be applied */
    protected int transformation_counter;

    /** Number of valid instances seen so far */
    protected int valid_instance_num;

    protected boolean query_instance_only;

    protected TransError trans_error;

    protected Transformation(Program program, String name,
                             String description) {
        super(program);
        this.name = name;
        this.description = description;
        transformation_counter = -1;
        valid_instance_num = 0;
        query_instance_only = false;
        trans_error = TransError.NONE;
    }

    @Override
    public String getPassName() {
        return "[" + name + "]";
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
    * Sets the instance to be applied.
    *
    * @param counter the 1-based instance index.
    * @throws IllegalArgumentException if <b>counter</b> is less than 1.
    */
    public void setTransformationCounter(int counter) {
        if (counter < 1) {
            throw new IllegalArgumentException(
                    "Invalid transformation counter: " + counter);
        }
        transformation_counter = counter;
    }

    public int getTransformationCounter() {
        return transformation_counter;
    }

    /** Turns the query mode on or off; query mode only counts instances. */
    public void setQueryInstanceFlag(boolean flag) {
        query_instance_only = flag;
    }

    public boolean isQueryInstanceOnly() {
        return query_instance_only;
    }

    /** Returns the number of valid instances counted by the last run. */
    public int getNumTransformationInstances() {
        return valid_instance_num;
    }

    public TransError getTransError() {
        return trans_error;
    }

    /** Checks if the last run finished without an error. */
    public boolean transSuccess() {
        return (trans_error == TransError.NONE);
    }

}
