package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Initializer holds initial values for the associated variable declarator.
* It is either a single value, <b>= expr</b>, or a brace-enclosed list whose
* elements are expressions or nested list initializers.
*/
public class Initializer implements Traversable {

    /** Parent traversable object */
    protected Traversable parent;

    /** List of children */
    protected List<Traversable> children;

    /** Flags for indicating it is a list */
    private boolean is_list;

    /**
    * Constructs a new initializer with the specified initializing value.
    * @param value the initializing value expression.
    */
    public Initializer(Expression value) {
        children = new ArrayList<Traversable>(1);
        addChild(value);
        value.setParens(false);
        is_list = false;
    }

    /**
    * Constructs a new initializer with the specified list of values.
    * @param values the list of initializing values.
    */
    public Initializer(List<? extends Traversable> values) {
        children = new ArrayList<Traversable>(values.size());
        for (Traversable value : values) {
            if (value instanceof Expression || value instanceof Initializer) {
                addChild(value);
                if (value instanceof Expression) {
                    ((Expression)value).setParens(false);
                }
            } else {
                throw new IllegalArgumentException(this.getClass().getName());
            }
        }
        is_list = true;
    }

    /**
    * Adds the specified traversable object to the list of children.
    * @param t the traversable object to be added.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    /** Checks if this is a brace-enclosed list. */
    public boolean isList() {
        return is_list;
    }

    /**
    * Returns the value of a single-value initializer.
    *
    * @return the value expression, or null for list initializers.
    */
    public Expression getValue() {
        return (is_list) ? null : (Expression)children.get(0);
    }

    /**
    * Prints an initializer to the specified writer. Top-level initializers
    * are preceded by the assignment sign.
    * @param o The writer on which to print the initializer.
    */
    public void print(PrintWriter o) {
        if (!(parent instanceof Initializer)) {
            o.print(" = ");
        }
        if (is_list) {
            o.print("{ ");
            PrintTools.printListWithComma(children, o);
            o.print(" }");
        } else {
            PrintTools.printList(children, o);
        }
    }

    /** Returns a string representation of the initializer. */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return children;
    }

    /* Traversable interface */
    public Traversable getParent() {
        return parent;
    }

    /* Traversable interface */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (!(t instanceof Expression || t instanceof Initializer) ||
            index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        parent = t;
    }

}
