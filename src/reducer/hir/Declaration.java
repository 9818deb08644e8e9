package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Base class for all declarations.
*/
public abstract class Declaration implements Traversable {

    /** The parent object */
    protected Traversable parent;

    /** The list of child objects */
    protected List<Traversable> children;

    /** Base constructor for derived classes. */
    protected Declaration() {
        parent = null;
        children = new ArrayList<Traversable>(1);
    }

    /**
    * Adds the specified traversable object at the end of the child list.
    *
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
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
    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Declarations do not allow their children to be replaced.
    * @throws UnsupportedOperationException always
    */
    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException(
                "Declarations do not support replacement of children.");
    }

    /** Returns a string representation of the declaration. */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
