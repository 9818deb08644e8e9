package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Base class for all statements.
*/
public abstract class Statement implements Traversable {

    /** The parent object */
    protected Traversable parent;

    /** The list of child objects */
    protected List<Traversable> children;

    protected Statement() {
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
    * Replaces the child at the given position. Subclasses restrict the kinds
    * of children they accept.
    *
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
