package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Base class for all expressions. Unlike statements, expressions are compared
* by identity; two occurrences of the same text are different objects on the
* tree.
*/
public abstract class Expression implements Traversable {

    /** The parent object of the expression */
    protected Traversable parent;

    /** All children must be Expressions. */
    protected List<Traversable> children;

    /**
    * Determines whether this expression should have a set of parentheses
    * around it when printed.
    */
    protected boolean needs_parens;

    /** Constructor for derived classes. */
    protected Expression() {
        parent = null;
        children = new ArrayList<Traversable>(1);
        needs_parens = false;
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return children;
    }

    /* Traversable interface */
    public Traversable getParent() {
        return parent;
    }

    /**
    * Get the parent Statement containing this Expression.
    *
    * @return the enclosing Statement or null if this Expression
    *   is not inside a Statement.
    */
    public Statement getStatement() {
        Traversable t = this;
        do {
            t = t.getParent();
        } while (t != null && !(t instanceof Statement));
        return (Statement)t;
    }

    /**
    * Prints the expression on the specified print writer, surrounded by
    * parentheses if {@link #needsParens()} holds.
    *
    * @param o the target print writer.
    */
    public void print(PrintWriter o) {
        if (needs_parens) {
            o.print("(");
        }
        printBody(o);
        if (needs_parens) {
            o.print(")");
        }
    }

    /** Prints the expression without the outer parentheses. */
    protected abstract void printBody(PrintWriter o);

    /**
    * @throws NotAnOrphanException if <b>t</b> has a parent object.
    * @throws IllegalArgumentException if <b>index</b> is out-of-range or
    * <b>t</b> is not an expression.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (!(t instanceof Expression) || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        // Detach the old child
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /**
    * Sets whether the expression needs to have
    * an outer set of parentheses printed around it.
    *
    * @param f True to use parens, false to not use parens.
    */
    public void setParens(boolean f) {
        needs_parens = f;
    }

    /**
    * Checks if the expression needs parentheses around itself when printed.
    */
    public boolean needsParens() {
        return needs_parens;
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        // expressions can appear in many places so it's probably not
        // worth it to try and provide instanceof checks against t here
        parent = t;
    }

    /** Returns a string representation of the expression */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    /**
    * Common operation used in constructors - adds the specified traversable
    * object at the end of the child list.
    *
    * @param t the new child object to be added.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

}
