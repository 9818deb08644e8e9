package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a declarator for a variable, a parameter or a field in a
* VariableDeclaration. Pointer specifiers are kept before the name and array
* specifiers after it, so <b>int *a[3]</b> has the leading specifier list
* <b>[*]</b> and the trailing list <b>[[3]]</b>. Declarators are compared by
* identity.
*/
public class VariableDeclarator implements Traversable, Symbol {

    /** The parent object */
    private Traversable parent;

    /** The initializer, if any, is the only child */
    private List<Traversable> children;

    private String name;

    /** The list of specifiers that appear before the declarator ID */
    private List<Specifier> leading_specs;

    /** The list of specifiers that appear after the declarator ID */
    private List<Specifier> trailing_specs;

    /** The first declaration of the same entity; null if this is the first */
    private VariableDeclarator canonical;

    /**
    * Constructs a new VariableDeclarator with the given name.
    *
    * @param name the name of the new variable.
    */
    public VariableDeclarator(String name) {
        this(new ArrayList<Specifier>(1), name, new ArrayList<Specifier>(1));
    }

    /**
    * Constructs a new variable declarator with the given leading specifier and
    * name.
    *
    * @param spec the given leading specifier.
    * @param name the name of the new variable.
    */
    public VariableDeclarator(Specifier spec, String name) {
        this(name);
        leading_specs.add(spec);
    }

    /**
    * Constructs a new variable declarator with the given leading specifiers
    * and name.
    *
    * @param leading_specs the list of leading specifiers.
    * @param name the name of the new variable.
    */
    public VariableDeclarator(List<Specifier> leading_specs, String name) {
        this(leading_specs, name, new ArrayList<Specifier>(1));
    }

    /**
    * Constructs a new variable declarator with the given leading specifiers,
    * the name, and the trailing specifiers.
    *
    * @param leading_specs the list of leading specifiers.
    * @param name the name of the new variable.
    * @param trailing_specs the list of trailing specifiers.
    */
    public VariableDeclarator(List<Specifier> leading_specs, String name,
                              List<Specifier> trailing_specs) {
        this.name = name;
        this.leading_specs = new ArrayList<Specifier>(leading_specs);
        this.trailing_specs = new ArrayList<Specifier>(trailing_specs);
        children = new ArrayList<Traversable>(1);
        canonical = null;
    }

    /**
    * Prints a variable declarator to a stream.
    *
    * @param o The writer on which to print the declarator.
    */
    public void print(PrintWriter o) {
        PrintTools.printList(leading_specs, o);
        o.print(name);
        PrintTools.printList(trailing_specs, o);
        if (getInitializer() != null) {
            getInitializer().print(o);
        }
    }

    /** Returns a string representation of the declarator. */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    /**
    * Returns the modifiable list of leading specifiers of this declarator.
    */
    public List<Specifier> getSpecifiers() {
        return leading_specs;
    }

    /**
    * Returns the modifiable list of array specifiers of this declarator.
    */
    public List<Specifier> getArraySpecifiers() {
        return trailing_specs;
    }

    /**
    * Returns the specifiers of the enclosing declaration followed by the
    * leading specifiers of this declarator.
    */
    public List<Specifier> getTypeSpecifiers() {
        List<Specifier> ret = new ArrayList<Specifier>(4);
        Declaration decl = getDeclaration();
        if (decl instanceof VariableDeclaration) {
            ret.addAll(((VariableDeclaration)decl).getSpecifiers());
        }
        ret.addAll(leading_specs);
        return ret;
    }

    public String getSymbolName() {
        return name;
    }

    public Declaration getDeclaration() {
        return (Declaration)parent;
    }

    /**
    * Returns the initializer of the declarator if one exists.
    *
    * @return the initializer or null.
    */
    public Initializer getInitializer() {
        if (children.size() > 0) {
            return (Initializer)children.get(0);
        } else {
            return null;
        }
    }

    /**
    * Sets the initializer, replacing any existing one.
    *
    * @param init the new initializer, or null to remove it.
    * @throws NotAnOrphanException if <b>init</b> has a parent.
    */
    public void setInitializer(Initializer init) {
        if (getInitializer() != null) {
            getInitializer().setParent(null);
            children.clear();
        }
        if (init != null) {
            if (init.getParent() != null) {
                throw new NotAnOrphanException();
            }
            children.add(init);
            init.setParent(this);
        }
    }

    /**
    * Returns the representative declarator shared by all redeclarations of
    * this entity. A declarator that has not been linked to an earlier one is
    * its own canonical declarator.
    */
    public VariableDeclarator getCanonicalDeclarator() {
        return (canonical == null) ? this : canonical;
    }

    /** Links this declarator to the first declaration of the same entity. */
    void setCanonicalDeclarator(VariableDeclarator first) {
        canonical = (first == this) ? null : first.getCanonicalDeclarator();
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
        if (!(t instanceof Initializer) || index != 0) {
            throw new IllegalArgumentException();
        }
        setInitializer((Initializer)t);
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        if (t != null && !(t instanceof VariableDeclaration)) {
            throw new IllegalArgumentException();
        }
        parent = t;
    }

}
