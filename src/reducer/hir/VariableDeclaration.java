package reducer.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a declaration of one or more variables of the same base type,
* e.g. <b>int *p, q[3]</b>. Also used for function parameters and for the
* members of a struct or union.
*/
public class VariableDeclaration extends Declaration {

    /** Common specifiers of all declarators */
    private List<Specifier> specs;

    /**
    * Creates a variable declaration with the given specifiers and
    * declarators.
    *
    * @param specs the list of specifiers.
    * @param declarators the list of declarators.
    * @throws NotAnOrphanException if a declarator has a parent.
    */
    public VariableDeclaration(List<Specifier> specs,
                               List<VariableDeclarator> declarators) {
        this.specs = new ArrayList<Specifier>(specs);
        for (VariableDeclarator d : declarators) {
            addChild(d);
        }
    }

    /**
    * Creates a variable declaration with the given specifiers and a single
    * declarator.
    */
    public VariableDeclaration(List<Specifier> specs,
                               VariableDeclarator declarator) {
        this.specs = new ArrayList<Specifier>(specs);
        addChild(declarator);
    }

    /**
    * Creates a variable declaration with one specifier and a single
    * declarator.
    */
    public VariableDeclaration(Specifier spec, VariableDeclarator declarator) {
        this.specs = new ArrayList<Specifier>(1);
        this.specs.add(spec);
        addChild(declarator);
    }

    /**
    * Prints the declaration without the terminating semicolon.
    */
    public void print(PrintWriter o) {
        PrintTools.printListWithSpace(specs, o);
        o.print(" ");
        PrintTools.printListWithComma(children, o);
    }

    /** Returns the specifiers shared by all declarators. */
    public List<Specifier> getSpecifiers() {
        return specs;
    }

    /**
    * Returns the <var>n</var><i>th</i> declarator.
    *
    * @param n the zero-based position.
    */
    public VariableDeclarator getDeclarator(int n) {
        return (VariableDeclarator)children.get(n);
    }

    /** Returns the number of declarators. */
    public int getNumDeclarators() {
        return children.size();
    }

    /** Returns the declarators in order. */
    public List<VariableDeclarator> getDeclarators() {
        List<VariableDeclarator> ret =
                new ArrayList<VariableDeclarator>(children.size());
        for (Traversable t : children) {
            ret.add((VariableDeclarator)t);
        }
        return ret;
    }

}
