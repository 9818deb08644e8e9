package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a single source file. Children are the top-level declarations in
* source order.
*/
public final class TranslationUnit implements Traversable {

    /** The parent program */
    private Traversable parent;

    /** The top-level declarations */
    private List<Traversable> children;

    /** The name of the original source file */
    private String input_filename;

    /**
    * Creates an empty translation unit associated with a file.
    *
    * @param input_filename The file name for this translation unit.
    */
    public TranslationUnit(String input_filename) {
        this.input_filename = input_filename;
        parent = null;
        children = new ArrayList<Traversable>();
    }

    /**
    * Appends a top-level declaration.
    *
    * @param decl the new declaration.
    * @throws NotAnOrphanException if <b>decl</b> has a parent.
    */
    public void addDeclaration(Declaration decl) {
        if (decl.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(decl);
        decl.setParent(this);
    }

    /** Returns the top-level declarations in source order. */
    public List<Declaration> getDeclarations() {
        List<Declaration> ret = new ArrayList<Declaration>(children.size());
        for (Traversable t : children) {
            ret.add((Declaration)t);
        }
        return ret;
    }

    /** Returns the name of the source file. */
    public String getInputFilename() {
        return input_filename;
    }

    /**
    * Prints the declarations separated by new lines. Variable and aggregate
    * declarations are terminated by a semicolon.
    */
    public void print(PrintWriter o) {
        for (Traversable t : children) {
            t.print(o);
            if (!(t instanceof Procedure)) {
                o.print(";");
            }
            o.print(PrintTools.line_sep);
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(1000);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException();
    }

    public void setParent(Traversable t) {
        if (t != null && !(t instanceof Program)) {
            throw new IllegalArgumentException();
        }
        parent = t;
    }

}
