package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents the entire program. Besides the translation units, a program owns
* the diagnostic state reported against it.
*/
public final class Program implements Traversable {

    /** Every child is a TranslationUnit. */
    private List<Traversable> children;

    private Diagnostics diagnostics;

    /**
    * Make an empty program.
    */
    public Program() {
        children = new ArrayList<Traversable>();
        diagnostics = new Diagnostics();
    }

    /**
    * Adds a translation unit to the program.
    *
    * @param tunit The translation unit to add.  Its parent
    * will be set to this program.
    */
    public void addTranslationUnit(TranslationUnit tunit) {
        if (tunit.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(tunit);
        tunit.setParent(this);
    }

    /** Returns the diagnostic state of this program. */
    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
    * Prints the translation units one after another.
    */
    public void print(PrintWriter o) {
        for (Traversable t : children) {
            t.print(o);
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(8000);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        // a program has no parent
        return null;
    }

    public void setChild(int index, Traversable t) {
        if (!(t instanceof TranslationUnit)) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.get(index).setParent(null);
        children.set(index, t);
        t.setParent(this);
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException(
                "A program cannot have a parent.");
    }

}
