package reducer.hir;

import java.io.PrintWriter;

/** Represents a block of statements, <b>{ ... }</b>. */
public class CompoundStatement extends Statement {

    public CompoundStatement() {
        super();
    }

    /**
    * Appends a statement to the block.
    *
    * @param stmt the statement to be added.
    * @throws NotAnOrphanException if <b>stmt</b> has a parent.
    */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    /**
    * Appends a local declaration to the block.
    *
    * @param decl the declaration to be added.
    */
    public void addDeclaration(Declaration decl) {
        addChild(new DeclarationStatement(decl));
    }

    @Override
    public void setChild(int index, Traversable t) {
        if (!(t instanceof Statement)) {
            throw new IllegalArgumentException();
        }
        super.setChild(index, t);
    }

    public void print(PrintWriter o) {
        o.print("{");
        o.print(PrintTools.line_sep);
        for (Traversable t : children) {
            t.print(o);
            o.print(PrintTools.line_sep);
        }
        o.print("}");
    }

}
