package reducer.hir;

import java.io.PrintWriter;

/** Represents a declaration appearing in a block. */
public class DeclarationStatement extends Statement {

    public DeclarationStatement(Declaration decl) {
        addChild(decl);
    }

    public Declaration getDeclaration() {
        return (Declaration)children.get(0);
    }

    @Override
    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException();
    }

    public void print(PrintWriter o) {
        getDeclaration().print(o);
        o.print(";");
    }

}
