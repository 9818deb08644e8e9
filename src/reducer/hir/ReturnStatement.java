package reducer.hir;

import java.io.PrintWriter;

/** Represents a return statement with an optional value. */
public class ReturnStatement extends Statement {

    public ReturnStatement() {
        super();
    }

    public ReturnStatement(Expression expr) {
        addChild(expr);
        expr.setParens(false);
    }

    /** Returns the returned value or null. */
    public Expression getExpression() {
        return (children.isEmpty()) ? null : (Expression)children.get(0);
    }

    @Override
    public void setChild(int index, Traversable t) {
        if (!(t instanceof Expression)) {
            throw new IllegalArgumentException();
        }
        super.setChild(index, t);
        ((Expression)t).setParens(false);
    }

    public void print(PrintWriter o) {
        o.print("return");
        if (getExpression() != null) {
            o.print(" ");
            getExpression().print(o);
        }
        o.print(";");
    }

}
