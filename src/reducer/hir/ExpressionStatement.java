package reducer.hir;

import java.io.PrintWriter;

/** Represents an expression evaluated for its side effects. */
public class ExpressionStatement extends Statement {

    public ExpressionStatement(Expression expr) {
        addChild(expr);
        expr.setParens(false);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
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
        getExpression().print(o);
        o.print(";");
    }

}
