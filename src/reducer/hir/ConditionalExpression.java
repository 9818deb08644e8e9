package reducer.hir;

import java.io.PrintWriter;

/** Represents <b>cond ? a : b</b>. */
public class ConditionalExpression extends Expression {

    public ConditionalExpression(Expression condition, Expression true_expr,
                                 Expression false_expr) {
        addChild(condition);
        addChild(true_expr);
        addChild(false_expr);
        needs_parens = true;
    }

    @Override
    protected void printBody(PrintWriter o) {
        getCondition().print(o);
        o.print(" ? ");
        getTrueExpression().print(o);
        o.print(" : ");
        getFalseExpression().print(o);
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public Expression getTrueExpression() {
        return (Expression)children.get(1);
    }

    public Expression getFalseExpression() {
        return (Expression)children.get(2);
    }

}
