package reducer.hir;

import java.io.PrintWriter;

/**
* Represents an expression having a binary operator and two operands. Both
* assignments and member accesses share this representation.
*/
public class BinaryExpression extends Expression {

    /** The operator for this expression */
    protected BinaryOperator op;

    /**
    * Creates a binary expression.
    *
    * @param lhs The lefthand expression.
    * @param op A binary operator.
    * @param rhs The righthand expression.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>rhs</b> has a parent
    * object.
    */
    public BinaryExpression(Expression lhs, BinaryOperator op, Expression rhs) {
        this.op = op;
        addChild(lhs);
        addChild(rhs);
        needs_parens = true;
    }

    @Override
    protected void printBody(PrintWriter o) {
        getLHS().print(o);
        o.print(" ");
        op.print(o);
        o.print(" ");
        getRHS().print(o);
    }

    /**
    * Returns the lefthand expression.
    *
    * @return the lefthand expression.
    */
    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the operator of the expression.
    *
    * @return the operator.
    */
    public BinaryOperator getOperator() {
        return op;
    }

    /**
    * Returns the righthand expression.
    *
    * @return the righthand expression.
    */
    public Expression getRHS() {
        return (Expression)children.get(1);
    }

}
