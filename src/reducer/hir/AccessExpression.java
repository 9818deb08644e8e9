package reducer.hir;

import java.io.PrintWriter;

/**
* <b>AccessExpression</b> is a representation for expressions that access
* a member of a struct or union. The righthand side is always an identifier
* naming the field.
*/
public class AccessExpression extends BinaryExpression {

    /**
    * Creates a member access expression.
    *
    * @param lhs The accessed structure or pointer to structure.
    * @param op An access operator.
    * @param member The identifier of the accessed field.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>member</b> has a parent
    * object.
    */
    public AccessExpression(Expression lhs, AccessOperator op,
                            Identifier member) {
        super(lhs, op, member);
        setParens(false);
    }

    @Override
    protected void printBody(PrintWriter o) {
        getLHS().print(o);
        op.print(o);
        getRHS().print(o);
    }

    @Override
    public AccessOperator getOperator() {
        return (AccessOperator)op;
    }

    /**
    * Replaces the access operator, e.g. turning <b>p-&gt;f</b> into
    * <b>p.f</b>.
    *
    * @param op the new operator.
    */
    public void setOperator(AccessOperator op) {
        this.op = op;
    }

    /** Returns the identifier of the accessed field. */
    public Identifier getMember() {
        return (Identifier)getRHS();
    }

}
