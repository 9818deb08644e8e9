package reducer.hir;

/**
* Represents a plain or compound assignment.
*/
public class AssignmentExpression extends BinaryExpression {

    /**
    * Creates an assignment expression.
    *
    * @param lhs The lefthand expression.
    * @param op An assignment operator.
    * @param rhs The righthand expression.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>rhs</b> has a parent
    * object.
    */
    public AssignmentExpression(Expression lhs, AssignmentOperator op,
                                Expression rhs) {
        super(lhs, op, rhs);
    }

    /**
    * Returns the operator of the expression.
    *
    * @return the operator.
    */
    @Override
    public AssignmentOperator getOperator() {
        return (AssignmentOperator)op;
    }

}
