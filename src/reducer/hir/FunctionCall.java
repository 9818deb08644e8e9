package reducer.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Represents a function call. Child 0 is the callee, the remaining children
* are the arguments.
*/
public class FunctionCall extends Expression {

    /**
    * Creates a function call.
    *
    * @param function An expression that evaluates to a function.
    * @param args A list of arguments to the function.
    * @throws NotAnOrphanException if any expression has a parent.
    */
    public FunctionCall(Expression function, List<? extends Expression> args) {
        addChild(function);
        for (Expression arg : args) {
            addChild(arg);
            arg.setParens(false);
        }
    }

    @Override
    protected void printBody(PrintWriter o) {
        getName().print(o);
        o.print("(");
        PrintTools.printListWithComma(children.subList(1, children.size()), o);
        o.print(")");
    }

    /**
    * Returns the expression that evaluates to the called function.
    *
    * @return the callee expression.
    */
    public Expression getName() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the argument at the given position.
    *
    * @param n the zero-based argument position.
    * @return the argument.
    */
    public Expression getArgument(int n) {
        return (Expression)children.get(n + 1);
    }

    /** Returns the number of arguments. */
    public int getNumArguments() {
        return children.size() - 1;
    }

    /**
    * Returns the procedure directly named by the callee, or null when the
    * call goes through an expression.
    */
    public Procedure getProcedure() {
        if (getName() instanceof Identifier) {
            Symbol symbol = ((Identifier)getName()).getSymbol();
            if (symbol instanceof Procedure) {
                return (Procedure)symbol;
            }
        }
        return null;
    }

}
