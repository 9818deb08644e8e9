package reducer.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a type cast <b>(type)expr</b>. The type is a list of specifiers
* in the same form as {@link Symbol#getTypeSpecifiers()}.
*/
public class Typecast extends Expression {

    private List<Specifier> specs;

    /**
    * Creates a type cast.
    *
    * @param specs A list of type specifiers, pointers last.
    * @param expr The expression to cast.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public Typecast(List<Specifier> specs, Expression expr) {
        this.specs = new ArrayList<Specifier>(specs);
        addChild(expr);
    }

    @Override
    protected void printBody(PrintWriter o) {
        o.print("(");
        PrintTools.printSpecifiers(specs, o);
        o.print(")");
        getExpression().print(o);
    }

    /**
    * Returns the modifiable list of specifiers of the cast type.
    *
    * @return the specifiers.
    */
    public List<Specifier> getSpecifiers() {
        return specs;
    }

    /**
    * Returns the expression being cast.
    *
    * @return the operand.
    */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

}
