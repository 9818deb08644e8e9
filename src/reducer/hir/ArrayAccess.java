package reducer.hir;

import java.io.PrintWriter;

/**
* Represents a subscript <b>a[i]</b>. Accesses to multi-dimensional arrays are
* nested, so <b>a[i][j]</b> is an array access whose array name is
* <b>a[i]</b>.
*/
public class ArrayAccess extends Expression {

    /**
    * Creates an array access.
    *
    * @param array An expression evaluating to an address.
    * @param index The subscript expression.
    * @throws NotAnOrphanException if <b>array</b> or <b>index</b> has a parent.
    */
    public ArrayAccess(Expression array, Expression index) {
        addChild(array);
        addChild(index);
        index.setParens(false);
    }

    @Override
    protected void printBody(PrintWriter o) {
        getArrayName().print(o);
        o.print("[");
        getIndex().print(o);
        o.print("]");
    }

    /**
    * Returns the expression being subscripted.
    *
    * @return the base expression.
    */
    public Expression getArrayName() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the subscript expression.
    *
    * @return the index.
    */
    public Expression getIndex() {
        return (Expression)children.get(1);
    }

}
