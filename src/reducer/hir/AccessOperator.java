package reducer.hir;

import java.io.PrintWriter;

/**
* Infix operators that accesses righthand side member of lefthand side
* structure or union.
*/
public class AccessOperator extends BinaryOperator {

    private static String[] names = {".", "->"};

    /**
    * .
    */
    public static final AccessOperator MEMBER_ACCESS = new AccessOperator(0);

    /**
    * -&gt;
    */
    public static final AccessOperator POINTER_ACCESS = new AccessOperator(1);

    /**
    * Used internally -- you may not create arbitrary access operators
    * and may only use the ones provided as static members.
    *
    * @param value The numeric code of the operator.
    */
    private AccessOperator(int value) {
        this.value = value;
    }

    @Override
    public boolean isCompare() {
        return false;
    }

    @Override
    public boolean isLogical() {
        return false;
    }

    @Override
    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

}
