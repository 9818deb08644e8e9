package reducer.hir;

import java.io.PrintWriter;

/**
* Infix operators that assign the value of their righthand side to their
* lefthand side.
*/
public class AssignmentOperator extends BinaryOperator {

    private static String[] names = {
            "=", "+=", "&=", "^=", "|=", "/=", "%=", "*=", "<<=", ">>=",
            "-=" };

    public static final AssignmentOperator NORMAL = new AssignmentOperator(0);
    public static final AssignmentOperator ADD = new AssignmentOperator(1);
    public static final AssignmentOperator BITWISE_AND =
            new AssignmentOperator(2);
    public static final AssignmentOperator BITWISE_EXCLUSIVE_OR =
            new AssignmentOperator(3);
    public static final AssignmentOperator BITWISE_INCLUSIVE_OR =
            new AssignmentOperator(4);
    public static final AssignmentOperator DIVIDE = new AssignmentOperator(5);
    public static final AssignmentOperator MODULUS = new AssignmentOperator(6);
    public static final AssignmentOperator MULTIPLY =
            new AssignmentOperator(7);
    public static final AssignmentOperator SHIFT_LEFT =
            new AssignmentOperator(8);
    public static final AssignmentOperator SHIFT_RIGHT =
            new AssignmentOperator(9);
    public static final AssignmentOperator SUBTRACT =
            new AssignmentOperator(10);

    /**
    * Used internally -- you may not create arbitrary assignment operators
    * and may only use the ones provided as static members.
    *
    * @param value The numeric code of the operator.
    */
    private AssignmentOperator(int value) {
        this.value = value;
    }

    /** Checks if the operator combines an arithmetic operation. */
    public boolean isCompound() {
        return (this != NORMAL);
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
