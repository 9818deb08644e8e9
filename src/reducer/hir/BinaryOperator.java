package reducer.hir;

import java.io.PrintWriter;

/**
* Infix operators that act on two expressions.
*/
public class BinaryOperator implements Printable {

    private static String[] names = {
            "+", "&", "^", "|", "/", "==", ">", ">=", "<", "<=", "!=",
            "&&", "||", "%", "*", "<<", ">>", "-" };

    public static final BinaryOperator ADD = new BinaryOperator(0);
    public static final BinaryOperator BITWISE_AND = new BinaryOperator(1);
    public static final BinaryOperator BITWISE_EXCLUSIVE_OR =
            new BinaryOperator(2);
    public static final BinaryOperator BITWISE_INCLUSIVE_OR =
            new BinaryOperator(3);
    public static final BinaryOperator DIVIDE = new BinaryOperator(4);
    public static final BinaryOperator COMPARE_EQ = new BinaryOperator(5);
    public static final BinaryOperator COMPARE_GT = new BinaryOperator(6);
    public static final BinaryOperator COMPARE_GE = new BinaryOperator(7);
    public static final BinaryOperator COMPARE_LT = new BinaryOperator(8);
    public static final BinaryOperator COMPARE_LE = new BinaryOperator(9);
    public static final BinaryOperator COMPARE_NE = new BinaryOperator(10);
    public static final BinaryOperator LOGICAL_AND = new BinaryOperator(11);
    public static final BinaryOperator LOGICAL_OR = new BinaryOperator(12);
    public static final BinaryOperator MODULUS = new BinaryOperator(13);
    public static final BinaryOperator MULTIPLY = new BinaryOperator(14);
    public static final BinaryOperator SHIFT_LEFT = new BinaryOperator(15);
    public static final BinaryOperator SHIFT_RIGHT = new BinaryOperator(16);
    public static final BinaryOperator SUBTRACT = new BinaryOperator(17);

    protected int value;

    /** Constructor for the assignment and access operators. */
    protected BinaryOperator() {
        value = -1;
    }

    private BinaryOperator(int value) {
        this.value = value;
    }

    /** Checks if the operator is a comparison. */
    public boolean isCompare() {
        return (value >= 5 && value <= 10);
    }

    /** Checks if the operator is a logical operator. */
    public boolean isLogical() {
        return (this == LOGICAL_AND || this == LOGICAL_OR);
    }

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

}
