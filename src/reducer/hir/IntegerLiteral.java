package reducer.hir;

import java.io.PrintWriter;

/** Represents an integer literal. */
public class IntegerLiteral extends Expression {

    private long value;

    public IntegerLiteral(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    protected void printBody(PrintWriter o) {
        o.print(value);
    }

}
