package reducer.hir;

import java.io.PrintWriter;

/** Represents a string literal. */
public class StringLiteral extends Expression {

    private String value;

    public StringLiteral(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    protected void printBody(PrintWriter o) {
        o.print("\"");
        o.print(value);
        o.print("\"");
    }

}
