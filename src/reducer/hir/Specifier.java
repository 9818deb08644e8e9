package reducer.hir;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
* Represents type specifiers and modifiers.
*/
public class Specifier implements Printable {

    private static String[] names = {
            "char", "short", "int", "long", "signed", "unsigned", "float",
            "double", "void", "_Bool", "const", "volatile", "restrict",
            "auto", "register", "static", "extern", "inline", "typedef" };

    public static final Specifier CHAR = new Specifier(0);
    public static final Specifier SHORT = new Specifier(1);
    public static final Specifier INT = new Specifier(2);
    public static final Specifier LONG = new Specifier(3);
    public static final Specifier SIGNED = new Specifier(4);
    public static final Specifier UNSIGNED = new Specifier(5);
    public static final Specifier FLOAT = new Specifier(6);
    public static final Specifier DOUBLE = new Specifier(7);
    public static final Specifier VOID = new Specifier(8);
    public static final Specifier CBOOL = new Specifier(9);
    public static final Specifier CONST = new Specifier(10);
    public static final Specifier VOLATILE = new Specifier(11);
    public static final Specifier RESTRICT = new Specifier(12);
    public static final Specifier AUTO = new Specifier(13);
    public static final Specifier REGISTER = new Specifier(14);
    public static final Specifier STATIC = new Specifier(15);
    public static final Specifier EXTERN = new Specifier(16);
    public static final Specifier INLINE = new Specifier(17);
    public static final Specifier TYPEDEF = new Specifier(18);

    /** Predefined integer value of each specifiers. */
    protected int value;

    /** Base constructor */
    protected Specifier() {
        value = -1;
    }

    private Specifier(int value) {
        this.value = value;
    }

    /** Prints the specifier to the print writer. */
    public void print(PrintWriter o) {
        if (value >= 0) {
            o.print(names[value]);
        }
    }

    /** Returns a string representation of the specifier. */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(16);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
