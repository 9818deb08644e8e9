package reducer.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/** Represents a C pointer. */
public class PointerSpecifier extends Specifier {

    /** * */
    public static final PointerSpecifier UNQUALIFIED = new PointerSpecifier();

    /** * const */
    public static final PointerSpecifier CONST =
            new PointerSpecifier(Specifier.CONST);

    /** * volatile */
    public static final PointerSpecifier VOLATILE =
            new PointerSpecifier(Specifier.VOLATILE);

    /** * const volatile */
    public static final PointerSpecifier CONST_VOLATILE =
            new PointerSpecifier(Specifier.CONST, Specifier.VOLATILE);

    private List<Specifier> qualifiers;

    private PointerSpecifier(Specifier ... specifiers) {
        qualifiers = new ArrayList<Specifier>(specifiers.length);
        for (Specifier specifier : specifiers) {
            qualifiers.add(specifier);
        }
    }

    @Override
    public void print(PrintWriter o) {
        o.print("*");
        if (!qualifiers.isEmpty()) {
            o.print(" ");
            PrintTools.printListWithSpace(qualifiers, o);
            o.print(" ");
        }
    }

}
