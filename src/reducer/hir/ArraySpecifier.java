package reducer.hir;

import java.io.PrintWriter;

/**
* Represents one dimension of a C array, e.g. <b>[10]</b> or <b>[]</b>.
* Multi-dimensional arrays carry one specifier per dimension.
*/
public class ArraySpecifier extends Specifier {

    /** Dimension of unknown size */
    public static final ArraySpecifier UNBOUNDED = new ArraySpecifier(-1);

    private int size;

    /**
    * Constructs an array specifier of the given size.
    *
    * @param size the number of elements, or a negative value for an
    * unbounded dimension.
    */
    public ArraySpecifier(int size) {
        this.size = size;
    }

    /** Returns the size of the dimension, negative if unbounded. */
    public int getSize() {
        return size;
    }

    @Override
    public void print(PrintWriter o) {
        o.print("[");
        if (size >= 0) {
            o.print(size);
        }
        o.print("]");
    }

}
