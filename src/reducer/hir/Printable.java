package reducer.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print its data. Every class provides
* a default way of printing itself as C source code, and its toString method
* returns the same text.
*/
public interface Printable {

    /**
    * Prints the code for the IR represented by the object.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
