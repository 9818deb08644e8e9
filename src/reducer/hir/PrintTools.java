package reducer.hir;

import reducer.exec.Driver;

import java.io.PrintWriter;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
* <b>PrintTools</b> provides tools that perform printing of collections of IR
* or debug messages.
*/
public final class PrintTools {

    // Short names for system properties
    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is greater than {@code min_verbosity}.
    * This method minimizes overheads from string composition since it is done
    * only if the verbosity level is met.
    * @param min_verbosity the minium verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= getVerbosity()) {
            if (items.length > 0) {
                StringBuilder sb = new StringBuilder(80);
                sb.append(items[0]);
                for (int i = 1; i < items.length; i++) {
                    sb.append(" ").append(items[i]);
                }
                System.err.println(sb.toString());
            }
        }
    }

    /**
    * Prints a string to System.out if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void println(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.out.println(message);
        }
    }

    /**
    * Prints a list of printable object to the specified print writer with a
    * separating string. If the list contains an object not printable, this
    * method throws a cast exception.
    * @param list the list of printable object.
    * @param w the target print writer.
    * @param sep the separating string.
    */
    public static void
            printListWithSeparator(List<?> list, PrintWriter w, String sep) {
        if (list == null) {
            return;
        }
        int list_size = list.size();
        if (list_size > 0) {
            ((Printable)list.get(0)).print(w);
            for (int i = 1; i < list_size; i++) {
                w.print(sep);
                ((Printable)list.get(i)).print(w);
            }
        }
    }

    /**
    * Prints a list of printable object to the specified print writer with a
    * separating comma.
    */
    public static void printListWithComma(List<?> list, PrintWriter w) {
        printListWithSeparator(list, w, ", ");
    }

    /**
    * Prints a list of printable object to the specified print writer with a
    * separating white space.
    */
    public static void printListWithSpace(List<?> list, PrintWriter w) {
        printListWithSeparator(list, w, " ");
    }

    /**
    * Prints a list of printable object to the specified print writer without
    * any separating string.
    */
    public static void printList(List<?> list, PrintWriter w) {
        printListWithSeparator(list, w, "");
    }

    /**
    * Prints a type given as a specifier list, e.g. <b>int **</b>. Pointer
    * specifiers are printed without separation after the other specifiers.
    *
    * @param specs the specifiers of the type.
    * @param w the target print writer.
    */
    public static void printSpecifiers(List<Specifier> specs, PrintWriter w) {
        boolean first = true;
        boolean pointer = false;
        for (Specifier spec : specs) {
            if (spec instanceof PointerSpecifier) {
                if (!pointer && !first) {
                    w.print(" ");
                }
                pointer = true;
            } else if (!first) {
                w.print(" ");
            }
            spec.print(w);
            first = false;
        }
    }

    /**
    * Returns the global verbosity level taken from the {@code verbosity}
    * option. The option is read on every call so that it can be changed
    * between runs.
    */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch(NumberFormatException e) {
            return 0;
        }
    }

    /**
    * Converts a collection of objects to a string with the given separator.
    * The elements are sorted alphabetically, and any {@code Symbol} object is
    * printed with its name.
    *
    * @param coll the collection to be converted.
    * @param separator the separating string.
    * @return the converted string.
    */
    public static String
            collectionToString(Collection<?> coll, String separator) {
        String ret = "";
        if (coll == null || coll.isEmpty()) {
            return ret;
        }
        TreeSet<String> sorted = new TreeSet<String>();
        for (Object o : coll) {
            if (o instanceof Symbol) {
                sorted.add(((Symbol)o).getSymbolName());
            } else {
                sorted.add(o.toString());
            }
        }
        Iterator<String> iter = sorted.iterator();
        if (iter.hasNext()) {
            StringBuilder sb = new StringBuilder(80);
            sb.append(iter.next());
            while (iter.hasNext()) {
                sb.append(separator).append(iter.next());
            }
            ret = sb.toString();
        }
        return ret;
    }

}
