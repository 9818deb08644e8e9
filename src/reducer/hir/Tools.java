package reducer.hir;

import java.util.List;

/**
* Collection of general tools that are not specific to the IR. Symbol access is
* in {@link SymbolTools}, printing in {@link PrintTools} and IR search and
* manipulation in {@link IRTools}.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the index of the first element in the list that is the very same
    * object as <var>o</var>, or -1. Unlike {@link List#indexOf(Object)} this
    * does not use equals, which expressions override with a lexical
    * comparison.
    *
    * @param list the list to be searched.
    * @param o the object to be found.
    * @return the index of the object or -1.
    */
    public static int identityIndexOf(List<?> list, Object o) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == o) {
                return i;
            }
        }
        return -1;
    }

    /** Returns the current system time in seconds. */
    public static double getTime() {
        return System.currentTimeMillis() / 1000.0;
    }

    /**
    * Returns the elapsed time in seconds since the given time.
    *
    * @param since the time taken from {@link #getTime()}.
    */
    public static double getTime(double since) {
        return getTime() - since;
    }

}
