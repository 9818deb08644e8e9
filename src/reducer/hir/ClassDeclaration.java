package reducer.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a struct or union definition. The children are the member
* declarations in order.
*/
public class ClassDeclaration extends Declaration {

    /**
    * Class for representing the two kinds of aggregate declarations,
    * <b>struct</b> and <b>union</b>.
    */
    public static class Key {

        private static final String[] name = {"struct", "union"};

        private int value;

        private Key(int value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return name[value];
        }
    }

    /** Keyword for <b>struct</b> type declaration. */
    public static final Key STRUCT = new Key(0);

    /** Keyword for <b>union</b> type declaration. */
    public static final Key UNION = new Key(1);

    private Key type;

    private String name;

    /**
    * Constructs an empty aggregate declaration with the given kind and name.
    *
    * @param type Must be one of STRUCT or UNION.
    * @param name The tag of the aggregate.
    */
    public ClassDeclaration(Key type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
    * Appends a member declaration.
    *
    * @param decl the new member.
    * @throws NotAnOrphanException if <b>decl</b> has a parent.
    */
    public void addDeclaration(VariableDeclaration decl) {
        addChild(decl);
    }

    /** Returns the member declarators in declaration order. */
    public List<VariableDeclarator> getFields() {
        List<VariableDeclarator> ret = new ArrayList<VariableDeclarator>();
        for (Traversable t : children) {
            ret.addAll(((VariableDeclaration)t).getDeclarators());
        }
        return ret;
    }

    public Key getKey() {
        return type;
    }

    public String getName() {
        return name;
    }

    /** Checks if this is a union, where only the first member is initialized. */
    public boolean isUnion() {
        return (type == UNION);
    }

    /**
    * Prints the definition without the terminating semicolon.
    */
    public void print(PrintWriter o) {
        o.print(type);
        o.print(" ");
        o.print(name);
        o.print(" {");
        o.print(PrintTools.line_sep);
        for (Traversable t : children) {
            o.print("  ");
            t.print(o);
            o.print(";");
            o.print(PrintTools.line_sep);
        }
        o.print("}");
    }

}
