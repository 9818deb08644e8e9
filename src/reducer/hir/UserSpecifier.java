package reducer.hir;

import java.io.PrintWriter;

/**
* Represents a type specifier naming a struct or union, e.g.
* <b>struct node</b>. The specifier refers to the class declaration directly,
* so two specifiers denote the same type exactly when they share the
* declaration object.
*/
public class UserSpecifier extends Specifier {

    private ClassDeclaration decl;

    public UserSpecifier(ClassDeclaration decl) {
        this.decl = decl;
    }

    /** Returns the struct or union this specifier names. */
    public ClassDeclaration getDeclaration() {
        return decl;
    }

    @Override
    public void print(PrintWriter o) {
        o.print(decl.getKey());
        o.print(" ");
        o.print(decl.getName());
    }

}
