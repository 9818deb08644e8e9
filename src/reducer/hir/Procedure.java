package reducer.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a function definition. Children are the parameter declarations
* followed by the body.
*/
public final class Procedure extends Declaration implements Symbol {

    /** The return type */
    private List<Specifier> specs;

    private String name;

    /**
    * Creates a function definition.
    *
    * @param specs the return type specifiers.
    * @param name the function name.
    * @param params the parameter declarations, one declarator each.
    * @param body the function body.
    * @throws NotAnOrphanException if a parameter or the body has a parent.
    */
    public Procedure(List<Specifier> specs, String name,
                     List<VariableDeclaration> params, CompoundStatement body) {
        this.specs = new ArrayList<Specifier>(specs);
        this.name = name;
        for (VariableDeclaration param : params) {
            addChild(param);
        }
        addChild(body);
    }

    public void print(PrintWriter o) {
        PrintTools.printSpecifiers(specs, o);
        o.print(" ");
        o.print(name);
        o.print("(");
        PrintTools.printListWithComma(getParameters(), o);
        o.print(") ");
        getBody().print(o);
    }

    /** Returns the parameter declarations. */
    public List<VariableDeclaration> getParameters() {
        List<VariableDeclaration> ret = new ArrayList<VariableDeclaration>();
        for (int i = 0; i < children.size() - 1; i++) {
            ret.add((VariableDeclaration)children.get(i));
        }
        return ret;
    }

    /**
    * Returns the declarator of the <var>n</var><i>th</i> parameter.
    *
    * @param n the zero-based parameter position.
    */
    public VariableDeclarator getParameter(int n) {
        return ((VariableDeclaration)children.get(n)).getDeclarator(0);
    }

    /** Returns the number of parameters. */
    public int getNumParameters() {
        return children.size() - 1;
    }

    /** Returns the function body. */
    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(children.size() - 1);
    }

    /** Returns the return type specifiers. */
    public List<Specifier> getTypeSpecifiers() {
        return specs;
    }

    public List<Specifier> getArraySpecifiers() {
        return new ArrayList<Specifier>(0);
    }

    public String getSymbolName() {
        return name;
    }

    public Declaration getDeclaration() {
        return this;
    }

}
