package reducer.hir;

import java.io.PrintWriter;

/**
* <b>Identifier</b> represents a valid C identifier which has a matching
* declaration. Construction of an identifier without a symbol is possible only
* through {@link SymbolTools#getOrphanID(String)}; such identifiers are
* reported as undeclared by the type checker.
*/
public class Identifier extends Expression {

    /** Fall-back string name for an orphan identifier. */
    private String name;

    /** Reference to the relevant symbol object. */
    private Symbol symbol;

    /**
    * Returns a new <b>incomplete</b> identifier with the given string name.
    *
    * @param name the raw string name.
    */
    protected Identifier(String name) {
        this.name = name;
    }

    /**
    * Constructs and returns a new <b>Identifier</b> with the given
    * <b>Symbol</b> object.
    *
    * @param symbol the relevant symbol object, which is typically a variable
    * declarator.
    */
    public Identifier(Symbol symbol) {
        this.symbol = symbol;
    }

    /** Returns the name of the identifier. */
    public String getName() {
        return (symbol == null) ? name : symbol.getSymbolName();
    }

    /** Returns the symbol this identifier refers to, or null for orphans. */
    public Symbol getSymbol() {
        return symbol;
    }

    @Override
    protected void printBody(PrintWriter o) {
        o.print(getName());
    }

}
