package reducer.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
* <b>SymbolTools</b> provides tools for querying symbols and the types of
* expressions. A type is represented as a list of specifiers: the base
* specifiers first, then the pointer specifiers, then the array dimensions
* from the innermost to the outermost. The last element of the list is
* therefore the outermost level of indirection; <b>int *a[3][4]</b> has the
* type <b>[int, *, [4], [3]]</b>.
*/
public final class SymbolTools {

    private SymbolTools() {
    }

    /**
    * Links the redeclarations of file-scope variables across all translation
    * units of the program. Every declarator with the same name as an earlier
    * file-scope declarator gets that earlier declarator as its canonical
    * declarator. Local variables, parameters and fields are not linked.
    *
    * @param program the program whose declarations are linked.
    */
    public static void linkRedeclarations(Program program) {
        Map<String, VariableDeclarator> first =
                new HashMap<String, VariableDeclarator>();
        for (Traversable tu : program.getChildren()) {
            for (Declaration decl :
                    ((TranslationUnit)tu).getDeclarations()) {
                if (!(decl instanceof VariableDeclaration)) {
                    continue;
                }
                for (VariableDeclarator d :
                        ((VariableDeclaration)decl).getDeclarators()) {
                    VariableDeclarator prev = first.get(d.getSymbolName());
                    if (prev == null) {
                        first.put(d.getSymbolName(), d);
                        d.setCanonicalDeclarator(d);
                    } else {
                        d.setCanonicalDeclarator(prev);
                    }
                }
            }
        }
        PrintTools.printlnStatus(3, "[SymbolTools] linked", first.size(),
                "file-scope variables");
    }

    /**
    * Returns an identifier that is not bound to any declaration. Such an
    * identifier is reported as undeclared by the type checker.
    *
    * @param name the name of the identifier.
    */
    public static Identifier getOrphanID(String name) {
        return new Identifier(name);
    }

    /**
    * Returns the symbol an expression names directly: the symbol of an
    * identifier or the member of an access expression.
    *
    * @param e the expression.
    * @return the symbol, or null if <b>e</b> does not name a symbol.
    */
    public static Symbol getSymbolOf(Expression e) {
        if (e instanceof Identifier) {
            return ((Identifier)e).getSymbol();
        } else if (e instanceof AccessExpression) {
            return ((AccessExpression)e).getMember().getSymbol();
        }
        return null;
    }

    /**
    * Returns the canonical declarator of the variable or field named by the
    * expression after stripping casts.
    *
    * @param e the expression.
    * @return the canonical declarator, or null if the expression does not
    * name a variable or a field.
    */
    public static VariableDeclarator getCanonicalDeclarator(Expression e) {
        Symbol symbol = getSymbolOf(IRTools.ignoreCasts(e));
        if (symbol instanceof VariableDeclarator) {
            return ((VariableDeclarator)symbol).getCanonicalDeclarator();
        }
        return null;
    }

    /**
    * Returns the number of pointer specifiers in the type of the declarator;
    * array dimensions are not counted.
    */
    public static int getIndirectionLevel(VariableDeclarator d) {
        int ret = 0;
        for (Specifier spec : d.getTypeSpecifiers()) {
            if (spec instanceof PointerSpecifier) {
                ret++;
            }
        }
        return ret;
    }

    /** Returns the full type of a declarator including array dimensions. */
    public static List<Specifier> getVariableType(Symbol symbol) {
        List<Specifier> ret = new ArrayList<Specifier>(symbol.getTypeSpecifiers());
        List<Specifier> dims = new ArrayList<Specifier>(symbol.getArraySpecifiers());
        Collections.reverse(dims);
        ret.addAll(dims);
        return ret;
    }

    /**
    * Checks if the outermost level of the type is a pointer.
    *
    * @param type the specifier list of a type, possibly null.
    */
    public static boolean isPointer(List<Specifier> type) {
        return (type != null && !type.isEmpty() &&
                type.get(type.size() - 1) instanceof PointerSpecifier);
    }

    /** Checks if the outermost level of the type is an array dimension. */
    public static boolean isArray(List<Specifier> type) {
        return (type != null && !type.isEmpty() &&
                type.get(type.size() - 1) instanceof ArraySpecifier);
    }

    /**
    * Returns the number of pointer and array levels of the type, counted from
    * the outermost level.
    */
    public static int getDepth(List<Specifier> type) {
        int ret = 0;
        for (int i = type.size() - 1; i >= 0; i--) {
            Specifier spec = type.get(i);
            if (spec instanceof PointerSpecifier ||
                spec instanceof ArraySpecifier) {
                ret++;
            } else {
                break;
            }
        }
        return ret;
    }

    /**
    * Checks if the type is a pointer to void, possibly qualified.
    */
    public static boolean isVoidPointer(List<Specifier> type) {
        return (isPointer(type) && getDepth(type) == 1 &&
                type.contains(Specifier.VOID));
    }

    /**
    * Returns the struct or union named by the base of the type.
    *
    * @return the aggregate declaration, or null if the base type is not an
    * aggregate.
    */
    public static ClassDeclaration getClassDeclaration(List<Specifier> type) {
        if (type == null) {
            return null;
        }
        for (Specifier spec : type) {
            if (spec instanceof UserSpecifier) {
                return ((UserSpecifier)spec).getDeclaration();
            }
        }
        return null;
    }

    /**
    * Returns the struct or union that declares the given field.
    *
    * @return the aggregate declaration, or null if <b>d</b> is not a field.
    */
    public static ClassDeclaration getEnclosingClass(VariableDeclarator d) {
        Declaration decl = d.getDeclaration();
        if (decl != null && decl.getParent() instanceof ClassDeclaration) {
            return (ClassDeclaration)decl.getParent();
        }
        return null;
    }

    /** Checks if the declarator is a member of a struct or union. */
    public static boolean isField(VariableDeclarator d) {
        return (getEnclosingClass(d) != null);
    }

    /**
    * Returns the procedure that declares the given parameter.
    *
    * @return the procedure, or null if <b>d</b> is not a parameter.
    */
    public static Procedure getProcedureOfParameter(VariableDeclarator d) {
        Declaration decl = d.getDeclaration();
        if (decl != null && decl.getParent() instanceof Procedure) {
            return (Procedure)decl.getParent();
        }
        return null;
    }

    /**
    * Returns the type of an expression as a list of specifiers.
    *
    * @param e the expression.
    * @return the type, or null if it cannot be determined.
    */
    public static List<Specifier> getExpressionType(Expression e) {
        if (e instanceof Identifier) {
            Symbol var = ((Identifier)e).getSymbol();
            if (var instanceof VariableDeclarator) {
                return getVariableType(var);
            }
        } else if (e instanceof AccessExpression) {
            Symbol var = ((AccessExpression)e).getMember().getSymbol();
            if (var != null) {
                return getVariableType(var);
            }
        } else if (e instanceof ArrayAccess) {
            return removeLevel(
                    getExpressionType(((ArrayAccess)e).getArrayName()));
        } else if (e instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)e;
            UnaryOperator op = ue.getOperator();
            List<Specifier> type = getExpressionType(ue.getExpression());
            if (op == UnaryOperator.DEREFERENCE) {
                return removeLevel(type);
            } else if (op == UnaryOperator.ADDRESS_OF) {
                if (type != null) {
                    LinkedList<Specifier> ret = new LinkedList<Specifier>(type);
                    ret.add(PointerSpecifier.UNQUALIFIED);
                    return ret;
                }
            } else if (op == UnaryOperator.LOGICAL_NEGATION) {
                return intType();
            } else {
                return type;
            }
        } else if (e instanceof AssignmentExpression) {
            return getExpressionType(((AssignmentExpression)e).getLHS());
        } else if (e instanceof BinaryExpression) {
            return getBinaryType((BinaryExpression)e);
        } else if (e instanceof Typecast) {
            return new ArrayList<Specifier>(((Typecast)e).getSpecifiers());
        } else if (e instanceof FunctionCall) {
            Procedure proc = ((FunctionCall)e).getProcedure();
            if (proc != null) {
                return new ArrayList<Specifier>(proc.getTypeSpecifiers());
            }
        } else if (e instanceof ConditionalExpression) {
            return getExpressionType(
                    ((ConditionalExpression)e).getTrueExpression());
        } else if (e instanceof IntegerLiteral) {
            return intType();
        } else if (e instanceof StringLiteral) {
            List<Specifier> ret = new ArrayList<Specifier>(2);
            ret.add(Specifier.CHAR);
            ret.add(PointerSpecifier.UNQUALIFIED);
            return ret;
        }
        return null;
    }

    private static List<Specifier> getBinaryType(BinaryExpression be) {
        BinaryOperator op = be.getOperator();
        if (op.isCompare() || op.isLogical()) {
            return intType();
        }
        List<Specifier> lhs = getExpressionType(be.getLHS());
        List<Specifier> rhs = getExpressionType(be.getRHS());
        if (op == BinaryOperator.ADD || op == BinaryOperator.SUBTRACT) {
            boolean lptr = (lhs != null && getDepth(lhs) > 0);
            boolean rptr = (rhs != null && getDepth(rhs) > 0);
            if (lptr && rptr && op == BinaryOperator.SUBTRACT) {
                List<Specifier> ret = new ArrayList<Specifier>(1);
                ret.add(Specifier.LONG);
                return ret;
            } else if (lptr) {
                return decay(lhs);
            } else if (rptr) {
                return decay(rhs);
            }
        }
        return lhs;
    }

    /* Replaces an outermost array dimension with a pointer */
    private static List<Specifier> decay(List<Specifier> type) {
        List<Specifier> ret = new ArrayList<Specifier>(type);
        if (isArray(ret)) {
            ret.set(ret.size() - 1, PointerSpecifier.UNQUALIFIED);
        }
        return ret;
    }

    /* Removes the outermost pointer or array level; null if there is none */
    private static List<Specifier> removeLevel(List<Specifier> type) {
        if (type == null || getDepth(type) == 0) {
            return null;
        }
        List<Specifier> ret = new ArrayList<Specifier>(type);
        ret.remove(ret.size() - 1);
        return ret;
    }

    private static List<Specifier> intType() {
        List<Specifier> ret = new ArrayList<Specifier>(1);
        ret.add(Specifier.INT);
        return ret;
    }

}
