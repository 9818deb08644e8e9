package reducer.hir;

/**
* <b>IRTools</b> provides tools that perform search and replacement of the IR
* tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Checks if the IR tree rooted at <b>t</b> is consistent, i.e., every
    * object below the root has a parent whose child list contains the
    * object.
    *
    * @param t the root of the tree to be checked.
    * @return true if the tree is consistent.
    */
    public static boolean checkConsistency(Traversable t) {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        iter.next();
        while (iter.hasNext()) {
            Traversable tr = iter.next();
            Traversable p = tr.getParent();
            if (p == null ||
                Tools.identityIndexOf(p.getChildren(), tr) < 0) {
                PrintTools.printlnStatus(0, "Affected IR =", tr);
                PrintTools.printlnStatus(0, "Affected parent =", p);
                return false;
            }
        }
        return true;
    }

    /**
    * Returns the expression under any number of type casts.
    *
    * @param e the expression.
    * @return the innermost non-cast expression.
    */
    public static Expression ignoreCasts(Expression e) {
        while (e instanceof Typecast) {
            e = ((Typecast)e).getExpression();
        }
        return e;
    }

    /**
    * Replaces <b>old</b> with <b>repl</b> in the parent of <b>old</b>. The
    * replaced expression becomes an orphan. The parentheses of <b>repl</b> are
    * adjusted to its new context.
    *
    * @param old the expression to be replaced; must have a parent.
    * @param repl an orphan expression.
    * @throws NotAnOrphanException if <b>repl</b> has a parent.
    * @throws IllegalStateException if <b>old</b> is not linked to a parent.
    */
    public static void replace(Expression old, Expression repl) {
        if (old == repl) {
            return;
        }
        if (repl.getParent() != null) {
            throw new NotAnOrphanException();
        }
        Traversable parent = old.getParent();
        int index = (parent == null) ?
                -1 : Tools.identityIndexOf(parent.getChildren(), old);
        if (index < 0) {
            throw new IllegalStateException("Expression is not on the tree: "
                    + old);
        }
        // set the list directly so that checks in setChild do not reject
        // declarators and initializers as parents
        old.setParent(null);
        parent.getChildren().set(index, repl);
        repl.setParent(parent);
        adjustParens(repl);
    }

    /**
    * Replaces <b>outer</b> with its child <b>inner</b>, removing one level of
    * the tree, e.g., <b>*p</b> becomes <b>p</b>.
    *
    * @param outer the expression to be removed.
    * @param inner a child of <b>outer</b>.
    */
    public static void unwrap(Expression outer, Expression inner) {
        if (inner.getParent() != outer) {
            throw new IllegalArgumentException(inner + " is not a child of "
                    + outer);
        }
        inner.setParent(null);
        replace(outer, inner);
    }

    /**
    * Wraps the expression with the specified unary operator in place, e.g.,
    * <b>p</b> becomes <b>&amp;p</b>.
    *
    * @param op the unary operator.
    * @param e the expression to be wrapped; must have a parent.
    * @return the new unary expression.
    */
    public static UnaryExpression wrap(UnaryOperator op, Expression e) {
        Traversable parent = e.getParent();
        int index = (parent == null) ?
                -1 : Tools.identityIndexOf(parent.getChildren(), e);
        if (index < 0) {
            throw new IllegalStateException("Expression is not on the tree: "
                    + e);
        }
        e.setParent(null);
        UnaryExpression ret = new UnaryExpression(op, e);
        adjustParens(e);
        parent.getChildren().set(index, ret);
        ret.setParent(parent);
        adjustParens(ret);
        return ret;
    }

    /**
    * Sets the parentheses of an expression after it was moved under a new
    * parent. Contexts that delimit the expression by themselves drop the
    * parentheses; operands of prefix and postfix operators get them when
    * the expression binds more loosely.
    */
    static void adjustParens(Expression e) {
        Traversable parent = e.getParent();
        if (parent instanceof Initializer ||
            parent instanceof Statement) {
            e.setParens(false);
        } else if (parent instanceof FunctionCall) {
            if (((FunctionCall)parent).getName() != e) {
                e.setParens(false);
            } else {
                e.setParens(!isPostfixOperand(e));
            }
        } else if (parent instanceof ArrayAccess) {
            if (((ArrayAccess)parent).getIndex() == e) {
                e.setParens(false);
            } else {
                e.setParens(!isPostfixOperand(e));
            }
        } else if (parent instanceof AccessExpression) {
            if (((AccessExpression)parent).getLHS() == e) {
                e.setParens(!isPostfixOperand(e));
            }
        } else if (parent instanceof UnaryExpression &&
                   ((UnaryExpression)parent).getOperator().isPostfix()) {
            e.setParens(!isPostfixOperand(e));
        } else if (parent instanceof UnaryExpression ||
                   parent instanceof Typecast) {
            e.setParens(isLooselyBound(e));
        } else if (parent instanceof BinaryExpression ||
                   parent instanceof ConditionalExpression) {
            if (isLooselyBound(e)) {
                e.setParens(true);
            }
        }
    }

    /* Expressions that can appear in front of a postfix operator as is */
    private static boolean isPostfixOperand(Expression e) {
        return (e instanceof Identifier || e instanceof ArrayAccess ||
                e instanceof AccessExpression || e instanceof FunctionCall ||
                e instanceof IntegerLiteral || e instanceof StringLiteral);
    }

    private static boolean isLooselyBound(Expression e) {
        return ((e instanceof BinaryExpression &&
                 !(e instanceof AccessExpression)) ||
                e instanceof ConditionalExpression);
    }

}
