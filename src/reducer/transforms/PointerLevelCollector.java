package reducer.transforms;

import reducer.hir.AccessExpression;
import reducer.hir.ArrayAccess;
import reducer.hir.AssignmentExpression;
import reducer.hir.BinaryExpression;
import reducer.hir.BinaryOperator;
import reducer.hir.DepthFirstIterator;
import reducer.hir.Expression;
import reducer.hir.IRTools;
import reducer.hir.Identifier;
import reducer.hir.PrintTools;
import reducer.hir.Specifier;
import reducer.hir.SymbolTools;
import reducer.hir.Traversable;
import reducer.hir.UnaryExpression;
import reducer.hir.UnaryOperator;
import reducer.hir.VariableDeclarator;

import java.util.List;

/**
* Collects the pointer declarators of a program into a
* {@link PointerLevelContext}. Three kinds of IR objects are visited:
* <ul>
* <li>declarators of variables and fields with a pointer type, which are
*     registered by their indirection level; parameters are skipped;</li>
* <li>address-of expressions on a variable or a member access, which mark
*     the declarator as address-taken;</li>
* <li>assignments to a pointer, which invalidate the assigned declarator
*     unless the right-hand side is an identifier, a unary expression or an
*     array access.</li>
* </ul>
* Top-level declarations can be collected one at a time in program order.
*/
public class PointerLevelCollector {

    private static final String pass_name = "[PointerLevelCollector]";

    private PointerLevelContext context;

    public PointerLevelCollector(PointerLevelContext context) {
        this.context = context;
    }

    /**
    * Collects from the IR tree rooted at <b>t</b>.
    *
    * @param t a top-level declaration, a translation unit or the program.
    */
    public void collect(Traversable t) {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        while (iter.hasNext()) {
            Traversable o = iter.next();
            if (o instanceof VariableDeclarator) {
                visitDeclarator((VariableDeclarator)o);
            } else if (o instanceof UnaryExpression) {
                visitUnaryExpression((UnaryExpression)o);
            } else if (o instanceof AssignmentExpression) {
                visitAssignment((AssignmentExpression)o);
            }
        }
    }

    /* Fields generated for the lowering of va_list */
    private static boolean isVAArgField(VariableDeclarator d) {
        String name = d.getSymbolName();
        return (SymbolTools.isField(d) &&
                (name.equals("reg_save_area") ||
                 name.equals("overflow_arg_area")));
    }

    private void visitDeclarator(VariableDeclarator d) {
        if (isVAArgField(d)) {
            return;
        }
        // only variables and fields are candidates
        if (SymbolTools.getProcedureOfParameter(d) != null) {
            return;
        }
        // array dimensions are not part of the leading specifiers
        List<Specifier> type = d.getTypeSpecifiers();
        if (!SymbolTools.isPointer(type)) {
            return;
        }
        VariableDeclarator canonical = d.getCanonicalDeclarator();
        if (context.isRegistered(canonical)) {
            return;
        }
        int level = SymbolTools.getIndirectionLevel(canonical);
        context.register(canonical, level);
        PrintTools.printlnStatus(3, pass_name, "registered",
                canonical.getSymbolName(), "at level", level);
    }

    private void visitUnaryExpression(UnaryExpression ue) {
        if (ue.getOperator() != UnaryOperator.ADDRESS_OF) {
            return;
        }
        Expression operand = IRTools.ignoreCasts(ue.getExpression());
        if (!(operand instanceof Identifier) &&
            !(operand instanceof AccessExpression)) {
            return;
        }
        VariableDeclarator d = SymbolTools.getCanonicalDeclarator(operand);
        if (d != null) {
            context.addAddressTaken(d);
            PrintTools.printlnStatus(3, pass_name, "address taken:",
                    d.getSymbolName());
        }
    }

    private void visitAssignment(AssignmentExpression ae) {
        Expression lhs = ae.getLHS();
        if (!SymbolTools.isPointer(SymbolTools.getExpressionType(lhs))) {
            return;
        }
        Expression rhs = IRTools.ignoreCasts(ae.getRHS());
        if (rhs instanceof Identifier || rhs instanceof UnaryExpression ||
            rhs instanceof ArrayAccess) {
            return;
        }
        VariableDeclarator d = getReferencedDeclarator(lhs);
        if (d != null) {
            context.invalidate(d);
            PrintTools.printlnStatus(3, pass_name, "invalidated",
                    d.getSymbolName(), "by", ae);
        }
    }

    /**
    * Returns the canonical declarator of the variable or field whose storage
    * an lvalue expression is rooted at, e.g., <b>p</b> for <b>*p</b>,
    * <b>p[1]</b> and <b>*(p + 1)</b>, and the field <b>f</b> for
    * <b>s.f[2]</b>.
    *
    * Dereferences, address-of, increments and decrements are looked through.
    *
    * @param e the lvalue expression.
    * @return the canonical declarator, or null if the expression is not
    * rooted at a variable or field, e.g., a function call or a conditional.
    * @throws InternalError if a variable reference has no declaration.
    */
    static VariableDeclarator getReferencedDeclarator(Expression e) {
        e = IRTools.ignoreCasts(e);
        while (e instanceof ArrayAccess) {
            e = IRTools.ignoreCasts(((ArrayAccess)e).getArrayName());
        }
        if (e instanceof Identifier || e instanceof AccessExpression) {
            VariableDeclarator ret = SymbolTools.getCanonicalDeclarator(e);
            if (ret == null) {
                throw new InternalError("Unresolved declaration of " + e);
            }
            return ret;
        }
        if (e instanceof UnaryExpression) {
            UnaryOperator op = ((UnaryExpression)e).getOperator();
            if (op == UnaryOperator.DEREFERENCE ||
                op == UnaryOperator.ADDRESS_OF ||
                UnaryOperator.hasSideEffects(op)) {
                return getReferencedDeclarator(
                        ((UnaryExpression)e).getExpression());
            }
        }
        if (e instanceof BinaryExpression &&
            !(e instanceof AssignmentExpression)) {
            BinaryExpression be = (BinaryExpression)e;
            BinaryOperator op = be.getOperator();
            if (op == BinaryOperator.ADD || op == BinaryOperator.SUBTRACT) {
                List<Specifier> ltype =
                        SymbolTools.getExpressionType(be.getLHS());
                if (ltype != null && SymbolTools.getDepth(ltype) > 0) {
                    return getReferencedDeclarator(be.getLHS());
                }
                return getReferencedDeclarator(be.getRHS());
            }
        }
        PrintTools.printlnStatus(3, pass_name, "no declaration for", e);
        return null;
    }

}
