package reducer.analysis;

import reducer.hir.AccessExpression;
import reducer.hir.AccessOperator;
import reducer.hir.ArrayAccess;
import reducer.hir.ArraySpecifier;
import reducer.hir.AssignmentExpression;
import reducer.hir.AssignmentOperator;
import reducer.hir.ClassDeclaration;
import reducer.hir.DepthFirstIterator;
import reducer.hir.Diagnostics;
import reducer.hir.Expression;
import reducer.hir.FunctionCall;
import reducer.hir.Identifier;
import reducer.hir.Initializer;
import reducer.hir.IntegerLiteral;
import reducer.hir.PrintTools;
import reducer.hir.Procedure;
import reducer.hir.Program;
import reducer.hir.ReturnStatement;
import reducer.hir.Specifier;
import reducer.hir.Symbol;
import reducer.hir.SymbolTools;
import reducer.hir.Tools;
import reducer.hir.Traversable;
import reducer.hir.UnaryExpression;
import reducer.hir.UnaryOperator;
import reducer.hir.VariableDeclarator;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Checks the pointer and aggregate structure of the types in a program and
* reports the problems it finds into the program's {@link Diagnostics}. Only
* the number of pointer/array levels of a type is compared; base types are
* not, and expressions whose type is unknown are not checked.
*
* <p>The checker reports
* <ul>
* <li>a fatal error for an identifier without a declaration,</li>
* <li>an error for a dereference or subscript of a non-pointer value,</li>
* <li>an error for a member access through the wrong operator or on a
*     non-aggregate,</li>
* <li>an error for taking the address of, incrementing or assigning to a
*     value that is not an lvalue,</li>
* <li>an error when the value of an assignment, an initializer, a call
*     argument or a return statement has a different number of levels than
*     its target,</li>
* <li>a warning for a non-zero integer constant converted to a pointer.</li>
* </ul>
*/
public class TypeChecker extends AnalysisPass {

    private Diagnostics diags;

    public TypeChecker(Program program) {
        super(program);
        diags = program.getDiagnostics();
    }

    @Override
    public String getPassName() {
        return "[TypeChecker]";
    }

    @Override
    public void start() {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(program);
        while (iter.hasNext()) {
            Traversable t = iter.next();
            if (t instanceof Identifier) {
                checkIdentifier((Identifier)t);
            } else if (t instanceof UnaryExpression) {
                checkUnary((UnaryExpression)t);
            } else if (t instanceof ArrayAccess) {
                checkSubscript((ArrayAccess)t);
            } else if (t instanceof AccessExpression) {
                checkMemberAccess((AccessExpression)t);
            } else if (t instanceof AssignmentExpression) {
                checkAssignment((AssignmentExpression)t);
            } else if (t instanceof FunctionCall) {
                checkCall((FunctionCall)t);
            } else if (t instanceof ReturnStatement) {
                checkReturn((ReturnStatement)t);
            } else if (t instanceof VariableDeclarator) {
                VariableDeclarator d = (VariableDeclarator)t;
                if (d.getInitializer() != null) {
                    checkInitializer(SymbolTools.getVariableType(d),
                            d.getInitializer(), d.getSymbolName());
                }
            }
        }
        PrintTools.printlnStatus(2, getPassName(),
                diags.getDiagnostics().size(), "diagnostics");
    }

    private void checkIdentifier(Identifier id) {
        if (id.getSymbol() == null) {
            diags.report(Diagnostics.Level.FATAL,
                    "use of undeclared identifier '" + id.getName() + "'");
        }
    }

    private void checkUnary(UnaryExpression ue) {
        UnaryOperator op = ue.getOperator();
        Expression operand = ue.getExpression();
        if (op == UnaryOperator.DEREFERENCE) {
            List<Specifier> type = SymbolTools.getExpressionType(operand);
            if (type != null && SymbolTools.getDepth(type) == 0) {
                diags.report(Diagnostics.Level.ERROR,
                        "indirection requires pointer operand ('" +
                        typeToString(type) + "' invalid): " + ue);
            }
        } else if (op == UnaryOperator.ADDRESS_OF) {
            if (!isLvalue(operand) && !isFunctionDesignator(operand)) {
                diags.report(Diagnostics.Level.ERROR,
                        "cannot take the address of an rvalue: " + ue);
            }
        } else if (UnaryOperator.hasSideEffects(op)) {
            if (!isLvalue(operand)) {
                diags.report(Diagnostics.Level.ERROR,
                        "expression is not assignable: " + ue);
            }
        }
    }

    private void checkSubscript(ArrayAccess aa) {
        List<Specifier> type = SymbolTools.getExpressionType(aa.getArrayName());
        if (type != null && SymbolTools.getDepth(type) == 0) {
            diags.report(Diagnostics.Level.ERROR,
                    "subscripted value is not an array or pointer: " + aa);
        }
    }

    private void checkMemberAccess(AccessExpression ae) {
        List<Specifier> type = SymbolTools.getExpressionType(ae.getLHS());
        if (type == null) {
            return;
        }
        int depth = SymbolTools.getDepth(type);
        if (ae.getOperator() == AccessOperator.POINTER_ACCESS) {
            if (depth != 1) {
                diags.report(Diagnostics.Level.ERROR,
                        "member reference type '" + typeToString(type) +
                        "' is not a pointer to an aggregate: " + ae);
                return;
            }
        } else if (depth != 0) {
            diags.report(Diagnostics.Level.ERROR,
                    "member reference type '" + typeToString(type) +
                    "' is a pointer; did you mean to use '->'?: " + ae);
            return;
        }
        ClassDeclaration cdecl = SymbolTools.getClassDeclaration(type);
        if (cdecl == null) {
            diags.report(Diagnostics.Level.ERROR,
                    "member reference base type '" + typeToString(type) +
                    "' is not a structure or union: " + ae);
        } else if (Tools.identityIndexOf(cdecl.getFields(),
                       ae.getMember().getSymbol()) < 0) {
            diags.report(Diagnostics.Level.ERROR,
                    "no member named '" + ae.getMember().getName() + "' in " +
                    cdecl.getKey() + " " + cdecl.getName());
        }
    }

    private void checkAssignment(AssignmentExpression ae) {
        if (!isLvalue(ae.getLHS())) {
            diags.report(Diagnostics.Level.ERROR,
                    "expression is not assignable: " + ae);
            return;
        }
        if (ae.getOperator() == AssignmentOperator.NORMAL) {
            checkCompatible(SymbolTools.getExpressionType(ae.getLHS()),
                    ae.getRHS(), "assigning to '" + ae.getLHS() + "'");
        }
    }

    private void checkCall(FunctionCall call) {
        Procedure proc = call.getProcedure();
        if (proc == null) {
            return;
        }
        if (proc.getNumParameters() != call.getNumArguments()) {
            diags.report(Diagnostics.Level.ERROR,
                    "wrong number of arguments to '" + proc.getSymbolName() +
                    "': expected " + proc.getNumParameters() + ", have " +
                    call.getNumArguments());
            return;
        }
        for (int i = 0; i < call.getNumArguments(); i++) {
            VariableDeclarator param = proc.getParameter(i);
            checkCompatible(SymbolTools.getVariableType(param),
                    call.getArgument(i),
                    "passing argument " + (i + 1) + " of '" +
                    proc.getSymbolName() + "'");
        }
    }

    private void checkReturn(ReturnStatement stmt) {
        if (stmt.getExpression() == null) {
            return;
        }
        Traversable t = stmt.getParent();
        while (t != null && !(t instanceof Procedure)) {
            t = t.getParent();
        }
        if (t != null) {
            checkCompatible(((Procedure)t).getTypeSpecifiers(),
                    stmt.getExpression(), "returning from '" +
                    ((Procedure)t).getSymbolName() + "'");
        }
    }

    /**
    * Checks an initializer against the type it initializes. Brace-enclosed
    * lists are matched element by element against array elements or
    * aggregate fields; a union only takes its first member.
    */
    private void checkInitializer(List<Specifier> type, Traversable init,
                                  String what) {
        if (init instanceof Expression) {
            checkCompatible(type, (Expression)init, "initializing '" +
                    what + "'");
            return;
        }
        Initializer initializer = (Initializer)init;
        if (!initializer.isList()) {
            checkCompatible(type, initializer.getValue(), "initializing '" +
                    what + "'");
            return;
        }
        List<Traversable> elems = initializer.getChildren();
        if (SymbolTools.getDepth(type) > 0) {
            if (!SymbolTools.isArray(type)) {
                diags.report(Diagnostics.Level.ERROR,
                        "brace-enclosed initializer for pointer '" + what +
                        "'");
                return;
            }
            List<Specifier> elem_type =
                    new ArrayList<Specifier>(type.subList(0, type.size() - 1));
            int size = ((ArraySpecifier)type.get(type.size() - 1)).getSize();
            if (size >= 0 && elems.size() > size) {
                diags.report(Diagnostics.Level.WARNING,
                        "excess elements in array initializer of '" + what +
                        "'");
            }
            for (Traversable elem : elems) {
                checkInitializer(elem_type, elem, what + "[]");
            }
            return;
        }
        ClassDeclaration cdecl = SymbolTools.getClassDeclaration(type);
        if (cdecl == null) {
            if (elems.size() == 1) {
                checkInitializer(type, elems.get(0), what);
            } else if (elems.size() > 1) {
                diags.report(Diagnostics.Level.WARNING,
                        "excess elements in scalar initializer of '" + what +
                        "'");
            }
            return;
        }
        List<VariableDeclarator> fields = cdecl.getFields();
        int num_fields = (cdecl.isUnion()) ?
                Math.min(1, fields.size()) : fields.size();
        if (elems.size() > num_fields) {
            diags.report(Diagnostics.Level.WARNING, "excess elements in " +
                    cdecl.getKey() + " initializer of '" + what + "'");
        }
        for (int i = 0; i < elems.size() && i < num_fields; i++) {
            VariableDeclarator field = fields.get(i);
            checkInitializer(SymbolTools.getVariableType(field), elems.get(i),
                    what + "." + field.getSymbolName());
        }
    }

    /**
    * Checks that a value has the same number of pointer/array levels as the
    * target type. A void pointer on either side and the null constant are
    * compatible with any pointer.
    */
    private void checkCompatible(List<Specifier> target, Expression value,
                                 String what) {
        List<Specifier> vtype = SymbolTools.getExpressionType(value);
        if (target == null || vtype == null) {
            return;
        }
        int tdepth = SymbolTools.getDepth(target);
        int vdepth = SymbolTools.getDepth(vtype);
        if (tdepth == vdepth) {
            return;
        }
        if (tdepth > 0 && vdepth == 0 && value instanceof IntegerLiteral) {
            if (((IntegerLiteral)value).getValue() != 0) {
                diags.report(Diagnostics.Level.WARNING,
                        "incompatible integer to pointer conversion " + what +
                        " from '" + value + "'");
            }
            return;
        }
        if (tdepth > 0 && vdepth > 0 &&
            (SymbolTools.isVoidPointer(target) ||
             SymbolTools.isVoidPointer(vtype))) {
            return;
        }
        diags.report(Diagnostics.Level.ERROR, "incompatible types " + what +
                ": '" + typeToString(target) + "' from '" +
                typeToString(vtype) + "' (" + value + ")");
    }

    private static boolean isLvalue(Expression e) {
        if (e instanceof Identifier) {
            return (((Identifier)e).getSymbol() instanceof VariableDeclarator);
        }
        return (e instanceof AccessExpression || e instanceof ArrayAccess ||
                (e instanceof UnaryExpression &&
                 ((UnaryExpression)e).getOperator() ==
                 UnaryOperator.DEREFERENCE));
    }

    private static boolean isFunctionDesignator(Expression e) {
        if (e instanceof Identifier) {
            Symbol symbol = ((Identifier)e).getSymbol();
            return (symbol instanceof Procedure);
        }
        return false;
    }

    private static String typeToString(List<Specifier> type) {
        StringWriter sw = new StringWriter(16);
        PrintWriter pw = new PrintWriter(sw);
        PrintTools.printSpecifiers(type, pw);
        pw.flush();
        return sw.toString();
    }

}
