package reducer.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reducer.hir.ClassDeclaration;
import reducer.hir.Diagnostics;
import reducer.hir.Expression;
import reducer.hir.PointerSpecifier;
import reducer.hir.Procedure;
import reducer.hir.Program;
import reducer.hir.ReturnStatement;
import reducer.hir.Specifier;
import reducer.hir.SymbolTools;
import reducer.hir.Traversable;
import reducer.hir.UnaryExpression;
import reducer.hir.UnaryOperator;
import reducer.hir.UserSpecifier;
import reducer.hir.VariableDeclaration;
import reducer.hir.VariableDeclarator;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static reducer.hir.IRBuilder.*;

public class TypeCheckerTest {

    private static Diagnostics check(Program program) {
        AnalysisPass.run(new TypeChecker(program));
        return program.getDiagnostics();
    }

    /* Declares p, q and x at file scope and evaluates exprs in main */
    private static Program withPointers(VariableDeclarator p,
                                        VariableDeclarator q,
                                        VariableDeclarator x,
                                        Expression... exprs) {
        Traversable[] stmts = new Traversable[exprs.length];
        for (int i = 0; i < exprs.length; i++) {
            stmts[i] = stmt(exprs[i]);
        }
        return program(declare(Specifier.INT, p), declare(Specifier.INT, q),
                declare(Specifier.INT, x), main(stmts));
    }

    @Test
    @DisplayName("A well-typed program has no diagnostics")
    void acceptsWellTypedProgram() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator q = declarator("q", 1);
        VariableDeclarator x = declarator("x", 0);
        Diagnostics diags = check(withPointers(p, q, x,
                assign(id(x), derefs(id(p), 2)),
                assign(id(q), deref(id(p))),
                assign(id(p), addr(id(q))),
                assign(id(q), lit(0)),
                assign(deref(id(q)), subscript(id(q), 1))));
        assertTrue(diags.getDiagnostics().isEmpty(),
                diags.getDiagnostics().toString());
    }

    @Test
    @DisplayName("Dereferencing a non-pointer is an error")
    void rejectsBadDereference() {
        VariableDeclarator p = declarator("p", 1);
        VariableDeclarator q = declarator("q", 1);
        VariableDeclarator x = declarator("x", 0);
        Diagnostics diags = check(withPointers(p, q, x,
                assign(id(x), derefs(id(p), 2))));
        assertTrue(diags.hasErrorOccurred());
    }

    @Test
    @DisplayName("Subscripting a non-pointer is an error")
    void rejectsBadSubscript() {
        VariableDeclarator p = declarator("p", 1);
        VariableDeclarator q = declarator("q", 1);
        VariableDeclarator x = declarator("x", 0);
        Diagnostics diags = check(withPointers(p, q, x,
                assign(id(q), subscript(id(x), 0))));
        assertTrue(diags.hasErrorOccurred());
    }

    @Test
    @DisplayName("Assigning values of a different depth is an error")
    void rejectsDepthMismatch() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator q = declarator("q", 1);
        VariableDeclarator x = declarator("x", 0);
        Diagnostics diags = check(withPointers(p, q, x,
                assign(id(p), id(q))));
        assertEquals(1, diags.getDiagnostics().size());
        assertEquals(Diagnostics.Level.ERROR,
                diags.getDiagnostics().get(0).getLevel());
    }

    @Test
    @DisplayName("A non-zero integer converted to a pointer is a warning")
    void warnsOnIntegerToPointer() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator q = declarator("q", 1);
        VariableDeclarator x = declarator("x", 0);
        Diagnostics diags = check(withPointers(p, q, x,
                assign(id(q), lit(4))));
        assertFalse(diags.hasErrorOccurred());
        assertEquals(Diagnostics.Level.WARNING,
                diags.getDiagnostics().get(0).getLevel());
    }

    @Test
    @DisplayName("void pointers are compatible with any pointer")
    void acceptsVoidPointers() {
        VariableDeclarator v = declarator("v", 1);
        VariableDeclarator p = declarator("p", 3);
        Program program = program(declare(Specifier.VOID, v),
                declare(Specifier.INT, p),
                main(stmt(assign(id(v), id(p))), stmt(assign(id(p), id(v)))));
        assertFalse(check(program).hasErrorOccurred());
    }

    @Test
    @DisplayName("Address-of and assignment need lvalues")
    void rejectsNonLvalues() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator q = declarator("q", 1);
        VariableDeclarator x = declarator("x", 0);
        Diagnostics diags = check(withPointers(p, q, x,
                assign(id(p), addr(addr(id(q))))));
        assertTrue(diags.hasErrorOccurred());

        diags = check(withPointers(declarator("p", 2), declarator("q", 1),
                declarator("x", 0), assign(lit(1), lit(2))));
        assertTrue(diags.hasErrorOccurred());

        VariableDeclarator y = declarator("y", 0);
        diags = check(withPointers(declarator("p", 2), declarator("q", 1), y,
                new UnaryExpression(UnaryOperator.POST_INCREMENT,
                        add(id(y), lit(1)))));
        assertTrue(diags.hasErrorOccurred());
    }

    @Test
    @DisplayName("Member access operators must match the base type")
    void checksMemberAccess() {
        VariableDeclarator buf = declarator("buf", 1);
        ClassDeclaration s = struct("S", declare(Specifier.CHAR, buf));
        VariableDeclarator v = declarator("v", 0);
        VariableDeclarator vp = declarator("vp", 1);
        VariableDeclarator c = declarator("c", 0);
        Program ok = program(s, declare(new UserSpecifier(s), v),
                declare(new UserSpecifier(s), vp), declare(Specifier.CHAR, c),
                main(stmt(assign(id(c), deref(member(id(v), buf)))),
                     stmt(assign(id(c), deref(arrow(id(vp), buf))))));
        assertTrue(check(ok).getDiagnostics().isEmpty());

        VariableDeclarator buf2 = declarator("buf", 1);
        ClassDeclaration s2 = struct("S", declare(Specifier.CHAR, buf2));
        VariableDeclarator w = declarator("w", 0);
        VariableDeclarator wp = declarator("wp", 1);
        VariableDeclarator d = declarator("d", 0);
        Program bad = program(s2, declare(new UserSpecifier(s2), w),
                declare(new UserSpecifier(s2), wp), declare(Specifier.CHAR, d),
                main(stmt(assign(id(d), deref(arrow(id(w), buf2)))),
                     stmt(assign(id(d), deref(member(id(wp), buf2))))));
        assertEquals(2, check(bad).getDiagnostics().size());
    }

    @Test
    @DisplayName("Aggregate initializers are checked field by field")
    void checksAggregateInitializers() {
        VariableDeclarator n = declarator("n", 0);
        VariableDeclarator buf = declarator("buf", 1);
        ClassDeclaration s = struct("S", declare(Specifier.INT, n),
                declare(Specifier.CHAR, buf));
        VariableDeclarator ch = declarator("ch", 0);
        VariableDeclarator good = declarator("good", 0, 2);
        VariableDeclarator bad = declarator("bad", 0);
        Program program = program(s, declare(Specifier.CHAR, ch),
                declare(new UserSpecifier(s), good,
                        list(list(lit(1), addr(id(ch))), list(lit(2), lit(0)))),
                declare(new UserSpecifier(s), bad,
                        list(lit(1), id(ch))));
        Diagnostics diags = check(program);
        assertEquals(1, diags.getDiagnostics().size());
        assertTrue(diags.getDiagnostics().get(0).getMessage().contains("bad.buf"));
    }

    @Test
    @DisplayName("Call arguments and return values are checked")
    void checksCallsAndReturns() {
        VariableDeclarator a = declarator("a", 2);
        List<VariableDeclaration> params = new ArrayList<VariableDeclaration>();
        params.add(declare(Specifier.INT, a));
        Procedure f = procedure(specs(Specifier.INT,
                PointerSpecifier.UNQUALIFIED), "f", params,
                new ReturnStatement(deref(id(a))));
        VariableDeclarator q = declarator("q", 1);
        Program ok = program(declare(Specifier.INT, q), f,
                main(stmt(call(f, addr(id(q))))));
        assertTrue(check(ok).getDiagnostics().isEmpty());

        VariableDeclarator b = declarator("b", 2);
        List<VariableDeclaration> params2 = new ArrayList<VariableDeclaration>();
        params2.add(declare(Specifier.INT, b));
        Procedure g = procedure(specs(Specifier.INT), "g", params2,
                new ReturnStatement(deref(id(b))));
        VariableDeclarator r = declarator("r", 1);
        Program bad = program(declare(Specifier.INT, r), g,
                main(stmt(call(g, id(r)))));
        assertEquals(2, check(bad).getDiagnostics().size());
    }

    @Test
    @DisplayName("Undeclared identifiers are fatal and suppression drops them")
    void reportsUndeclared() {
        VariableDeclarator x = declarator("x", 0);
        Program program = program(declare(Specifier.INT, x),
                main(stmt(assign(id(x), SymbolTools.getOrphanID("y")))));
        program.getDiagnostics().setSuppressAllDiagnostics(true);
        assertFalse(check(program).hasErrorOccurred());
        program.getDiagnostics().setSuppressAllDiagnostics(false);
        assertTrue(check(program).hasFatalErrorOccurred());
    }

}
