package reducer.transforms;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reducer.hir.AssignmentExpression;
import reducer.hir.AssignmentOperator;
import reducer.hir.ClassDeclaration;
import reducer.hir.ConditionalExpression;
import reducer.hir.Declaration;
import reducer.hir.PointerSpecifier;
import reducer.hir.Procedure;
import reducer.hir.Program;
import reducer.hir.ReturnStatement;
import reducer.hir.Specifier;
import reducer.hir.SymbolTools;
import reducer.hir.TranslationUnit;
import reducer.hir.Traversable;
import reducer.hir.UnaryExpression;
import reducer.hir.UnaryOperator;
import reducer.hir.UserSpecifier;
import reducer.hir.VariableDeclaration;
import reducer.hir.VariableDeclarator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static reducer.hir.IRBuilder.*;

public class PointerLevelCollectorTest {

    private static PointerLevelContext collect(Traversable t) {
        PointerLevelContext context = new PointerLevelContext();
        new PointerLevelCollector(context).collect(t);
        return context;
    }

    /* int *mk() { return 0; } */
    private static Procedure mk() {
        return procedure(specs(Specifier.INT, PointerSpecifier.UNQUALIFIED),
                "mk", new ArrayList<VariableDeclaration>(),
                new ReturnStatement(lit(0)));
    }

    @Test
    @DisplayName("Pointer declarators are registered by indirection level")
    void registersByLevel() {
        VariableDeclarator a = declarator("a", 1);
        VariableDeclarator b = declarator("b", 2);
        VariableDeclarator c = declarator("c", 3);
        VariableDeclarator d = declarator("d", 0);
        VariableDeclarator e = declarator("e", 1, 4);
        VariableDeclarator f = declarator("f", 0, 3);
        PointerLevelContext context = collect(program(
                declare(Specifier.INT, a), declare(Specifier.INT, b),
                declare(Specifier.INT, c), declare(Specifier.INT, d),
                declare(Specifier.INT, e), declare(Specifier.INT, f)));

        assertEquals(Arrays.asList(a, e),
                new ArrayList<VariableDeclarator>(context.getDeclarators(1)));
        assertEquals(Arrays.asList(b),
                new ArrayList<VariableDeclarator>(context.getDeclarators(2)));
        assertEquals(Arrays.asList(c),
                new ArrayList<VariableDeclarator>(context.getDeclarators(3)));
        assertEquals(3, context.getMaxIndirectLevel());
        assertFalse(context.isRegistered(d));
        assertFalse(context.isRegistered(f));
        assertEquals(4, context.getValidDeclarators().size());
    }

    @Test
    @DisplayName("Locals are registered but parameters are not")
    void skipsParameters() {
        VariableDeclarator q = declarator("q", 3);
        VariableDeclarator l = declarator("l", 1);
        List<VariableDeclaration> params = new ArrayList<VariableDeclaration>();
        params.add(declare(Specifier.INT, q));
        PointerLevelContext context = collect(program(
                procedure(specs(Specifier.VOID), "f", params,
                        declare(Specifier.CHAR, l))));
        assertFalse(context.isRegistered(q));
        assertTrue(context.isRegistered(l));
        assertEquals(1, context.getMaxIndirectLevel());
    }

    @Test
    @DisplayName("Fields generated for va_list are skipped")
    void skipsVAArgFields() {
        VariableDeclarator gp = declarator("gp_offset", 0);
        VariableDeclarator overflow = declarator("overflow_arg_area", 1);
        VariableDeclarator save = declarator("reg_save_area", 1);
        VariableDeclarator other = declarator("other", 1);
        VariableDeclarator global = declarator("reg_save_area", 1);
        ClassDeclaration tag = struct("__va_list_tag",
                declare(Specifier.UNSIGNED, gp),
                declare(Specifier.VOID, overflow),
                declare(Specifier.VOID, save),
                declare(Specifier.VOID, other));
        PointerLevelContext context = collect(program(tag,
                declare(Specifier.VOID, global)));
        assertEquals(Arrays.asList(other, global),
                new ArrayList<VariableDeclarator>(context.getDeclarators(1)));
    }

    @Test
    @DisplayName("Redeclarations are registered once through the canonical one")
    void registersCanonicalOnce() {
        VariableDeclarator g1 = declarator("g", 2);
        VariableDeclarator g2 = declarator("g", 2);
        Program program = program(
                unit("a.c", new VariableDeclaration(
                        specs(Specifier.EXTERN, Specifier.INT), g1)),
                unit("b.c", declare(Specifier.INT, g2)));
        PointerLevelContext context = collect(program);
        assertEquals(1, context.getDeclarators(2).size());
        assertSame(g1, context.getDeclarators(2).iterator().next());

        new PointerLevelCollector(context).collect(program);
        assertEquals(1, context.getDeclarators(2).size());
        assertEquals(1, context.getValidDeclarators().size());
    }

    @Test
    @DisplayName("Top-level declarations can be collected one at a time")
    void collectsIncrementally() {
        VariableDeclarator a = declarator("a", 1);
        VariableDeclarator b = declarator("b", 2);
        VariableDeclarator c = declarator("c", 1);
        Program program = program(declare(Specifier.INT, a),
                declare(Specifier.INT, b),
                main(declare(Specifier.INT, c)));
        PointerLevelContext context = new PointerLevelContext();
        PointerLevelCollector collector = new PointerLevelCollector(context);
        TranslationUnit tu = (TranslationUnit)program.getChildren().get(0);
        for (Declaration decl : tu.getDeclarations()) {
            collector.collect(decl);
        }
        assertEquals(Arrays.asList(a, c),
                new ArrayList<VariableDeclarator>(context.getDeclarators(1)));
        assertEquals(2, context.getMaxIndirectLevel());
    }

    @Test
    @DisplayName("Only references and member accesses are marked address-taken")
    void marksAddressTaken() {
        VariableDeclarator x = declarator("x", 1);
        VariableDeclarator y = declarator("y", 1);
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator f = declarator("f", 1);
        ClassDeclaration s = struct("S", declare(Specifier.INT, f));
        VariableDeclarator sv = declarator("sv", 0);
        PointerLevelContext context = collect(program(
                declare(Specifier.INT, x), declare(Specifier.INT, y),
                declare(Specifier.INT, p), s,
                declare(new UserSpecifier(s), sv),
                main(stmt(assign(id(p), addr(id(x)))),
                     stmt(assign(id(p), addr(member(id(sv), f)))),
                     stmt(assign(id(x), addr(deref(id(y))))),
                     stmt(assign(id(p), addr(cast(
                             specs(Specifier.INT, PointerSpecifier.UNQUALIFIED),
                             id(y))))))));
        assertEquals(Arrays.asList(x, f, y),
                new ArrayList<VariableDeclarator>(
                        context.getAddressTakenDeclarators()));
        assertFalse(context.isAddressTaken(p));
    }

    @Test
    @DisplayName("Pointer assignments from unsafe right-hand sides invalidate")
    void classifiesAssignments() {
        VariableDeclarator q = declarator("q", 1);
        VariableDeclarator r = declarator("r", 1);
        VariableDeclarator s = declarator("s", 1);
        VariableDeclarator t = declarator("t", 1);
        VariableDeclarator u = declarator("u", 1);
        VariableDeclarator w = declarator("w", 1);
        VariableDeclarator arr = declarator("arr", 1, 2);
        VariableDeclarator pp = declarator("pp", 2);
        VariableDeclarator c = declarator("c", 0);
        Procedure mk = mk();
        PointerLevelContext context = collect(program(
                declare(Specifier.INT, q), declare(Specifier.INT, r),
                declare(Specifier.INT, s), declare(Specifier.INT, t),
                declare(Specifier.INT, u), declare(Specifier.INT, w),
                declare(Specifier.INT, arr), declare(Specifier.INT, pp),
                declare(Specifier.INT, c), mk,
                main(stmt(assign(id(q), id(r))),
                     stmt(assign(id(r), deref(id(pp)))),
                     stmt(assign(id(s), subscript(id(arr), 0))),
                     stmt(assign(id(r), cast(specs(Specifier.INT,
                             PointerSpecifier.UNQUALIFIED), id(q)))),
                     stmt(assign(id(t), call(mk))),
                     stmt(assign(id(u), new ConditionalExpression(
                             id(c), id(q), id(r)))),
                     stmt(new AssignmentExpression(id(w),
                             AssignmentOperator.ADD, lit(1))),
                     stmt(assign(deref(id(pp)), call(mk))),
                     stmt(assign(id(c), lit(2))))));
        assertTrue(context.isValid(q));
        assertTrue(context.isValid(r));
        assertTrue(context.isValid(s));
        assertTrue(context.isValid(arr));
        assertFalse(context.isValid(t));
        assertFalse(context.isValid(u));
        assertFalse(context.isValid(w));
        assertFalse(context.isValid(pp));
        assertTrue(context.isRegistered(pp));
    }

    @Test
    @DisplayName("An unsafe assignment to a field invalidates the field")
    void invalidatesFields() {
        VariableDeclarator f = declarator("f", 1);
        ClassDeclaration s = struct("S", declare(Specifier.INT, f));
        VariableDeclarator sv = declarator("sv", 0);
        PointerLevelContext context = collect(program(s,
                declare(new UserSpecifier(s), sv),
                main(stmt(assign(member(id(sv), f), lit(0))))));
        assertTrue(context.isRegistered(f));
        assertFalse(context.isValid(f));
    }

    @Test
    @DisplayName("Assignment targets resolve to the declarator they are rooted at")
    void resolvesReferencedDeclarators() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator f = declarator("f", 1, 4);
        ClassDeclaration s = struct("S", declare(Specifier.INT, f));
        VariableDeclarator sv = declarator("sv", 0);
        VariableDeclarator c = declarator("c", 0);
        Procedure mk = mk();
        program(declare(Specifier.INT, p), s,
                declare(new UserSpecifier(s), sv), declare(Specifier.INT, c),
                mk);

        assertSame(p, PointerLevelCollector.getReferencedDeclarator(
                subscript(id(p), 1)));
        assertSame(p, PointerLevelCollector.getReferencedDeclarator(
                deref(add(id(p), lit(1)))));
        assertSame(p, PointerLevelCollector.getReferencedDeclarator(
                deref(add(lit(1), id(p)))));
        assertSame(f, PointerLevelCollector.getReferencedDeclarator(
                subscript(member(id(sv), f), 2)));
        assertSame(p, PointerLevelCollector.getReferencedDeclarator(
                deref(addr(id(p)))));
        assertSame(p, PointerLevelCollector.getReferencedDeclarator(
                deref(new UnaryExpression(UnaryOperator.POST_INCREMENT,
                        id(p)))));
        assertNull(PointerLevelCollector.getReferencedDeclarator(
                subscript(call(mk), 0)));
        assertNull(PointerLevelCollector.getReferencedDeclarator(
                new ConditionalExpression(id(c), id(p), id(p))));
        assertThrows(InternalError.class,
                () -> PointerLevelCollector.getReferencedDeclarator(
                        SymbolTools.getOrphanID("u")));
    }

    @Test
    @DisplayName("Assignments through unusual targets are collected without failing")
    void collectsUnusualTargets() {
        VariableDeclarator p = declarator("p", 1);
        VariableDeclarator r = declarator("r", 2);
        VariableDeclarator s = declarator("s", 2);
        VariableDeclarator c = declarator("c", 0);
        Procedure mk = mk();
        PointerLevelContext context = collect(program(
                declare(Specifier.INT, p), declare(Specifier.INT, r),
                declare(Specifier.INT, s), declare(Specifier.INT, c), mk,
                main(stmt(assign(deref(addr(id(p))), call(mk))),
                     stmt(assign(deref(new UnaryExpression(
                             UnaryOperator.POST_INCREMENT, id(r))), call(mk))),
                     stmt(assign(deref(new ConditionalExpression(
                             id(c), id(s), id(s))), call(mk))))));
        assertFalse(context.isValid(p));
        assertFalse(context.isValid(r));
        assertTrue(context.isValid(s));
    }

    @Test
    @DisplayName("Registering a non-pointer is an internal error")
    void rejectsNonPositiveLevels() {
        PointerLevelContext context = new PointerLevelContext();
        VariableDeclarator x = declarator("x", 0);
        assertThrows(InternalError.class, () -> context.register(x, 0));
    }

}
