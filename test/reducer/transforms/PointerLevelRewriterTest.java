package reducer.transforms;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reducer.analysis.AnalysisPass;
import reducer.analysis.TypeChecker;
import reducer.hir.AssignmentExpression;
import reducer.hir.AssignmentOperator;
import reducer.hir.ClassDeclaration;
import reducer.hir.Diagnostics;
import reducer.hir.ExpressionStatement;
import reducer.hir.PointerSpecifier;
import reducer.hir.Procedure;
import reducer.hir.Program;
import reducer.hir.Specifier;
import reducer.hir.SymbolTools;
import reducer.hir.UnaryExpression;
import reducer.hir.UnaryOperator;
import reducer.hir.UserSpecifier;
import reducer.hir.VariableDeclaration;
import reducer.hir.VariableDeclarator;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static reducer.hir.IRBuilder.*;

public class PointerLevelRewriterTest {

    private static void rewrite(Program program, VariableDeclarator d) {
        VariableDeclarator canonical = d.getCanonicalDeclarator();
        ClassDeclaration record_decl = (SymbolTools.isField(canonical)) ?
                SymbolTools.getEnclosingClass(canonical) : null;
        new PointerLevelRewriter(program, canonical, record_decl).rewrite();
    }

    private static void assertWellTyped(Program program) {
        Diagnostics diags = program.getDiagnostics();
        diags.reset();
        AnalysisPass.run(new TypeChecker(program));
        assertFalse(diags.hasErrorOccurred(), diags.getDiagnostics()::toString);
    }

    private static String text(ExpressionStatement s) {
        return s.getExpression().toString();
    }

    @Test
    @DisplayName("The indirection past the array dimensions is removed")
    void removesDereferences() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator x = declarator("x", 0);
        ExpressionStatement s1 = stmt(assign(id(x), derefs(id(p), 2)));
        ExpressionStatement s2 = stmt(assign(id(x), deref(subscript(id(p), 0))));
        ExpressionStatement s3 = stmt(assign(id(x), subscript(subscript(id(p), 0), 1)));
        Program program = program(declare(Specifier.INT, p),
                declare(Specifier.INT, x), main(s1, s2, s3));
        rewrite(program, p);
        assertEquals("int *p", p.getParent().toString());
        assertEquals("x = *p", text(s1));
        assertEquals("x = *p", text(s2));
        assertEquals("x = p[1]", text(s3));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Uses of the old type take the address of the reduced variable")
    void wrapsValueUses() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator r = declarator("r", 2);
        VariableDeclarator a = declarator("a", 2);
        List<VariableDeclaration> params = new ArrayList<VariableDeclaration>();
        params.add(declare(Specifier.INT, a));
        Procedure g = procedure(specs(Specifier.VOID), "g", params);
        ExpressionStatement s1 = stmt(assign(id(r), id(p)));
        ExpressionStatement s2 = stmt(call(g, id(p)));
        Program program = program(declare(Specifier.INT, p),
                declare(Specifier.INT, r), g, main(s1, s2));
        rewrite(program, p);
        assertEquals("r = &p", text(s1));
        assertEquals("g(&p)", text(s2));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Values assigned to the reduced variable lose one level")
    void reducesAssignedValues() {
        VariableDeclarator x = declarator("x", 1);
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator r = declarator("r", 2);
        ExpressionStatement s1 = stmt(assign(id(p), addr(id(x))));
        ExpressionStatement s2 = stmt(assign(id(p), cast(specs(Specifier.INT,
                PointerSpecifier.UNQUALIFIED, PointerSpecifier.UNQUALIFIED),
                id(x))));
        ExpressionStatement s3 = stmt(assign(id(p), lit(0)));
        ExpressionStatement s4 = stmt(assign(id(p), id(r)));
        ExpressionStatement s5 = stmt(assign(id(p), id(p)));
        Program program = program(declare(Specifier.INT, x),
                declare(Specifier.INT, p), declare(Specifier.INT, r),
                main(s1, s2, s3, s4, s5));
        rewrite(program, p);
        assertEquals("p = x", text(s1));
        assertEquals("p = (int *)x", text(s2));
        assertEquals("p = 0", text(s3));
        assertEquals("p = *r", text(s4));
        assertEquals("p = p", text(s5));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Initializers of the reduced declarator lose one level")
    void reducesInitializers() {
        VariableDeclarator x = declarator("x", 1);
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator n = declarator("n", 2);
        VariableDeclarator pa = declarator("pa", 2, 2);
        Program program = program(declare(Specifier.INT, x),
                declare(Specifier.INT, p, init(addr(id(x)))),
                declare(Specifier.INT, n, init(lit(0))),
                declare(Specifier.INT, pa, list(addr(id(x)), lit(0))));
        rewrite(program, p);
        rewrite(program, n);
        rewrite(program, pa);
        assertEquals("int *p = x", p.getParent().toString());
        assertEquals("int *n = 0", n.getParent().toString());
        assertEquals("int *pa[2] = { x, 0 }", pa.getParent().toString());
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Arrays of pointers keep their subscripts")
    void keepsArrayDimensions() {
        VariableDeclarator pa = declarator("pa", 2, 2);
        VariableDeclarator y = declarator("y", 1);
        VariableDeclarator x = declarator("x", 0);
        VariableDeclarator z = declarator("z", 2);
        VariableDeclarator v = declarator("v", 1);
        ExpressionStatement s1 = stmt(assign(id(y), deref(subscript(id(pa), 1))));
        ExpressionStatement s2 = stmt(assign(id(x), derefs(subscript(id(pa), 0), 2)));
        ExpressionStatement s3 = stmt(assign(id(z), subscript(id(pa), 1)));
        ExpressionStatement s4 = stmt(assign(id(v), id(pa)));
        Program program = program(declare(Specifier.INT, pa),
                declare(Specifier.INT, y), declare(Specifier.INT, x),
                declare(Specifier.INT, z), declare(Specifier.VOID, v),
                main(s1, s2, s3, s4));
        rewrite(program, pa);
        assertEquals("int *pa[2]", pa.getParent().toString());
        assertEquals("y = pa[1]", text(s1));
        assertEquals("x = *pa[0]", text(s2));
        assertEquals("z = &pa[1]", text(s3));
        assertEquals("v = pa", text(s4));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Arrow accesses through the reduced pointer become member accesses")
    void turnsArrowIntoDot() {
        VariableDeclarator v = declarator("v", 0);
        ClassDeclaration s = struct("S", declare(Specifier.INT, v));
        VariableDeclarator sp = declarator("sp", 1);
        VariableDeclarator spp = declarator("spp", 2);
        VariableDeclarator x = declarator("x", 0);
        ExpressionStatement s1 = stmt(assign(id(x), arrow(id(sp), v)));
        ExpressionStatement s2 = stmt(assign(id(x), arrow(deref(id(spp)), v)));
        Program program = program(s, declare(new UserSpecifier(s), sp),
                declare(new UserSpecifier(s), spp), declare(Specifier.INT, x),
                main(s1, s2));
        rewrite(program, sp);
        rewrite(program, spp);
        assertEquals("struct S sp", sp.getParent().toString());
        assertEquals("x = sp.v", text(s1));
        assertEquals("x = spp->v", text(s2));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Uses of a reduced field are rewritten through member accesses")
    void rewritesFieldUses() {
        VariableDeclarator buf = declarator("buf", 1);
        ClassDeclaration s = struct("T", declare(Specifier.CHAR, buf),
                declare(Specifier.INT, declarator("n", 0)));
        VariableDeclarator t = declarator("t", 0);
        VariableDeclarator tp = declarator("tp", 1);
        VariableDeclarator c = declarator("c", 0);
        VariableDeclarator cp = declarator("cp", 1);
        ExpressionStatement s1 = stmt(assign(id(c), deref(member(id(t), buf))));
        ExpressionStatement s2 = stmt(assign(id(c), subscript(arrow(id(tp), buf), 0)));
        ExpressionStatement s3 = stmt(assign(id(cp), member(id(t), buf)));
        ExpressionStatement s4 = stmt(assign(member(id(t), buf), id(cp)));
        Program program = program(s, declare(new UserSpecifier(s), t),
                declare(new UserSpecifier(s), tp),
                declare(Specifier.CHAR, c), declare(Specifier.CHAR, cp),
                main(s1, s2, s3, s4));
        rewrite(program, buf);
        assertEquals("char buf", buf.getParent().toString());
        assertEquals("c = t.buf", text(s1));
        assertEquals("c = tp->buf", text(s2));
        assertEquals("cp = &t.buf", text(s3));
        assertEquals("t.buf = *cp", text(s4));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Aggregate initializers are adjusted where they set the field")
    void reducesAggregateInitializers() {
        VariableDeclarator buf = declarator("buf", 1);
        ClassDeclaration s = struct("T", declare(Specifier.CHAR, buf),
                declare(Specifier.INT, declarator("n", 0)));
        ClassDeclaration u = struct("U",
                declare(Specifier.INT, declarator("k", 0)),
                declare(new UserSpecifier(s), declarator("inner", 0)));
        VariableDeclarator ch = declarator("ch", 0);
        VariableDeclarator t = declarator("t", 0);
        VariableDeclarator ts = declarator("ts", 0, 2);
        VariableDeclarator uv = declarator("u", 0);
        VariableDeclarator tp = declarator("tp", 1);
        Program program = program(s, u, declare(Specifier.CHAR, ch),
                declare(new UserSpecifier(s), t, list(addr(id(ch)), lit(1))),
                declare(new UserSpecifier(s), ts,
                        list(list(addr(id(ch)), lit(1)), list(lit(0), lit(2)))),
                declare(new UserSpecifier(u), uv,
                        list(lit(3), list(addr(id(ch)), lit(4)))),
                declare(new UserSpecifier(s), tp, init(lit(0))));
        rewrite(program, buf);
        assertEquals("struct T t = { ch, 1 }", t.getParent().toString());
        assertEquals("struct T ts[2] = { { ch, 1 }, { 0, 2 } }",
                ts.getParent().toString());
        assertEquals("struct U u = { 3, { ch, 4 } }",
                uv.getParent().toString());
        assertEquals("struct T *tp = 0", tp.getParent().toString());
        assertWellTyped(program);
    }

    @Test
    @DisplayName("A union initializer only sets the first member")
    void reducesUnionInitializers() {
        VariableDeclarator w0 = declarator("w0", 1);
        VariableDeclarator w1 = declarator("w1", 1);
        ClassDeclaration w = union("W", declare(Specifier.CHAR, w0),
                declare(Specifier.CHAR, w1));
        VariableDeclarator ch = declarator("ch", 0);
        VariableDeclarator wv = declarator("w", 0);
        Program program = program(w, declare(Specifier.CHAR, ch),
                declare(new UserSpecifier(w), wv, list(addr(id(ch)))));
        rewrite(program, w1);
        assertEquals("union W w = { &ch }", wv.getParent().toString());
        rewrite(program, w0);
        assertEquals("union W w = { ch }", wv.getParent().toString());
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Address-of, increments and compound assignments are left alone")
    void keepsSideEffectContexts() {
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator v = declarator("v", 1);
        ExpressionStatement s1 = stmt(new UnaryExpression(
                UnaryOperator.POST_INCREMENT, id(p)));
        ExpressionStatement s2 = stmt(assign(id(v), addr(id(p))));
        ExpressionStatement s3 = stmt(new AssignmentExpression(id(p),
                AssignmentOperator.ADD, lit(1)));
        Program program = program(declare(Specifier.INT, p),
                declare(Specifier.VOID, v), main(s1, s2, s3));
        rewrite(program, p);
        assertEquals("p++", text(s1));
        assertEquals("v = &p", text(s2));
        assertEquals("p += 1", text(s3));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Every redeclaration of a global is reduced")
    void reducesRedeclarations() {
        VariableDeclarator g1 = declarator("g", 2);
        VariableDeclarator g2 = declarator("g", 2);
        VariableDeclarator x = declarator("x", 0);
        ExpressionStatement s1 = stmt(assign(id(x), derefs(id(g1), 2)));
        Program program = program(
                unit("a.c", new VariableDeclaration(
                        specs(Specifier.EXTERN, Specifier.INT), g1),
                        main(declare(Specifier.INT, x), s1)),
                unit("b.c", declare(Specifier.INT, g2, init(lit(0)))));
        rewrite(program, g2);
        assertEquals("extern int *g", g1.getParent().toString());
        assertEquals("int *g = 0", g2.getParent().toString());
        assertEquals("x = *g", text(s1));
        assertWellTyped(program);
    }

    @Test
    @DisplayName("Values are reduced by address removal, casts or dereference")
    void reducesValues() {
        VariableDeclarator x = declarator("x", 1);
        VariableDeclarator p = declarator("p", 2);
        VariableDeclarator r = declarator("r", 1);
        ExpressionStatement s1 = stmt(assign(id(r), addr(id(x))));
        ExpressionStatement s2 = stmt(assign(id(r), cast(specs(Specifier.INT,
                PointerSpecifier.UNQUALIFIED, PointerSpecifier.UNQUALIFIED),
                id(x))));
        ExpressionStatement s3 = stmt(assign(id(r), lit(0)));
        ExpressionStatement s4 = stmt(assign(id(r), id(p)));
        ExpressionStatement s5 = stmt(assign(id(r), add(id(p), lit(1))));
        program(declare(Specifier.INT, x), declare(Specifier.INT, p),
                declare(Specifier.INT, r), main(s1, s2, s3, s4, s5));
        for (ExpressionStatement s : List.of(s1, s2, s3, s4, s5)) {
            PointerLevelRewriter.reduceValue(
                    ((AssignmentExpression)s.getExpression()).getRHS());
        }
        assertEquals("r = x", text(s1));
        assertEquals("r = (int *)x", text(s2));
        assertEquals("r = 0", text(s3));
        assertEquals("r = *p", text(s4));
        assertEquals("r = *(p + 1)", text(s5));
    }

    @Test
    @DisplayName("A declarator without a pointer level cannot be reduced")
    void rejectsNonPointer() {
        VariableDeclarator x = declarator("x", 0);
        Program program = program(declare(Specifier.INT, x));
        assertThrows(InternalError.class,
                () -> new PointerLevelRewriter(program, x, null).rewrite());
    }

}
