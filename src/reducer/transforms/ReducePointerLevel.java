package reducer.transforms;

import reducer.analysis.AnalysisPass;
import reducer.analysis.TypeChecker;
import reducer.hir.ClassDeclaration;
import reducer.hir.Declaration;
import reducer.hir.Diagnostics;
import reducer.hir.PrintTools;
import reducer.hir.Program;
import reducer.hir.SymbolTools;
import reducer.hir.TranslationUnit;
import reducer.hir.Traversable;
import reducer.hir.VariableDeclarator;

/**
* Reduces the pointer indirection level of one variable or field
* by one.
*
* <p>Valid declarators are numbered as follows. Declarators at the largest
* indirection level come first in the order they were seen; they are valid
* even if their address is taken. Then come the declarators at each smaller
* level, from the largest down to 1, excluding address-taken ones. A
* declarator is invalid at any level if it is assigned a pointer value that
* is not an identifier, a unary expression or an array access.
*/
public class ReducePointerLevel extends Transformation {

    public static final String NAME = "reduce-pointer-level";

    public static final String DESCRIPTION =
            "Reduce pointer indirect level for a global/local variable. " +
            "All valid variables are sorted by their indirect levels. " +
            "The pass will ensure to first choose a valid variable " +
            "with the largest indirect level. This mechanism could " +
            "reduce the complexity of our implementation, because " +
            "we don't have to consider the case where the chosen variable " +
            "with the largest indirect level would be address-taken. " +
            "Variables at non-largest-indirect-level are ineligible " +
            "if they: \n" +
            "  * being address-taken \n" +
            "  * OR being used as LHS in any pointer form, e.g., \n" +
            "    p, *p(assume *p is of pointer type), \n" +
            "    while the RHS is NOT a UnaryOperator. \n";

    private PointerLevelContext context;

    private PointerLevelCollector collector;

    /** The selected canonical declarator; never reassigned once set */
    private VariableDeclarator the_decl;

    /** The aggregate declaring the selected field */
    private ClassDeclaration the_record_decl;

    public ReducePointerLevel(Program program) {
        super(program, NAME, DESCRIPTION);
        context = new PointerLevelContext();
        collector = new PointerLevelCollector(context);
        the_decl = null;
        the_record_decl = null;
    }

    @Override
    public void start() {
        Diagnostics diags = program.getDiagnostics();
        SymbolTools.linkRedeclarations(program);
        for (Traversable tu : program.getChildren()) {
            for (Declaration decl :
                    ((TranslationUnit)tu).getDeclarations()) {
                handleTopLevelDecl(decl);
            }
        }
        doAnalysis();
        PrintTools.printlnStatus(2, getPassName(), context);
        if (query_instance_only) {
            return;
        }
        if (the_decl == null) {
            trans_error = TransError.MAX_INSTANCE;
            return;
        }
        PrintTools.printlnStatus(1, getPassName(), "selected",
                the_decl.getSymbolName(), "at level",
                SymbolTools.getIndirectionLevel(the_decl));
        diags.setSuppressAllDiagnostics(false);
        if (SymbolTools.isField(the_decl)) {
            setRecordDecl();
        }
        new PointerLevelRewriter(program, the_decl, the_record_decl).rewrite();
        AnalysisPass.run(new TypeChecker(program));
        if (diags.hasErrorOccurred() || diags.hasFatalErrorOccurred()) {
            trans_error = TransError.INTERNAL;
        }
    }

    /** Collects from one top-level declaration. */
    void handleTopLevelDecl(Declaration decl) {
        collector.collect(decl);
    }

    /**
    * Counts the valid declarators in numbering order and selects the one
    * whose number equals the transformation counter.
    */
    void doAnalysis() {
        int max_level = context.getMaxIndirectLevel();
        for (VariableDeclarator d : context.getDeclarators(max_level)) {
            if (!context.isValid(d)) {
                continue;
            }
            valid_instance_num++;
            if (valid_instance_num == transformation_counter) {
                the_decl = d;
            }
        }
        for (int level = max_level - 1; level > 0; level--) {
            for (VariableDeclarator d : context.getDeclarators(level)) {
                if (!context.isValid(d) || context.isAddressTaken(d)) {
                    continue;
                }
                valid_instance_num++;
                if (valid_instance_num == transformation_counter) {
                    the_decl = d;
                }
            }
        }
    }

    private void setRecordDecl() {
        the_record_decl = SymbolTools.getEnclosingClass(the_decl);
        if (the_record_decl == null) {
            throw new InternalError("No enclosing aggregate for field " +
                    the_decl.getSymbolName());
        }
    }

    /** Returns the selected declarator, or null if none was selected. */
    public VariableDeclarator getSelectedDeclarator() {
        return the_decl;
    }

    /** Returns the aggregate declaring the selected field, or null. */
    public ClassDeclaration getRecordDecl() {
        return the_record_decl;
    }

    public PointerLevelContext getContext() {
        return context;
    }

}
