package reducer.transforms;

import reducer.hir.IRTools;
import reducer.hir.PrintTools;
import reducer.hir.Program;
import reducer.hir.SymbolTools;
import reducer.hir.Tools;

/**
* Base class of all transformation passes. For consistent reduction, there
* is a checking process at the end of every transformation pass.
*/
public abstract class TransformPass {

    /** The associated program */
    protected Program program;

    /** Constructs a transform pass with the given program */
    protected TransformPass(Program program) {
        this.program = program;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    * @param pass the transform pass that is to be run.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.printlnStatus(1, pass.getPassName(), "begin");
        pass.start();
        PrintTools.printlnStatus(1, pass.getPassName(), "end in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        if (!IRTools.checkConsistency(pass.program)) {
            throw new InternalError("Inconsistent IR after " +
                                    pass.getPassName());
        }
        SymbolTools.linkRedeclarations(pass.program);
    }

    /** Starts a transform pass */
    public abstract void start();

}
