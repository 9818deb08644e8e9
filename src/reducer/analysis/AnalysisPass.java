package reducer.analysis;

import reducer.hir.IRTools;
import reducer.hir.PrintTools;
import reducer.hir.Program;
import reducer.hir.Tools;

public abstract class AnalysisPass
{
  protected Program program;

  protected AnalysisPass(Program program)
  {
    this.program = program;
  }

  public abstract String getPassName();

  public static void run(AnalysisPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.printlnStatus(2, pass.getPassName(), "begin");
    pass.start();
    PrintTools.printlnStatus(2, pass.getPassName(), "end in",
        String.format("%.2f seconds", Tools.getTime(timer)));
    if (!IRTools.checkConsistency(pass.program))
      throw new InternalError("Inconsistent IR after " + pass.getPassName());
  }

  public abstract void start();
}
