package reducer.exec;

import reducer.hir.Diagnostics;
import reducer.hir.PrintTools;
import reducer.hir.Program;
import reducer.transforms.ReducePointerLevel;
import reducer.transforms.TransError;
import reducer.transforms.TransformPass;
import reducer.transforms.Transformation;

import java.io.PrintStream;
import java.util.Map;
import java.util.TreeMap;

/**
* Keeps the registered transformations and drives one of them over a
* program. The reduction driver first asks for the number of instances with
* {@link #queryCount()} and then applies instances one at a time with
* {@link #apply(int)}, each time on a freshly built program.
*/
public class TransformationManager {

    /** Creates a transformation for a program. */
    public interface TransformationFactory {
        Transformation create(Program program);
    }

    private static class Entry {
        private final String description;
        private final TransformationFactory factory;

        private Entry(String description, TransformationFactory factory) {
            this.description = description;
            this.factory = factory;
        }
    }

    private Map<String, Entry> registry;

    private Program program;

    private String trans_name;

    /**
    * Creates a manager for the given program with the built-in
    * transformations registered. The transformation defaults to
    * {@value ReducePointerLevel#NAME}.
    */
    public TransformationManager(Program program) {
        this.program = program;
        registry = new TreeMap<String, Entry>();
        trans_name = ReducePointerLevel.NAME;
        register(ReducePointerLevel.NAME, ReducePointerLevel.DESCRIPTION,
                new TransformationFactory() {
                    public Transformation create(Program p) {
                        return new ReducePointerLevel(p);
                    }
                });
    }

    /**
    * Registers a transformation under a name, replacing an earlier one with
    * the same name.
    */
    public void register(String name, String description,
                         TransformationFactory factory) {
        registry.put(name, new Entry(description, factory));
    }

    public boolean isValidTransformation(String name) {
        return registry.containsKey(name);
    }

    /**
    * Selects the transformation to be run.
    *
    * @throws IllegalArgumentException if no transformation has that name.
    */
    public void setTransformation(String name) {
        if (!isValidTransformation(name)) {
            throw new IllegalArgumentException(
                    "Unknown transformation: " + name);
        }
        trans_name = name;
    }

    public String getTransformation() {
        return trans_name;
    }

    /** Returns the description of a registered transformation or null. */
    public String getDescription(String name) {
        Entry entry = registry.get(name);
        return (entry == null) ? null : entry.description;
    }

    /** Prints the registered transformations with their descriptions. */
    public void printTransformations(PrintStream out) {
        for (Map.Entry<String, Entry> e : registry.entrySet()) {
            out.println(e.getKey() + ":");
            out.println(e.getValue().description);
        }
    }

    /**
    * Runs the collection and the analysis only and returns the number of
    * valid instances. The program is not modified.
    */
    public int queryCount() {
        Transformation trans = createTransformation();
        trans.setQueryInstanceFlag(true);
        TransformPass.run(trans);
        int ret = trans.getNumTransformationInstances();
        PrintTools.printlnStatus(1, trans.getPassName(), ret, "instances");
        return ret;
    }

    /**
    * Applies the instance with the given 1-based index.
    *
    * @param counter the instance index.
    * @return {@link TransError#NONE} on success,
    * {@link TransError#MAX_INSTANCE} if there are fewer instances, in which
    * case the program is unchanged, or {@link TransError#INTERNAL} if the
    * transformed program has errors.
    * @throws IllegalArgumentException if <b>counter</b> is less than 1.
    */
    public TransError apply(int counter) {
        Transformation trans = createTransformation();
        trans.setTransformationCounter(counter);
        TransformPass.run(trans);
        TransError ret = trans.getTransError();
        if (ret != TransError.NONE) {
            PrintTools.printlnStatus(1, trans.getPassName(), "failed:", ret);
        }
        return ret;
    }

    /* Each run starts with a clean diagnostic state that stays silent
       until the rewrite */
    private Transformation createTransformation() {
        Diagnostics diags = program.getDiagnostics();
        diags.reset();
        diags.setSuppressAllDiagnostics(true);
        return registry.get(trans_name).factory.create(program);
    }

}
