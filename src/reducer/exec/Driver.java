package reducer.exec;

import reducer.hir.PrintTools;
import reducer.hir.Program;
import reducer.transforms.ReducePointerLevel;
import reducer.transforms.TransError;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Implements the command line interface of the reducer over a program that
 * has already been built. The options are kept in a static option set so
 * that every part of the reducer can read them through
 * {@link #getOptionValue(String)}.
 *
 * <p>Exit status: 0 on success, 1 for a usage error or a counter beyond the
 * number of instances, 2 if the transformed program has errors.
 */
public class Driver
{
  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static
  {
    registerOptions();
  }

  /**
   * The program the options are applied to.
   */
  protected Program program;

  /**
   * Stream receiving the results; messages go to stderr.
   */
  protected PrintStream out;

  protected Driver(Program program, PrintStream out)
  {
    this.program = program;
    this.out = out;
  }

  public static void registerOptions()
  {
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-3) that you wish to see");
    options.add(options.UTILITY, "query-instances",
                "Print the number of instances of the transformation");
    options.add(options.UTILITY, "list-transformations",
                "Print the registered transformations");
    options.add(options.TRANSFORM, "transformation",
                ReducePointerLevel.NAME, "name",
                "The transformation to be run");
    options.add(options.TRANSFORM, "counter", "N",
                "The instance of the transformation to be applied, from 1");
  }

  /**
   * Returns the value of the given key or null
   * if the value is not set.  Key values are
   * set on the command line as <b>-option_name=value</b>.
   *
   * @param key The key to search
   * @return the value of the given key or null if the
   *   value is not set.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Sets the value of the option represented by <i>key</i> to
   * <i>value</i>.
   *
   * @param key The option name.
   * @param value The option value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  /**
   * Restores the default value of every option.
   */
  public static void resetOptions()
  {
    options.reset();
  }

  /**
   * Parses command line options.
   *
   * @param args the options, each of the form <b>-name</b> or
   *   <b>-name=value</b>.
   * @return false if an argument is not a registered option.
   */
  protected boolean parseCommandLine(String[] args)
  {
    for (String opt : args)
    {
      if (opt.length() < 2 || opt.charAt(0) != '-')
      {
        System.err.println("Error: unexpected argument " + opt);
        return false;
      }

      int eq = opt.indexOf('=');
      String option_name = (eq == -1) ? opt.substring(1) : opt.substring(1, eq);

      if (!options.contains(option_name))
      {
        System.err.println("Error: unrecognized option " + option_name);
        return false;
      }

      // no value on the command line, so just set it to "1"
      setOptionValue(option_name, (eq == -1) ? "1" : opt.substring(eq + 1));
    }
    return true;
  }

  /**
   * Prints the list of options that the reducer accepts.
   */
  public void printUsage()
  {
    String usage = "\nreducer.exec.Driver [option]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Runs the selected transformation as the options say.
   *
   * @return the exit status.
   */
  protected int runPasses()
  {
    TransformationManager manager = new TransformationManager(program);

    if (getOptionValue("list-transformations") != null)
    {
      manager.printTransformations(out);
      return 0;
    }

    String name = getOptionValue("transformation");
    if (name == null || !manager.isValidTransformation(name))
    {
      System.err.println("Error: unknown transformation " + name);
      return 1;
    }
    manager.setTransformation(name);

    if (getOptionValue("query-instances") != null)
    {
      out.println("Available transformation instances: " +
                  manager.queryCount());
      return 0;
    }

    int counter;
    try {
      counter = Integer.parseInt(String.valueOf(getOptionValue("counter")));
    } catch (NumberFormatException e) {
      System.err.println("Error: invalid counter " + getOptionValue("counter"));
      return 1;
    }
    if (counter < 1)
    {
      System.err.println("Error: invalid counter " + counter);
      return 1;
    }

    TransError error = manager.apply(counter);
    switch (error)
    {
      case NONE:
        PrintWriter pw = new PrintWriter(out);
        program.print(pw);
        pw.flush();
        return 0;
      case MAX_INSTANCE:
        System.err.println(
            "Error: the counter value exceeds the number of transformation instances!");
        return 1;
      default:
        System.err.println("Error: the transformed program has errors!");
        return 2;
    }
  }

  /**
   * Parses the options and runs the transformation over the program,
   * printing to stdout.
   *
   * @param program the program to be transformed.
   * @param args Command line options.
   * @return the exit status.
   */
  public static int run(Program program, String[] args)
  {
    return run(program, args, System.out);
  }

  /**
   * Parses the options and runs the transformation over the program.
   * Options set by an earlier run are reset first.
   *
   * @param program the program to be transformed.
   * @param args Command line options.
   * @param out the stream receiving the instance count or the program.
   * @return the exit status.
   */
  public static int run(Program program, String[] args, PrintStream out)
  {
    // every run starts from the defaults
    resetOptions();
    Driver driver = new Driver(program, out);
    if (!driver.parseCommandLine(args))
    {
      driver.printUsage();
      return 1;
    }
    if (getOptionValue("help") != null)
    {
      driver.printUsage();
      return 0;
    }
    PrintTools.printlnStatus(2, "[Driver] transformation =",
        getOptionValue("transformation"), "counter =",
        getOptionValue("counter"));
    try {
      return driver.runPasses();
    } catch (InternalError e) {
      System.err.println("Error: " + e.getMessage());
      return 2;
    }
  }
}
