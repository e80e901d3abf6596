package NexusLink;

import NexusLink.Model.Automaton;
import NexusLink.Model.MinimizationLevel;
import NexusLink.Model.MinimizationMetrics;
import NexusLink.Model.MinimizationResult;
import NexusLink.Model.MinimizerConfig;

import java.util.ArrayList;
import java.util.List;

public class NexusLinkCommandLine {
  public static void main(String[] args) {
    String outputFile = null;
    MinimizerConfig config = MinimizerConfig.defaults();
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg) || "--verbose".equalsIgnoreCase(arg)) {
        config = config.withVerbose(true);
      } else if ("--no-metrics".equalsIgnoreCase(arg)) {
        config = config.withMetrics(false);
      } else if ("--level".equalsIgnoreCase(arg)) {
        String value = requireValue(args, i, arg);
        i++;
        try {
          config = config.withLevel(MinimizationLevel.fromCode(Integer.parseInt(value)));
        } catch (IllegalArgumentException e) {
          // NumberFormatException is an IllegalArgumentException too
          System.err.println("Invalid minimization level: " + value);
          printUsageAndExit();
        }
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        outputFile = requireValue(args, i, arg);
        i++;
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    boolean validInvocation = (positional.size() == 2) && "minimize".equalsIgnoreCase(positional.get(0));
    if (!validInvocation) {
      printUsageAndExit();
    }

    String filePath = positional.get(1);
    System.out.println("Minimizing: " + filePath);
    System.out.println("Minimization level: " + config.level());

    MinimizationResult result = minimizeFile(filePath, config);
    System.out.println("Minimized size: " + result.automaton().size());

    MinimizationMetrics metrics = result.metrics();
    if (metrics != null) {
      System.out.println();
      System.out.println("Minimization metrics:");
      System.out.println("---------------------");
      System.out.println(metrics);
    }

    if (outputFile != null) {
      System.out.println("Writing to file: " + outputFile);
      BAFormat.writeFile(outputFile, result.automaton());
    }
    Minimizer.destroy(result.automaton());
  }

  private static String requireValue(String[] args, int i, String flag) {
    // Require a value that isn't another flag
    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
      System.err.println("Missing value for " + flag);
      printUsageAndExit(); // exits
    }
    return args[i + 1];
  }

  private static void printUsageAndExit() {
    System.out.println(
        "NexusLink [--debug] [--level <0-3>] [--no-metrics] [--writeBA <BA output file>] minimize <BA input file>");
    System.out.println("[--debug] : Log refinement progress");
    System.out.println("[--level <0-3>] : 0=none, 1=basic (drop unreachable states), 2=standard (merge equivalent"
        + " states, default), 3=aggressive (both)");
    System.out.println("[--no-metrics] : Skip metrics collection");
    System.out.println("[--writeBA <BA output file>] : Write minimized automaton to specified output file");
    System.out.println();
    System.out.println("<BA file> : deterministic automaton (in the BA format), exactly one initial state.");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.exit(0);
  }

  /**
   * Read and minimize a BA file.
   * @param filePath - BA input file
   * @param config - minimizer settings
   * @return - minimized automaton and metrics
   */
  static MinimizationResult minimizeFile(String filePath, MinimizerConfig config) {
    final Automaton original = BAFormat.readFile(filePath);
    System.out.println("Original size: " + original.size());
    System.out.println("Alphabet size: " + original.getInputSymbols().size());
    try {
      return Minimizer.minimize(original, config);
    } finally {
      Minimizer.destroy(original);
    }
  }
}
