package FSM;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import FSM.Model.Cancellation;
import FSM.Model.CompactFiniteAutomaton;
import FSM.Model.DeterminizationCancelledException;
import FSM.Model.FiniteAutomaton;
import FSM.Model.UnknownSymbolException;

public class FSMCommandLine {
  public static void main(String[] args) {
    String dotFilename = null;
    String baFilename = null;
    int maxStates = Integer.MAX_VALUE;
    long timeoutSeconds = 0;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--writeDot".equalsIgnoreCase(arg)) {
        dotFilename = requireValue(args, i++, arg);
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        baFilename = requireValue(args, i++, arg);
      } else if ("--maxStates".equalsIgnoreCase(arg)) {
        maxStates = parsePositive(requireValue(args, i++, arg), arg);
      } else if ("--timeout".equalsIgnoreCase(arg)) {
        timeoutSeconds = parsePositive(requireValue(args, i++, arg), arg);
      } else if (positional.isEmpty() && arg.startsWith("-")) {
        // Unknown flag; after the operation, arguments are symbols and may start with '-'
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }

    String operation = positional.get(0);
    String filePath = positional.get(1);
    List<String> word = positional.subList(2, positional.size());

    final CompactFiniteAutomaton<Integer, String> automaton = BAFormat.getBAFile(filePath);
    System.out.println("Automaton size: " + automaton.size());
    System.out.println("Alphabet size: " + automaton.getInputAlphabet().size());

    final Cancellation cancellation = new Cancellation(maxStates);
    ScheduledExecutorService timer = null;
    if (timeoutSeconds > 0) {
      timer = Executors.newSingleThreadScheduledExecutor();
      cancellation.setBackref(timer.schedule(cancellation::setInterrupted, timeoutSeconds, TimeUnit.SECONDS));
    }

    try {
      long before = System.currentTimeMillis();
      FiniteAutomaton<?, String> result = runOperation(operation, automaton, word, cancellation);
      long after = System.currentTimeMillis();
      if (result != null) {
        System.out.println(operation + " result size: " + result.size());
        System.out.println(operation + " duration: " + ((after - before) / 1000f) + "s");
      }
      FiniteAutomaton<?, String> output = result == null ? automaton : result;
      if (dotFilename != null) {
        writeDotFile(dotFilename, output);
      }
      if (baFilename != null) {
        System.out.println("Writing to file: " + baFilename);
        BAFormat.writeBAFile(baFilename, output);
      }
    } catch (DeterminizationCancelledException e) {
      System.out.println(operation + ": " + e.getLabel() + " after " + e.getStatesExplored() + " states");
    } catch (UnknownSymbolException e) {
      System.out.println("Word is not over the automaton's alphabet: " + e.getSymbol());
    } finally {
      cancellation.cancel();
      if (timer != null) {
        timer.shutdownNow();
      }
    }
  }

  private static String requireValue(String[] args, int i, String flag) {
    // Require a value that isn't another flag
    if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
      System.err.println("Missing value for " + flag);
      printUsageAndExit(); // exits
    }
    return args[i + 1];
  }

  private static int parsePositive(String value, String flag) {
    try {
      int parsed = Integer.parseInt(value);
      if (parsed > 0) {
        return parsed;
      }
    } catch (NumberFormatException e) {
      System.err.println("Not a number: " + value);
    }
    System.err.println("Expected a positive value for " + flag);
    printUsageAndExit();
    return -1; // unreachable
  }

  private static void printUsageAndExit() {
    System.out.println(
        "FSM [--maxStates <n>] [--timeout <seconds>] [--writeDot <file>] [--writeBA <file>] <operation> <BA input file> [symbol ...]");
    System.out.println("[--maxStates <n>] : Abort determinization above n states");
    System.out.println("[--timeout <seconds>] : Abort determinization after the given time");
    System.out.println("[--writeDot <file>] : Write the resulting automaton as a DOT graph");
    System.out.println("[--writeBA <file>] : Write the resulting automaton in BA format");
    System.out.println();
    System.out.println("<operation> : one of the choices below:");
    System.out.println("  info: Deterministic, complete, accessible and co-accessible checks.");
    System.out.println("  accepts: Whether the automaton accepts the word given by the remaining symbols.");
    System.out.println("  det: Subset construction.");
    System.out.println("  complete: Completion with a sink state.");
    System.out.println("  access: Restriction to accessible states.");
    System.out.println("  coaccess: Restriction to co-accessible states.");
    System.out.println("  trim: Restriction to accessible and co-accessible states.");
    System.out.println();
    System.out.println("<BA file> : finite automaton (in the BA format).");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.exit(0);
  }

  /**
   * Choose operation to run.
   * @param operation - operation passed in from command-line
   * @param automaton - automaton read from the input file
   * @param word - symbols for the accepts operation
   * @param cancellation - limits for determinization
   * @return - transformed automaton, or null for the query operations
   */
  static FiniteAutomaton<?, String> runOperation(String operation,
                                                 CompactFiniteAutomaton<Integer, String> automaton,
                                                 List<String> word,
                                                 Cancellation cancellation) {
    return switch (operation.toLowerCase()) {
      case "info" -> {
        printInfo(automaton);
        yield null;
      }
      case "accepts" -> {
        System.out.println("accepts " + word + ": " + StructuralAnalyzer.accepts(automaton, word));
        yield null;
      }
      case "det" -> new PowersetDeterminizer(cancellation).run(automaton);
      // BA state ids are 0..size-1, so size() is a fresh label
      case "complete" -> Canonicalizer.toComplete(automaton, automaton.size());
      case "access" -> Canonicalizer.toAccessible(automaton);
      case "coaccess" -> Canonicalizer.toCoAccessible(automaton);
      case "trim" -> Canonicalizer.trim(automaton);
      default -> throw new IllegalStateException("Unexpected operation choice: " + operation);
    };
  }

  private static void printInfo(FiniteAutomaton<?, ?> automaton) {
    System.out.println("deterministic: " + StructuralAnalyzer.isDeterministic(automaton));
    System.out.println("complete: " + StructuralAnalyzer.isComplete(automaton));
    System.out.println("accessible: " + StructuralAnalyzer.isAccessible(automaton));
    System.out.println("co-accessible: " + StructuralAnalyzer.isCoAccessible(automaton));
    System.out.println("accepts empty word: " + StructuralAnalyzer.acceptsEmptyWord(automaton));
  }

  private static void writeDotFile(String filename, FiniteAutomaton<?, ?> automaton) {
    System.out.println("Writing to file: " + filename);
    try (Writer writer = new FileWriter(filename, StandardCharsets.UTF_8)) {
      DotWriter.write(automaton, writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
