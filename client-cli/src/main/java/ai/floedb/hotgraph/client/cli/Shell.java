/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.hotgraph.client.cli;

import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeKind;
import ai.floedb.hotgraph.service.HotGraph;
import ai.floedb.hotgraph.service.HotGraphFactory;
import ai.floedb.hotgraph.service.HotGraphStats;
import ai.floedb.hotgraph.service.config.HotGraphConfig;
import ai.floedb.hotgraph.service.config.HotGraphConfigs;
import ai.floedb.hotgraph.service.metrics.HotGraphMetrics;
import ai.floedb.hotgraph.service.zone.ZoneRule;
import ai.floedb.hotgraph.service.zone.ZoneRuleLoader;
import ai.floedb.hotgraph.storage.file.GraphDocumentCodec;
import ai.floedb.hotgraph.storage.memory.InMemoryGraphStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

@CommandLine.Command(
    name = "hotgraph-shell",
    mixinStandardHelpOptions = true,
    version = "hotgraph-shell 0.1",
    description =
        "Query the hot component graph interactively, or run one command given as arguments")
public class Shell implements Callable<Integer> {

  private static final Logger LOG = Logger.getLogger(Shell.class);

  static final String DEMO_GRAPH = "/demo/bench.json";
  static final String DEMO_ZONES = "/demo/zones.json";

  @CommandLine.Option(
      names = {"--store"},
      description = "Store kind: memory or file (default: memory)")
  String storeKind;

  @CommandLine.Option(
      names = {"--graph"},
      description = "Graph JSON file (file store, or seed for the memory store)")
  Path graphFile;

  @CommandLine.Option(
      names = {"--zones"},
      description = "Zone definitions JSON file")
  Path zoneFile;

  @CommandLine.Option(
      names = {"--max-hops"},
      description = "Default hop bound for path (default: 5)")
  Integer maxHops;

  @CommandLine.Parameters(
      arity = "0..*",
      paramLabel = "COMMAND",
      description = "Run this command and exit instead of starting the shell")
  List<String> command = new ArrayList<>();

  private final PrintStream out;
  private HotGraph graph;

  public Shell() {
    this(System.out);
  }

  Shell(PrintStream out) {
    this.out = out;
  }

  Shell(HotGraph graph, PrintStream out) {
    this.graph = graph;
    this.out = out;
  }

  public static void main(String[] args) {
    System.exit(commandLine(new Shell()).execute(args));
  }

  /** Everything from the first positional on is the command, options included. */
  static CommandLine commandLine(Shell shell) {
    return new CommandLine(shell)
        .setStopAtPositional(true)
        .setUnmatchedOptionsArePositionalParams(true);
  }

  @Override
  public Integer call() {
    try {
      if (graph == null) {
        graph = open();
      }
    } catch (RuntimeException e) {
      printError(e);
      return 2;
    }
    if (!command.isEmpty()) {
      return execute(String.join(" ", command)) ? 0 : 1;
    }
    interactive();
    return 0;
  }

  private void interactive() {
    out.println("Hotgraph Shell (type 'help' for commands, 'quit' to exit).");
    try {
      Terminal terminal = TerminalBuilder.builder().system(true).build();
      Path historyPath = Paths.get(System.getProperty("user.home"), ".hotgraph_shell_history");
      var parser = new DefaultParser();
      parser.setEofOnUnclosedQuote(true);
      Completer completer =
          new StringsCompleter(
              "focus",
              "neighbors",
              "related",
              "path",
              "zone",
              "kind",
              "dirty",
              "update",
              "remove",
              "sync",
              "stats",
              "help",
              "quit",
              "exit");
      LineReader reader =
          LineReaderBuilder.builder()
              .terminal(terminal)
              .appName("hotgraph-shell")
              .parser(parser)
              .completer(completer)
              .variable(LineReader.HISTORY_FILE, historyPath)
              .option(LineReader.Option.HISTORY_TIMESTAMPED, true)
              .build();
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    try {
                      reader.getHistory().save();
                    } catch (IOException e) {
                      LOG.debugf(e, "Could not save shell history to %s", historyPath);
                    }
                  }));
      while (true) {
        String line;
        try {
          line = reader.readLine("hotgraph> ");
        } catch (UserInterruptException e) {
          continue;
        } catch (EndOfFileException e) {
          break;
        }
        if (line == null) {
          break;
        }
        line = line.trim();
        if (line.isEmpty()) {
          continue;
        }
        if (line.equalsIgnoreCase("quit") || line.equalsIgnoreCase("exit")) {
          break;
        }
        execute(line);
      }
    } catch (IOException e) {
      out.println("Fatal: " + e);
    }
  }

  /** Runs one command line; returns false when it failed and an error was printed. */
  boolean execute(String line) {
    try {
      dispatch(line);
      return true;
    } catch (Exception e) {
      printError(e);
      return false;
    }
  }

  HotGraph open() {
    Map<String, String> overrides = new LinkedHashMap<>();
    if (storeKind != null) {
      overrides.put("hotgraph.store.kind", storeKind);
    }
    if (graphFile != null) {
      overrides.put("hotgraph.store.path", graphFile.toString());
    }
    if (zoneFile != null) {
      overrides.put("hotgraph.zone-file", zoneFile.toString());
    }
    if (maxHops != null) {
      overrides.put("hotgraph.path.default-max-hops", maxHops.toString());
    }
    HotGraphConfig config = HotGraphConfigs.load(overrides);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    if (config.store().path().isPresent()) {
      return HotGraphFactory.create(config, registry);
    }

    LOG.info("No graph file configured; loading the demo bench");
    List<ZoneRule> zones =
        config.zoneFile().isPresent()
            ? new ZoneRuleLoader().load(Path.of(config.zoneFile().get()))
            : readDemoZones();
    return HotGraph.builder(new InMemoryGraphStore(readDemoGraph()))
        .zones(zones)
        .metrics(new HotGraphMetrics(registry))
        .defaultMaxHops(config.path().defaultMaxHops())
        .pathCacheEnabled(config.path().cacheEnabled())
        .statsTopN(config.stats().topN())
        .build();
  }

  void dispatch(String inputLine) {
    List<String> tokens = tokenize(inputLine);
    if (tokens.isEmpty()) {
      return;
    }
    String cmd = tokens.get(0);
    List<String> args = tokens.subList(1, tokens.size());
    switch (cmd) {
      case "help" -> printHelp();
      case "focus" -> cmdFocus(args);
      case "neighbors" -> cmdNeighbors(args);
      case "related" -> cmdRelated(args);
      case "path" -> cmdPath(args);
      case "zone" -> cmdZone(args);
      case "kind" -> cmdKind(args);
      case "dirty" -> cmdDirty(args);
      case "update" -> cmdUpdate(args);
      case "remove" -> cmdRemove(args);
      case "sync" -> cmdSync(args);
      case "stats" -> cmdStats(args);
      default -> out.println("Unknown command. Type 'help'.");
    }
  }

  private void cmdFocus(List<String> args) {
    if (!args.isEmpty() && args.get(0).equals("--radius")) {
      if (args.size() < 3) {
        out.println("usage: focus --radius <n> <id> [<id> ...]");
        return;
      }
      int radius = parseInt(args.get(1), "radius");
      int size = graph.focusAround(radius, args.subList(2, args.size()));
      out.println("focus: " + size + " node(s) within " + radius + " hop(s)");
      return;
    }
    int size = graph.focus(args);
    out.println(size == 0 ? "focus: cleared" : "focus: " + size + " node(s)");
  }

  private void cmdNeighbors(List<String> args) {
    if (args.size() != 1) {
      out.println("usage: neighbors <id>");
      return;
    }
    printIds(graph.neighbors(args.get(0)));
  }

  private void cmdRelated(List<String> args) {
    if (args.size() != 1) {
      out.println("usage: related <id>");
      return;
    }
    printIds(graph.related(args.get(0)));
  }

  private void cmdPath(List<String> args) {
    if (args.size() < 2 || args.size() > 3) {
      out.println("usage: path <start> <end> [max_hops]");
      return;
    }
    List<String> path =
        args.size() == 3
            ? graph.path(args.get(0), args.get(1), parseInt(args.get(2), "max_hops"))
            : graph.path(args.get(0), args.get(1));
    out.println(String.join(" -> ", path));
  }

  private void cmdZone(List<String> args) {
    if (args.isEmpty()) {
      printIds(List.copyOf(graph.zoneNames()));
      return;
    }
    if (args.size() != 1) {
      out.println("usage: zone [<name>]");
      return;
    }
    printIds(graph.zoneMembers(args.get(0)));
  }

  private void cmdKind(List<String> args) {
    if (args.size() != 1) {
      out.println("usage: kind <hardware|software>");
      return;
    }
    printIds(graph.nodesOfKind(NodeKind.parse(args.get(0))));
  }

  private void cmdDirty(List<String> args) {
    if (args.isEmpty()) {
      out.println("dirty: " + graph.dirtyCount());
      return;
    }
    out.println("dirty: " + graph.markDirty(args));
  }

  private void cmdUpdate(List<String> args) {
    if (args.size() < 2) {
      out.println("usage: update <id> <hardware|software> [key=value ...]");
      return;
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    for (String pair : args.subList(2, args.size())) {
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("expected key=value, got: " + pair);
      }
      attributes.put(pair.substring(0, eq), pair.substring(eq + 1));
    }
    GraphNode node = new GraphNode(args.get(0), NodeKind.parse(args.get(1)), attributes);
    out.println("dirty: " + graph.stageUpdate(node));
  }

  private void cmdRemove(List<String> args) {
    if (args.size() != 1) {
      out.println("usage: remove <id>");
      return;
    }
    out.println("dirty: " + graph.stageRemoval(args.get(0)));
  }

  private void cmdSync(List<String> args) {
    if (args.size() > 1) {
      out.println("usage: sync [expected_revision]");
      return;
    }
    long revision =
        args.isEmpty() ? graph.sync() : graph.sync(parseLong(args.get(0), "expected_revision"));
    out.println("revision: " + revision);
  }

  private void cmdStats(List<String> args) {
    if (args.size() == 1 && args.get(0).equals("reset")) {
      graph.resetStats();
      out.println("access counters reset");
      return;
    }
    if (!args.isEmpty()) {
      out.println("usage: stats [reset]");
      return;
    }
    HotGraphStats s = graph.stats();
    out.println("revision:   " + s.revision() + " (" + s.syncState() + ")");
    out.println("graph:      " + s.nodeCount() + " node(s), " + s.edgeCount() + " edge(s)");
    out.println("focus:      " + s.focusSize());
    out.println(
        "path cache: "
            + s.cachedPaths()
            + " cached, "
            + s.cacheHits()
            + " hit(s), "
            + s.cacheMisses()
            + " miss(es)");
    out.println("accesses:   " + s.totalAccesses());
    out.println("dirty:      " + s.dirtyCount());
    out.println(
        "top:        "
            + (s.topAccessed().isEmpty()
                ? "(none)"
                : s.topAccessed().stream()
                    .map(c -> c.id() + "=" + c.count())
                    .collect(Collectors.joining(", "))));
  }

  private void printIds(List<String> ids) {
    out.println(ids.isEmpty() ? "(none)" : String.join(", ", ids));
  }

  private void printHelp() {
    out.println(
        """
        Options:
        --store <memory|file>   Store kind (default: memory)
        --graph <file>          Graph JSON file; without it the demo bench is loaded
        --zones <file>          Zone definitions JSON file
        --max-hops <n>          Default hop bound for path (default: 5)

        Commands:
        focus [<id> ...]                       replace the focus set (no ids clears it)
        focus --radius <n> <id> [<id> ...]     focus on everything within n hops
        neighbors <id>
        related <id>                           neighbors of the other kind
        path <start> <end> [max_hops]
        zone [<name>]                          list zones, or members of one zone
        kind <hardware|software>
        dirty [<id> ...]                       mark ids dirty (no ids: show count)
        update <id> <hardware|software> [key=value ...]
        remove <id>
        sync [expected_revision]
        stats [reset]
        help
        quit | exit
        """);
  }

  private void printError(Throwable t) {
    var chain = new ArrayList<Throwable>();
    Throwable cur = t;
    while (cur != null && !chain.contains(cur)) {
      chain.add(cur);
      cur = cur.getCause();
    }
    String msg = t.getMessage();
    if (msg == null || msg.isBlank()) {
      msg = t.getClass().getSimpleName();
    }
    out.println("! " + msg);
    for (int i = 1; i < chain.size(); i++) {
      Throwable c = chain.get(i);
      String rendered =
          c.getMessage() == null
              ? c.getClass().getSimpleName()
              : c.getClass().getSimpleName() + ": " + c.getMessage();
      out.println("! caused by: " + rendered);
    }
  }

  static List<String> tokenize(String line) {
    List<String> tokens = new ArrayList<>();
    StringBuilder cur = new StringBuilder();
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char ch = line.charAt(i);
      if (quote != 0) {
        if (ch == quote) {
          quote = 0;
        } else {
          cur.append(ch);
        }
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        continue;
      }
      if (Character.isWhitespace(ch)) {
        if (cur.length() > 0) {
          tokens.add(cur.toString());
          cur.setLength(0);
        }
        continue;
      }
      cur.append(ch);
    }
    if (quote != 0) {
      throw new IllegalArgumentException("Unclosed quote in command");
    }
    if (cur.length() > 0) {
      tokens.add(cur.toString());
    }
    return tokens;
  }

  private static int parseInt(String value, String name) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, e);
    }
  }

  private static long parseLong(String value, String name) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, e);
    }
  }

  private static Graph readDemoGraph() {
    try (InputStream in = resource(DEMO_GRAPH)) {
      return new GraphDocumentCodec().read(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + DEMO_GRAPH, e);
    }
  }

  private static List<ZoneRule> readDemoZones() {
    try (InputStream in = resource(DEMO_ZONES)) {
      return new ZoneRuleLoader().load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + DEMO_ZONES, e);
    }
  }

  private static InputStream resource(String name) throws IOException {
    InputStream in = Shell.class.getResourceAsStream(name);
    if (in == null) {
      throw new IOException("missing classpath resource " + name);
    }
    return in;
  }
}
