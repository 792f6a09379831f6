package mobileqa.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import mobileqa.MobileQAException;
import mobileqa.locator.Locator;
import mobileqa.locator.LocatorConverter;
import mobileqa.locator.LocatorRepository;
import mobileqa.locator.LocatorShape;
import mobileqa.locator.PageSource;
import mobileqa.locator.selector.Selector;
import mobileqa.locator.selector.SelectorNode;
import mobileqa.locator.selector.SelectorParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point for offline locator work.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code mobileqa convert} converts a locator to another shape</li>
 *   <li>{@code mobileqa parse} prints the AST of selector text as JSON</li>
 *   <li>{@code mobileqa match} evaluates a locator against a saved page source</li>
 *   <li>{@code mobileqa repo} lists a locator repository</li>
 *   <li>{@code mobileqa version} prints the build version</li>
 * </ul>
 *
 * <p>A locator argument is XPath when it starts with {@code /} or {@code (},
 * an attribute map when it is a JSON object, and selector text otherwise.
 *
 * <p>Main class wired into the fat-JAR manifest by maven-shade-plugin.
 */
@Command(
        name        = "mobileqa",
        description = "Convert, inspect and test UI locators",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                MobileQACLI.ConvertCommand.class,
                MobileQACLI.ParseCommand.class,
                MobileQACLI.MatchCommand.class,
                MobileQACLI.RepoCommand.class,
                MobileQACLI.VersionCommand.class
        }
)
public class MobileQACLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MobileQACLI.class);

    static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /** The configured command line; locator errors print a message and exit with 2. */
    static CommandLine commandLine() {
        return new CommandLine(new MobileQACLI())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof MobileQAException) {
                        cmd.getErr().println("Error: " + ex.getMessage());
                        log.debug("Command failed", ex);
                        return 2;
                    }
                    throw ex;
                });
    }

    static Locator parseLocator(String text) throws IOException {
        String s = text.strip();
        if (s.startsWith("{")) {
            Map<String, Object> attributes = MAPPER.readValue(s, new TypeReference<LinkedHashMap<String, Object>>() {});
            return Locator.attributes(attributes);
        }
        return Locator.of(s);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /** Converts a locator between attribute-map, XPath and selector shapes. */
    @Command(
            name        = "convert",
            description = "Convert a locator to another shape",
            mixinStandardHelpOptions = true
    )
    static class ConvertCommand implements Callable<Integer> {

        enum Target { XPATH, SELECTOR, ATTRIBUTES }

        @Parameters(index = "0", description = "Locator: XPath, selector text or JSON attribute map")
        String locator;

        @Option(
                names       = {"-t", "--to"},
                description = "Target shape: ${COMPLETION-CANDIDATES}",
                required    = true
        )
        Target to;

        @Override
        public Integer call() throws Exception {
            Locator source = parseLocator(locator);
            switch (to) {
                case XPATH -> System.out.println(LocatorConverter.toXPath(
                        LocatorConverter.convert(source, LocatorShape.PATH_QUERY)));
                case SELECTOR -> System.out.println(LocatorConverter.toSelectorText(source));
                case ATTRIBUTES -> System.out.println(MAPPER.writeValueAsString(
                        LocatorConverter.convert(source, LocatorShape.ATTRIBUTES).getAttributes()));
            }
            return 0;
        }
    }

    /** Prints the parsed call chain of selector text. */
    @Command(
            name        = "parse",
            description = "Print the AST of selector text as JSON",
            mixinStandardHelpOptions = true
    )
    static class ParseCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Selector text, e.g. new UiSelector().text(\"OK\");")
        String selector;

        @Override
        public Integer call() throws Exception {
            System.out.println(MAPPER.writeValueAsString(toTree(SelectorParser.parse(selector))));
            return 0;
        }

        static List<Map<String, Object>> toTree(Selector selector) {
            List<Map<String, Object>> calls = new ArrayList<>();
            for (SelectorNode node : selector.nodes()) {
                Map<String, Object> call = new LinkedHashMap<>();
                call.put("method", node.method().getMethodName());
                List<Object> args = new ArrayList<>();
                for (Object arg : node.arguments()) {
                    args.add(arg instanceof Selector nested ? toTree(nested) : arg);
                }
                call.put("arguments", args);
                calls.add(call);
            }
            return calls;
        }
    }

    /** Evaluates a locator against a page source dump saved from a device. */
    @Command(
            name        = "match",
            description = "List the nodes of a saved page source that a locator selects",
            mixinStandardHelpOptions = true
    )
    static class MatchCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Locator: XPath, selector text or JSON attribute map")
        String locator;

        @Option(names = {"-s", "--source"}, required = true, description = "Page source XML file")
        Path source;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(source)) {
                System.err.println("Page source not found: " + source.toAbsolutePath());
                return 1;
            }
            PageSource page = PageSource.load(source);
            List<Element> nodes = page.select(parseLocator(locator));
            System.out.printf("%d node(s) matched%n", nodes.size());
            for (int i = 0; i < nodes.size(); i++) {
                Element e = nodes.get(i);
                System.out.printf("  [%d] %-36s text=%-20s id=%-30s bounds=%s%n", i,
                        e.getAttribute("class"), quote(e.getAttribute("text")),
                        e.getAttribute("resource-id"), e.getAttribute("bounds"));
            }
            return nodes.isEmpty() ? 1 : 0;
        }

        private static String quote(String s) {
            return "\"" + s + "\"";
        }
    }

    /** Lists a locator repository with every entry's XPath form. */
    @Command(
            name        = "repo",
            description = "List the named locators of a repository file",
            mixinStandardHelpOptions = true
    )
    static class RepoCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to the locator repository JSON")
        Path file;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(file)) {
                System.err.println("Repository not found: " + file.toAbsolutePath());
                return 1;
            }
            LocatorRepository repo = LocatorRepository.load(file);
            System.out.printf("Locator repository: %s (%d locators)%n%n", file.toAbsolutePath(), repo.size());
            for (String name : repo.names()) {
                Locator loc = repo.get(name);
                System.out.printf("  %-24s %-10s %s%n", name, loc.getShape(), loc.describe());
                System.out.printf("  %-24s %-10s %s%n", "", "xpath", LocatorConverter.toXPath(loc));
            }
            return 0;
        }
    }

    // ── Version ───────────────────────────────────────────────────────────────

    @Command(
            name        = "version",
            description = "Print MobileQA version",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("MobileQA 1.0.0-SNAPSHOT");
            System.out.println("Modules: locator, selector, session, element, navigator, cli");
            return 0;
        }
    }
}
