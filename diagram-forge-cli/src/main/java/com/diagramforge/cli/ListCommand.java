package com.diagramforge.cli;

import com.diagramforge.core.catalog.CloudProvider;
import com.diagramforge.core.catalog.ComponentCatalog;
import com.diagramforge.core.model.ComponentKind;
import com.diagramforge.core.model.Size;
import com.diagramforge.core.repair.RepairRule;
import com.diagramforge.core.repair.RepairRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to list component kinds, known cloud services, or auto-fix rules.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all component kinds with their default sizes
 * diagramforge list kinds
 *
 * # List the cloud services with a dedicated icon
 * diagramforge list services
 *
 * # List the auto-fix rules in pipeline order
 * diagramforge list rules
 * }</pre>
 */
@Command(
    name = "list",
    description = "List component kinds, cloud services, or repair rules",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: kinds, services, or rules")
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase(Locale.ROOT)) {
            case "kinds", "kind" -> listKinds(out);
            case "services", "service" -> listServices(out);
            case "rules", "rule" -> listRules(out);
            default -> {
                log.error("Unknown type: {}. Use: kinds, services, or rules", type);
                yield CliSupport.EXIT_ENGINE_ERROR;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listKinds(PrintWriter out) {
        out.println("Component Kinds:");
        out.println();
        for (ComponentKind kind : ComponentKind.values()) {
            Size size = ComponentCatalog.defaultSize(kind);
            out.printf("  • %-14s %-12s %sx%s%n", kind.wireName(), kind.category(),
                (int) size.width(), (int) size.height());
        }
        return CliSupport.EXIT_OK;
    }

    private int listServices(PrintWriter out) {
        out.println("Cloud Services:");
        for (CloudProvider provider : CloudProvider.values()) {
            out.println();
            out.printf("  %s (default: %s)%n", provider.kind().wireName(), provider.defaultService());
            for (Map.Entry<String, String> service : provider.knownServices().entrySet()) {
                out.printf("    • %-22s %s%n", service.getKey(), service.getValue());
            }
        }
        return CliSupport.EXIT_OK;
    }

    private int listRules(PrintWriter out) {
        out.println("Auto-fix Rules (in order):");
        out.println();
        List<RepairRule> rules = RepairRules.defaults();
        for (int i = 0; i < rules.size(); i++) {
            out.printf("  %2d. %s%n", i + 1, rules.get(i).name());
        }
        return CliSupport.EXIT_OK;
    }
}
