package org.carball.queryflow.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.builder.QueryStringBuilder;
import org.carball.queryflow.config.ConfigurationLoader;
import org.carball.queryflow.config.MappingConfig;
import org.carball.queryflow.config.MappingConfigLoader;
import org.carball.queryflow.dsl.DslQueryBuilder;
import org.carball.queryflow.exception.QueryFlowException;
import org.carball.queryflow.exception.QueryStringParseException;
import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.condition.Condition;
import org.carball.queryflow.model.mapping.FieldMapping;
import org.carball.queryflow.transformer.QueryStringTransformer;
import org.carball.queryflow.transformer.TransformerSettings;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

@Slf4j
public class QueryFlowCLI {

    private static final String VERSION = "1.0.0";
    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9][0-9]{0,17})");

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;

    public QueryFlowCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
    }

    public static void main(String[] args) {
        int status = new QueryFlowCLI(System.out, System.err, new ConfigurationLoader()).run(args);
        System.exit(status);
    }

    /**
     * Runs one command and returns the process exit status.
     */
    public int run(String[] args) {
        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            switch (args[0]) {
                case "transform":
                    return transform(args);
                case "build":
                    return build(args);
                case "dsl":
                    return dsl(args);
                case "version":
                    out.println("queryflow " + VERSION);
                    return 0;
                default:
                    throw new IllegalArgumentException("Unknown command: " + args[0]);
            }
        } catch (QueryStringParseException e) {
            err.println("❌ Query error: " + e.getMessage());
            log.debug("Query error details", e);
            return 1;
        } catch (IllegalArgumentException | QueryFlowException e) {
            err.println("❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            err.println("❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private int transform(String[] args) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            throw new IllegalArgumentException("Query string not specified");
        }
        out.println(createTransformer(args).transform(args[1]));
        return 0;
    }

    private int build(String[] args) throws IOException {
        MappingConfig config = configurationLoader.loadMappingConfig(args);
        MappingConfigLoader loader = configurationLoader.getMappingConfigLoader();
        QueryStringBuilder builder = new QueryStringBuilder(
                loader.toOperatorAliases(config), loader.toConditionRelation(config));
        FieldMapping fieldMapping = loader.toFieldMapping(config);

        List<Condition> conditions = parseConditions(args, builder);
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("At least one --condition is required");
        }
        for (Condition condition : conditions) {
            builder.addFilter(condition.toBuilder()
                    .field(fieldMapping.resolve(condition.getField()))
                    .build());
        }
        out.println(builder.build());
        return 0;
    }

    private int dsl(String[] args) throws IOException {
        MappingConfig config = configurationLoader.loadMappingConfig(args);
        MappingConfigLoader loader = configurationLoader.getMappingConfigLoader();
        QueryStringBuilder aliasResolver = new QueryStringBuilder(loader.toOperatorAliases(config), BooleanOp.AND);
        FieldMapping fieldMapping = loader.toFieldMapping(config);
        QueryStringTransformer transformer = new QueryStringTransformer(
                fieldMapping, loader.toValueTranslations(config), configurationLoader.loadSettings(args));

        DslQueryBuilder builder = new DslQueryBuilder(fieldMapping, transformer)
                .conditions(parseConditions(args, aliasResolver))
                .conditionRelation(loader.toConditionRelation(config));

        int page = 1;
        int pageSize = 10;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--query":
                case "-q":
                    builder.queryString(requireValue(args, i++, "Query string not specified"));
                    break;
                case "--sort":
                    builder.ordering(Arrays.asList(requireValue(args, i++, "Sort fields not specified").split(",")));
                    break;
                case "--page":
                    page = parseNumber(requireValue(args, i++, "Page not specified"), "--page");
                    break;
                case "--size":
                    pageSize = parseNumber(requireValue(args, i++, "Page size not specified"), "--size");
                    break;
                default:
                    break;
            }
        }
        builder.pagination(page, pageSize);
        out.println(builder.toJson());
        return 0;
    }

    private QueryStringTransformer createTransformer(String[] args) throws IOException {
        MappingConfig config = configurationLoader.loadMappingConfig(args);
        MappingConfigLoader loader = configurationLoader.getMappingConfigLoader();
        TransformerSettings settings = configurationLoader.loadSettings(args);
        return new QueryStringTransformer(loader.toFieldMapping(config), loader.toValueTranslations(config), settings);
    }

    private static List<Condition> parseConditions(String[] args, QueryStringBuilder aliasResolver) {
        List<Condition> conditions = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            if ("--condition".equals(args[i]) || "-c".equals(args[i])) {
                conditions.add(parseCondition(requireValue(args, i++, "Condition not specified"), aliasResolver));
            }
        }
        return conditions;
    }

    /**
     * Parses {@code field:operator[:v1,v2][:or|and]}.
     */
    static Condition parseCondition(String text, QueryStringBuilder aliasResolver) {
        String[] parts = text.split(":", -1);
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Invalid condition '" + text + "', expected field:operator:values");
        }
        Condition.ConditionBuilder builder = Condition.builder()
                .field(parts[0].trim())
                .operator(aliasResolver.resolveOperator(parts[1]));

        int valueEnd = parts.length;
        if (parts.length >= 4 && isRelation(parts[parts.length - 1])) {
            builder.groupRelation(BooleanOp.fromName(parts[parts.length - 1]));
            valueEnd--;
        }
        String values = String.join(":", Arrays.copyOfRange(parts, Math.min(2, valueEnd), valueEnd));
        List<Object> parsed = new ArrayList<>();
        if (!values.isEmpty()) {
            for (String value : values.split(",")) {
                parsed.add(toValue(value.trim()));
            }
        }
        return builder.values(parsed).build();
    }

    private static boolean isRelation(String text) {
        return "or".equalsIgnoreCase(text) || "and".equalsIgnoreCase(text);
    }

    private static Object toValue(String text) {
        return INTEGER.matcher(text).matches() ? (Object) Long.valueOf(text) : text;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    private static int parseNumber(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                "help".equals(args[0]);
    }

    private void printUsage() {
        out.println("queryflow " + VERSION);
        out.println();
        out.println("Usage: java -jar queryflow.jar <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  transform <query>        Rewrite a query string with the configured mapping");
        out.println("  build                    Build a query string from --condition options");
        out.println("  dsl                      Build an Elasticsearch search body");
        out.println("  version                  Print the version");
        out.println();
        out.println("Options:");
        out.println("  --condition, -c <cond>   field:operator[:v1,v2][:or|and], repeatable");
        out.println("  --query, -q <query>      Query string embedded in the search body (dsl)");
        out.println("  --sort <f1,-f2>          Sort fields, '-' for descending (dsl)");
        out.println("  --page <n>               Page number starting at 1 (dsl)");
        out.println("  --size <n>               Page size (dsl, default: 10)");
        out.println("  --help, -h               Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Examples:");
        out.println("  java -jar queryflow.jar transform 'severity: 致命' --mapping mapping.yml");
        out.println("  java -jar queryflow.jar build -c status:equal:error,warning -c level:gte:3");
        out.println("  java -jar queryflow.jar dsl -c status:equal:error -q 'message: timeout' --sort -created_at");
    }
}
