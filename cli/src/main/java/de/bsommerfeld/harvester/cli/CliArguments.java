package de.bsommerfeld.harvester.cli;

import de.bsommerfeld.harvester.core.domain.HarvestRequest;
import de.bsommerfeld.harvester.core.domain.ReportView;

import java.nio.file.Path;
import java.util.Map;

/**
 * Parsed command line of {@link HarvesterMain}.
 */
public final class CliArguments {

    static final String TOKEN_ENV = "FRAMEIO_TOKEN";

    static final String USAGE = """
            Usage:
              harvester --project <id> [--filter "a,b"] [--include-historical]
                        [--view grouped|recent] [--output report.json]
                        [--config path] [--token <token>]
              harvester --list-teams
              harvester --list-projects <teamId>

            The API token is read from --token or the FRAMEIO_TOKEN environment variable.
            """;

    /** What the invocation asks for. */
    public enum Command {
        HARVEST, LIST_TEAMS, LIST_PROJECTS, HELP
    }

    private Command command = Command.HARVEST;
    private String projectId;
    private String teamId;
    private String nameFilter;
    private boolean includeHistorical;
    private ReportView view = ReportView.GROUPED;
    private Path output;
    private Path configPath;
    private String token;

    private CliArguments() {
    }

    /**
     * Parses {@code args}. The token falls back to {@value #TOKEN_ENV} in
     * {@code env}.
     *
     * @throws UsageException if an option is unknown, lacks its value, or a
     *                        required input is missing
     */
    public static CliArguments parse(String[] args, Map<String, String> env) throws UsageException {
        CliArguments parsed = new CliArguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--project":
                    parsed.projectId = value(args, ++i, arg);
                    break;
                case "--filter":
                    parsed.nameFilter = value(args, ++i, arg);
                    break;
                case "--include-historical":
                    parsed.includeHistorical = true;
                    break;
                case "--view":
                    parsed.view = view(value(args, ++i, arg));
                    break;
                case "--output":
                    parsed.output = Path.of(value(args, ++i, arg));
                    break;
                case "--config":
                    parsed.configPath = Path.of(value(args, ++i, arg));
                    break;
                case "--token":
                    parsed.token = value(args, ++i, arg);
                    break;
                case "--list-teams":
                    parsed.command = Command.LIST_TEAMS;
                    break;
                case "--list-projects":
                    parsed.command = Command.LIST_PROJECTS;
                    parsed.teamId = value(args, ++i, arg);
                    break;
                case "-h":
                case "--help":
                    parsed.command = Command.HELP;
                    return parsed;
                default:
                    throw new UsageException("Unknown option: " + arg);
            }
        }

        if (parsed.token == null || parsed.token.isBlank())
            parsed.token = env.get(TOKEN_ENV);
        if (parsed.token == null || parsed.token.isBlank())
            throw new UsageException("No API token given (use --token or " + TOKEN_ENV + ")");
        if (parsed.command == Command.HARVEST && (parsed.projectId == null || parsed.projectId.isBlank()))
            throw new UsageException("--project is required");
        return parsed;
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length || args[index].startsWith("--"))
            throw new UsageException(option + " requires a value");
        return args[index];
    }

    private static ReportView view(String raw) throws UsageException {
        try {
            return ReportView.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    public HarvestRequest toRequest() {
        return new HarvestRequest(token, projectId, nameFilter, includeHistorical, view);
    }

    public Command command() {
        return command;
    }

    public String projectId() {
        return projectId;
    }

    public String teamId() {
        return teamId;
    }

    public String nameFilter() {
        return nameFilter;
    }

    public boolean includeHistorical() {
        return includeHistorical;
    }

    public ReportView view() {
        return view;
    }

    public Path output() {
        return output;
    }

    public Path configPath() {
        return configPath;
    }

    public String token() {
        return token;
    }
}
