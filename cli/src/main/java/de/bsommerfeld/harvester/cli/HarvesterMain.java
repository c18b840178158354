package de.bsommerfeld.harvester.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.harvester.core.domain.HarvestReport;
import de.bsommerfeld.harvester.core.event.ApplicationEventBus;
import de.bsommerfeld.harvester.core.util.StorageUtils;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import de.bsommerfeld.harvester.frameio.ProjectInfo;
import de.bsommerfeld.harvester.frameio.Team;
import de.bsommerfeld.harvester.harvest.HarvestException;
import de.bsommerfeld.harvester.harvest.HarvestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;

/**
 * Command line entry point.
 *
 * <p>
 * Exit codes: {@code 0} success, {@code 1} fatal error, {@code 2} usage
 * error.
 */
public final class HarvesterMain {

    static final String LOG_DIR_PROPERTY = "harvester.log.dir";

    static {
        // Read by logback.xml; must be set before the first logger is created
        if (System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY,
                    StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("logs").toString());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(HarvesterMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private HarvesterMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args, env);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.print(CliArguments.USAGE);
            return EXIT_USAGE;
        }
        if (arguments.command() == CliArguments.Command.HELP) {
            out.print(CliArguments.USAGE);
            return EXIT_OK;
        }

        Injector injector;
        try {
            injector = Guice.createInjector(new AppModule(arguments.configPath(), arguments.token()));
        } catch (RuntimeException e) {
            LOG.error("Startup failed", e);
            return EXIT_FAILURE;
        }

        try {
            switch (arguments.command()) {
                case LIST_TEAMS:
                    for (Team team : injector.getInstance(FrameioApi.class).listTeams())
                        out.println(team.id() + "\t" + team.name());
                    return EXIT_OK;
                case LIST_PROJECTS:
                    for (ProjectInfo project : injector.getInstance(FrameioApi.class).listProjects(arguments.teamId()))
                        out.println(project.id() + "\t" + project.name());
                    return EXIT_OK;
                default:
                    return harvest(injector, arguments, out);
            }
        } catch (FrameioApiException e) {
            LOG.error("Request failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (HarvestException e) {
            LOG.error("Harvest failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Could not write report: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private static int harvest(Injector injector, CliArguments arguments, PrintStream out)
            throws HarvestException, IOException {
        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        ProgressListener listener = new ProgressListener();
        eventBus.register(listener);
        try {
            HarvestReport report = injector.getInstance(HarvestService.class).harvest(arguments.toRequest());
            if (arguments.output() != null) {
                ReportWriter.write(report, arguments.output());
                LOG.info("Report written to {}", arguments.output().toAbsolutePath());
            } else {
                ReportWriter.write(report, out);
            }
            return EXIT_OK;
        } finally {
            eventBus.unregister(listener);
        }
    }
}
