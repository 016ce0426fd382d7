package org.optimax.rogue.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.optimax.rogue.cli.CommandLineInterface;
import org.optimax.rogue.runtime.EngineSettings;
import org.optimax.rogue.runtime.TickOutcome;
import org.optimax.rogue.server.DuelServer;
import org.optimax.rogue.server.config.ServerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "serve",
    description = "Hosts one duel between two players identified by their shared secrets."
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServeCommand.class);

    static final int EXIT_MATCH_NOT_STARTED = 1;
    static final int EXIT_BAD_CONFIGURATION = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--secret1", required = true, description = "Shared secret player 1 identifies with.")
    private String secret1;

    @Option(names = "--secret2", required = true, description = "Shared secret player 2 identifies with.")
    private String secret2;

    @Option(names = "--host", description = "Interface to listen on (overrides optimax-rogue.server.host).")
    private String host;

    @Option(names = "--port", description = "Port to listen on (overrides optimax-rogue.server.port).")
    private Integer port;

    @Override
    public Integer call() throws Exception {
        if (secret1.equals(secret2)) {
            LOGGER.error("--secret1 and --secret2 must differ");
            return EXIT_BAD_CONFIGURATION;
        }

        final ServerSettings serverSettings;
        final EngineSettings engineSettings;
        try {
            final Config config = parent.getConfig().getConfig("optimax-rogue");
            ServerSettings settings = ServerSettings.fromConfig(config);
            if (host != null) {
                settings = settings.withHost(host);
            }
            if (port != null) {
                settings = settings.withPort(port);
            }
            serverSettings = settings;
            engineSettings = EngineSettings.fromConfig(config);
        } catch (IllegalArgumentException | ConfigException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return EXIT_BAD_CONFIGURATION;
        }

        final DuelServer server = new DuelServer(serverSettings, engineSettings, secret1, secret2);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown"));

        final Optional<TickOutcome> outcome = server.run();
        if (outcome.isEmpty()) {
            LOGGER.info("No match was played.");
            return EXIT_MATCH_NOT_STARTED;
        }
        LOGGER.info("Match finished: {}", outcome.get());
        return 0;
    }
}
