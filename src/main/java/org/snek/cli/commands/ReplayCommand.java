package org.snek.cli.commands;

import com.typesafe.config.ConfigException;
import org.snek.cli.CommandLineInterface;
import org.snek.runtime.GameController;
import org.snek.runtime.GameSettings;
import org.snek.runtime.internal.services.SeededRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "replay",
    description = "Run a game headless from a script of turns and time advances and print the result"
)
public class ReplayCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ReplayCommand.class);

    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_BAD_SCRIPT = 2;

    @Option(
        names = {"-s", "--script"},
        required = true,
        description = "Events to feed, e.g. \"R,t0.25*4,D,t0.25\" (L/R/U/D turn, t<seconds> advance, *n repeat)"
    )
    private String script;

    @Option(names = {"-W", "--width"}, description = "Board width in cells (default from configuration)")
    private Integer width;

    @Option(names = {"-H", "--height"}, description = "Board height in cells (default from configuration)")
    private Integer height;

    @Option(names = {"--seed"}, description = "Seed for snake and fruit placement (default from configuration, else time-based)")
    private Long seed;

    @Option(names = {"--board"}, negatable = true, defaultValue = "true", fallbackValue = "true",
        description = "Print the final board; --no-board suppresses it")
    private boolean board = true;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        GameSettings settings;
        try {
            settings = GameSettings.fromConfig(parent.getConfig());
            if (width != null || height != null) {
                settings = settings.withSize(width != null ? width : settings.width(), height != null ? height : settings.height());
            }
            if (seed != null) {
                settings = settings.withSeed(seed);
            }
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid game configuration: {}", e.getMessage());
            err.println("Invalid game configuration: " + e.getMessage());
            err.flush();
            return EXIT_CONFIG_ERROR;
        }

        ReplayScript replay;
        try {
            replay = ReplayScript.parse(script);
        } catch (IllegalArgumentException e) {
            err.println("Invalid script: " + e.getMessage());
            err.flush();
            return EXIT_BAD_SCRIPT;
        }

        long effectiveSeed = settings.effectiveSeed();
        GameController controller = new GameController(settings, new SeededRandomProvider(effectiveSeed));
        LOG.debug("Replaying {} steps on {}x{} with seed {}", replay.steps().size(), settings.width(), settings.height(), effectiveSeed);
        int refused = replay.playOn(controller);

        out.println("seed:    " + effectiveSeed);
        out.println("state:   " + controller.state());
        out.println("cause:   " + controller.terminationCause().map(Enum::name).orElse("-"));
        out.println("length:  " + controller.snakeLength());
        out.println("head:    " + controller.snakeHead());
        out.println("ticks:   " + controller.tickCount());
        out.println("refused: " + refused);
        controller.lastMessage().ifPresent(m -> out.println("message: " + m));
        if (board) {
            out.print(controller.grid().render());
        }
        out.flush();
        return 0;
    }
}
