package org.chessarena.console;

import org.chessarena.match.MatchOrchestrator;
import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.rules.FenCodec;
import org.chessarena.rules.FenFormatException;
import org.chessarena.rules.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Line-based director surface on top of a {@link MatchOrchestrator}.
 */
public class DirectorConsole {
    private static final Logger logger = LoggerFactory.getLogger(DirectorConsole.class);

    private static final String HELP = String.join("\n",
            "Commands:",
            "  start                  start the match",
            "  pause | resume         pause or resume automatic turns",
            "  reset                  back to the start position",
            "  force <white|black> <move>  play a move for a side",
            "  skip                   pass the turn (paused or waiting only)",
            "  prompt <text>          replace the next prompt sent to an agent",
            "  fen <position>         set the position without validation",
            "  result <white|black|draw>  end the match by decision",
            "  status | board | moves show match state",
            "  help                   this text",
            "  quit                   leave");

    private final MatchOrchestrator orchestrator;
    private final ConsoleMatchView view;
    private final PrintStream out;

    public DirectorConsole(MatchOrchestrator orchestrator, ConsoleMatchView view, PrintStream out) {
        this.orchestrator = orchestrator;
        this.view = view;
        this.out = out;
    }

    public void run(BufferedReader in) throws IOException {
        out.println("Director console ready. Type 'help' for commands.");
        String line;
        while ((line = in.readLine()) != null) {
            if (!handle(line)) {
                return;
            }
        }
    }

    /**
     * Executes one command line.
     *
     * @return {@code false} once the director asked to quit
     */
    public boolean handle(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String[] parts = trimmed.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";

        try {
            switch (command) {
                case "start" -> orchestrator.start();
                case "pause" -> orchestrator.pause();
                case "resume" -> orchestrator.resume();
                case "reset" -> orchestrator.reset();
                case "force" -> force(argument);
                case "skip" -> orchestrator.skipTurn();
                case "prompt" -> orchestrator.overridePrompt(argument);
                case "fen" -> setPosition(argument);
                case "result" -> orchestrator.declareResult(parseOutcome(argument));
                case "status" -> view.printStatus(orchestrator.snapshot());
                case "board" -> view.printBoard(orchestrator.snapshot());
                case "moves" -> view.printMoves(orchestrator.snapshot());
                case "help" -> out.println(HELP);
                case "quit", "exit" -> {
                    return false;
                }
                default -> out.println("Unknown command: " + command + ". Type 'help' for commands.");
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.debug("Director command '{}' rejected: {}", trimmed, e.getMessage());
            out.println("Rejected: " + e.getMessage());
        }
        return true;
    }

    private void force(String argument) {
        String[] parts = argument.split("\\s+", 2);
        if (parts.length < 2) {
            throw new IllegalArgumentException("Usage: force <white|black> <move>");
        }
        orchestrator.forceMove(parts[1], parseSide(parts[0]));
    }

    private void setPosition(String fen) {
        try {
            Position position = FenCodec.parse(fen);
            orchestrator.setPosition(position);
        } catch (FenFormatException e) {
            throw new IllegalArgumentException("Invalid FEN: " + e.getMessage(), e);
        }
    }

    static PieceColor parseSide(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "white", "w" -> PieceColor.WHITE;
            case "black", "b" -> PieceColor.BLACK;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }

    static Outcome parseOutcome(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "white", "1-0" -> Outcome.WHITE_WINS;
            case "black", "0-1" -> Outcome.BLACK_WINS;
            case "draw", "1/2-1/2" -> Outcome.DRAW;
            default -> throw new IllegalArgumentException("Unknown result: " + value);
        };
    }
}
