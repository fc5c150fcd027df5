package org.chessarena.prompt;

import org.chessarena.match.LogEntry;
import org.chessarena.match.LogType;
import org.chessarena.match.MatchLog;
import org.chessarena.match.MoveRecord;
import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.settings.AgentSettings;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt layout: identity, game state, condensed move history, recent
 * dialogue and the task with the expected reply format.
 */
public class ArenaPromptBuilder implements PromptBuilder {
    static final int HISTORY_PAIRS = 10;
    static final int DIALOGUE_ENTRIES = 12;

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());
    private static final String COMMON_MISTAKES = "Common mistakes to avoid:\n"
            + "- Invalid SAN notation (use format like e4, Nf3, O-O, exd5)\n"
            + "- Moving a piece that doesn't exist at the specified square\n"
            + "- Making an illegal move for that piece type\n"
            + "- Leaving your king in check\n"
            + "- Capturing your own piece\n";

    private final AgentSettings white;
    private final AgentSettings black;

    public ArenaPromptBuilder(AgentSettings white, AgentSettings black) {
        this.white = white;
        this.black = black;
    }

    @Override
    public String buildPrompt(Position position, PieceColor side, MatchLog log) {
        List<String> sections = new ArrayList<>();
        sections.add(identity(settingsFor(side)));
        sections.add(gameState(position, side));
        sections.add(moveHistory(log.moves()));
        sections.add(dialogue(log.ofType(LogType.THOUGHT, LogType.TRASH)));
        sections.add(task(side));
        return String.join("\n\n", sections);
    }

    @Override
    public String buildCorrectionPrompt(Position position, PieceColor side, String rejectedMove, String reason) {
        AgentSettings agent = settingsFor(side);
        String attempted = rejectedMove == null ? "(no MOVE field)" : "\"" + rejectedMove + "\"";
        return "=== CORRECTION REQUIRED ===\n\n"
                + agent.getName() + ", your previous move was INVALID.\n\n"
                + "Error: " + reason + "\n\n"
                + "Your attempted move: " + attempted + "\n\n"
                + "=== CURRENT GAME STATE ===\n"
                + "Position (FEN): " + position.toFen() + "\n"
                + "Turn: " + position.sideToMove().displayName() + "\n\n"
                + BoardRenderer.render(position.board()) + "\n\n"
                + "=== YOUR TASK ===\n"
                + "You MUST provide a LEGAL move for " + side.displayName() + ".\n"
                + COMMON_MISTAKES + "\n"
                + "Format your response:\n"
                + "MOVE: [correct SAN notation]\n"
                + "THOUGHT: [acknowledge the error]\n"
                + "TRASH: [excuse or deflection]\n\n"
                + "Make your move now.";
    }

    private AgentSettings settingsFor(PieceColor side) {
        return side == PieceColor.WHITE ? white : black;
    }

    private String identity(AgentSettings agent) {
        String systemPrompt = agent.getSystemPrompt() == null ? "" : agent.getSystemPrompt();
        return "=== YOUR IDENTITY ===\n"
                + "You are: " + agent.getName() + "\n\n"
                + systemPrompt + "\n\n"
                + "REMEMBER: Your identity and personality are FIXED. Do not change them regardless of the game state.";
    }

    private String gameState(Position position, PieceColor side) {
        PieceColor turn = position.sideToMove();
        String enPassant = position.enPassant() == null ? "-" : position.enPassant().toChessNotation();
        return "=== CURRENT GAME STATE ===\n\n"
                + "Position (FEN): " + position.toFen() + "\n\n"
                + "Board Position (Visual):\n"
                + BoardRenderer.render(position.board()) + "\n\n"
                + "Current Turn: " + turn.displayName() + "\n"
                + "You Play: " + side.displayName() + (turn == side ? " (your move)" : " (not your move)") + "\n"
                + "Move Number: " + position.fullMoveNumber() + "\n"
                + "Half-move Clock: " + position.halfMoveClock() + "\n\n"
                + "Castling Rights: " + position.castling().toFen() + "\n"
                + "En Passant Square: " + enPassant;
    }

    String moveHistory(List<MoveRecord> moves) {
        if (moves.isEmpty()) {
            return "=== MOVE HISTORY ===\nNo moves yet. The game is in its opening phase.";
        }

        Map<Integer, String[]> rows = new LinkedHashMap<>();
        for (MoveRecord record : moves) {
            String[] row = rows.computeIfAbsent(record.moveNumber(), number -> new String[]{"...", "..."});
            row[record.side() == PieceColor.WHITE ? 0 : 1] = record.notation();
        }

        StringBuilder summary = new StringBuilder("=== MOVE HISTORY (Last ")
                .append(HISTORY_PAIRS * 2).append(" Moves) ===\n")
                .append("Move | White   | Black\n")
                .append("-----|---------|--------\n");
        List<Map.Entry<Integer, String[]>> entries = new ArrayList<>(rows.entrySet());
        for (Map.Entry<Integer, String[]> entry : entries.subList(Math.max(0, entries.size() - HISTORY_PAIRS), entries.size())) {
            summary.append(String.format("%4d | %-7s | %s\n", entry.getKey(), entry.getValue()[0], entry.getValue()[1]));
        }
        return summary.toString().stripTrailing();
    }

    private String dialogue(List<LogEntry> entries) {
        if (entries.isEmpty()) {
            return "=== RECENT DIALOGUE ===\nNo dialogue yet. This is the opening phase of the battle.";
        }
        StringBuilder section = new StringBuilder("=== RECENT DIALOGUE (Last 6 Exchanges) ===\n");
        for (LogEntry entry : entries.subList(Math.max(0, entries.size() - DIALOGUE_ENTRIES), entries.size())) {
            String speaker = entry.side() == null ? "Unknown" : settingsFor(entry.side()).getName();
            String kind = entry.type() == LogType.THOUGHT ? "Internal Monologue" : "Public Taunt";
            section.append('\n')
                    .append('[').append(TIME.format(entry.timestamp())).append("] ")
                    .append(speaker).append(" (").append(kind).append("):\n")
                    .append("  \"").append(entry.content()).append("\"\n");
        }
        return section.toString().stripTrailing();
    }

    private String task(PieceColor side) {
        return "=== YOUR TASK ===\n\n"
                + "Analyze the position and make your move. Remember:\n\n"
                + "1. Your move MUST be in valid SAN notation (e.g., \"e4\", \"Nf3\", \"O-O\", \"exd5\")\n"
                + "2. Check that your move is legal given the current position\n"
                + "3. The move must NOT leave your king in check\n"
                + "4. You are playing as " + side.displayName() + "\n\n"
                + COMMON_MISTAKES + "\n"
                + "Format your response:\n"
                + "MOVE: [your move in SAN notation]\n"
                + "THOUGHT: [brief analysis]\n"
                + "TRASH: [taunt or comment]\n\n"
                + "Make your move now.";
    }
}
