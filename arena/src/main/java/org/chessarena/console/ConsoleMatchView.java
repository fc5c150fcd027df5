package org.chessarena.console;

import org.chessarena.match.AgentUsage;
import org.chessarena.match.LogEntry;
import org.chessarena.match.MatchListener;
import org.chessarena.match.MatchStatus;
import org.chessarena.match.MatchSnapshot;
import org.chessarena.match.MoveRecord;
import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.prompt.BoardRenderer;

import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Text rendering of the match for a terminal: a running log feed plus board
 * and move-list views on demand.
 */
public class ConsoleMatchView implements MatchListener {
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    private final PrintStream out;
    private final boolean unicode;

    public ConsoleMatchView(PrintStream out, boolean unicode) {
        this.out = out;
        this.unicode = unicode;
    }

    @Override
    public void onStatusChanged(MatchStatus previous, MatchStatus current) {
        out.println("[status] " + previous.displayName() + " -> " + current.displayName());
    }

    @Override
    public void onLogEntry(LogEntry entry) {
        String side = entry.side() == null ? "" : " " + entry.side().displayName();
        out.println("[" + TIME.format(entry.timestamp()) + "] " + entry.type() + side + ": " + entry.content());
    }

    @Override
    public void onPositionChanged(Position position) {
        out.println(BoardRenderer.render(position.board(), unicode));
    }

    public void printBoard(MatchSnapshot snapshot) {
        out.println(BoardRenderer.render(snapshot.position().board(), unicode));
        out.println("FEN: " + snapshot.fen());
    }

    public void printStatus(MatchSnapshot snapshot) {
        out.println("Status: " + snapshot.status().displayName());
        out.println("To move: " + snapshot.sideToMove().displayName() + " (move " + snapshot.position().fullMoveNumber() + ")");
        out.println("Hallucinations: white " + snapshot.whiteHallucinations() + "/" + snapshot.hallucinationCeiling()
                + ", black " + snapshot.blackHallucinations() + "/" + snapshot.hallucinationCeiling());
        out.println("Requests: white " + describe(snapshot.whiteUsage()) + ", black " + describe(snapshot.blackUsage()));
        if (snapshot.result() != null) {
            out.println("Result: " + snapshot.result());
        }
        if (snapshot.errorMessage() != null) {
            out.println("Error: " + snapshot.errorMessage());
        }
    }

    private static String describe(AgentUsage usage) {
        return usage.requests() + " (" + usage.errors() + " failed, avg " + usage.averageLatencyMs() + "ms)";
    }

    public void printMoves(MatchSnapshot snapshot) {
        List<MoveRecord> moves = snapshot.moves();
        if (moves.isEmpty()) {
            out.println("No moves yet.");
            return;
        }
        StringBuilder line = new StringBuilder();
        for (MoveRecord record : moves) {
            if (record.side() == PieceColor.WHITE) {
                line.append(record.moveNumber()).append(". ");
            } else if (line.length() == 0) {
                line.append(record.moveNumber()).append("... ");
            }
            line.append(record.notation());
            if (record.source() == MoveRecord.Source.DIRECTOR) {
                line.append("(D)");
            }
            line.append(' ');
        }
        out.println(line.toString().trim());
    }
}
