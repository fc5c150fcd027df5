package org.chessarena.model;

public enum CastleSide {
    KINGSIDE("O-O", 7, 6, 5),
    QUEENSIDE("O-O-O", 0, 2, 3);

    private final String notation;
    private final int rookCol;
    private final int kingTargetCol;
    private final int rookTargetCol;

    CastleSide(String notation, int rookCol, int kingTargetCol, int rookTargetCol) {
        this.notation = notation;
        this.rookCol = rookCol;
        this.kingTargetCol = kingTargetCol;
        this.rookTargetCol = rookTargetCol;
    }

    public String notation() {
        return notation;
    }

    public int rookCol() {
        return rookCol;
    }

    public int kingTargetCol() {
        return kingTargetCol;
    }

    public int rookTargetCol() {
        return rookTargetCol;
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
