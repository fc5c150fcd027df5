package org.chessarena.rules;

public class FenFormatException extends Exception {

    public FenFormatException(String message) {
        super(message);
    }
}
