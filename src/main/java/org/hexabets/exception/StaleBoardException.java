package org.hexabets.exception;

/** Action mines sur une grille inexistante, perdue ou remplacée. */
public class StaleBoardException extends IllegalStateException {
    public StaleBoardException(String message) {
        super(message);
    }
}
