package org.hexabets.exception;

/** Paramètres de jeu hors bornes, levée avant toute consommation de nonce. */
public class InvalidParametersException extends IllegalArgumentException {
    public InvalidParametersException(String message) {
        super(message);
    }
}
