package org.hexabets.exception;

/** Montant non positif ou solde insuffisant : la mise est refusée, rien n'est modifié. */
public class InvalidBetException extends IllegalArgumentException {
    public InvalidBetException(String message) {
        super(message);
    }
}
