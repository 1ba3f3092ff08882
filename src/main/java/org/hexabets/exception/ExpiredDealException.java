package org.hexabets.exception;

/** Donne hi-lo / blackjack inconnue, déjà jouée ou ouverte sous un seed depuis retiré. */
public class ExpiredDealException extends IllegalStateException {
    public ExpiredDealException(String message) {
        super(message);
    }
}
