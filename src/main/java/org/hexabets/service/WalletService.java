package org.hexabets.service;

import lombok.extern.slf4j.Slf4j;
import org.hexabets.exception.InvalidBetException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Soldes de démo en mémoire, par session. Les jeux ne connaissent que
 * {@link #appliquer} : vérification du solde et delta signé en une seule étape atomique.
 */
@Slf4j
@Service
public class WalletService {

    private final Map<String, BigDecimal> soldes = new ConcurrentHashMap<>();
    private final BigDecimal soldeInitial;

    public WalletService(@Value("${app.wallet.initial-balance:10000}") BigDecimal soldeInitial) {
        this.soldeInitial = soldeInitial.setScale(2, RoundingMode.FLOOR);
    }

    public BigDecimal getSolde(String sessionId) {
        return soldes.computeIfAbsent(sessionId, k -> soldeInitial);
    }

    /** Refuse une mise non positive ou supérieure au solde, sans rien modifier. */
    public void verifierMise(String sessionId, BigDecimal mise) {
        if (mise == null || mise.signum() <= 0) throw new InvalidBetException("Montant invalide");
        if (getSolde(sessionId).compareTo(mise) < 0) throw new InvalidBetException("Solde insuffisant");
    }

    /**
     * Applies {@code delta} if the balance still covers {@code mise}; the check and the
     * update happen inside one {@code compute} so concurrent bets cannot overdraw.
     */
    public BigDecimal appliquer(String sessionId, BigDecimal mise, BigDecimal delta) {
        BigDecimal solde = soldes.compute(sessionId, (k, courant) -> {
            BigDecimal base = courant == null ? soldeInitial : courant;
            if (base.compareTo(mise) < 0) throw new InvalidBetException("Solde insuffisant");
            return base.add(delta);
        });
        log.debug("Session {} : delta {} -> solde {}", sessionId, delta, solde);
        return solde;
    }

    public BigDecimal debiter(String sessionId, BigDecimal montant) {
        if (montant == null || montant.signum() <= 0) throw new InvalidBetException("Montant invalide");
        return appliquer(sessionId, montant, montant.negate());
    }

    public BigDecimal crediter(String sessionId, BigDecimal montant) {
        return appliquer(sessionId, BigDecimal.ZERO, montant);
    }
}
