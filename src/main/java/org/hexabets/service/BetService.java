package org.hexabets.service;

import lombok.extern.slf4j.Slf4j;
import org.hexabets.dto.BetRequest;
import org.hexabets.dto.BetResponse;
import org.hexabets.exception.ExpiredDealException;
import org.hexabets.exception.InvalidParametersException;
import org.hexabets.model.Commitment;
import org.hexabets.service.fair.CommitmentManager;
import org.hexabets.service.fair.FairDraws;
import org.hexabets.service.fair.NonceAllocator;
import org.hexabets.service.fair.RandomStream;
import org.hexabets.service.games.BetOutcome;
import org.hexabets.service.games.GameResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enchaîne une mise : contrôle du montant et des paramètres, snapshot du commitment,
 * numéro de séquence, résolution, puis un seul delta signé vers le wallet.
 * Les jeux en deux temps (hi-lo, blackjack) gardent leur donne ouverte par session
 * jusqu'à la mise, qui la consomme.
 */
@Slf4j
@Service
public class BetService {

    private final CommitmentManager commitments;
    private final NonceAllocator nonces;
    private final RandomStream randomStream;
    private final WalletService wallet;
    private final String defaultPlayerSeed;
    private final Map<String, Draw> deals = new ConcurrentHashMap<>();

    public BetService(CommitmentManager commitments,
                      NonceAllocator nonces,
                      RandomStream randomStream,
                      WalletService wallet,
                      @Value("${app.fair.default-player-seed:client}") String defaultPlayerSeed) {
        this.commitments = commitments;
        this.nonces = nonces;
        this.randomStream = randomStream;
        this.wallet = wallet;
        this.defaultPlayerSeed = defaultPlayerSeed;
    }

    public <P> BetResponse play(String sessionId, GameResolver<P> resolver, BetRequest req, P params) {
        BigDecimal mise = normalize(req.betAmount);
        wallet.verifierMise(sessionId, mise);
        resolver.validate(params);
        return settle(sessionId, resolver, mise, open(resolver.drawsPerBet(), req.playerSeed, req.sequenceNumber), params);
    }

    /**
     * Opens the block of a two-step game and keeps it for this session. A new deal for
     * the same game replaces the previous one.
     */
    public Draw deal(String sessionId, GameResolver<?> resolver, String playerSeed) {
        Draw draw = open(resolver.drawsPerBet(), playerSeed, null);
        deals.put(dealKey(sessionId, resolver), draw);
        return draw;
    }

    /**
     * Settles the session's open deal, at most once. The bet must name the deal's
     * {@code sequenceNumber}; a deal opened before the last rotation is discarded.
     */
    public <P> BetResponse playDeal(String sessionId, GameResolver<P> resolver, BetRequest req, P params) {
        if (req.sequenceNumber == null) {
            throw new InvalidParametersException("sequenceNumber (nonceBase) requis");
        }
        BigDecimal mise = normalize(req.betAmount);
        wallet.verifierMise(sessionId, mise);
        resolver.validate(params);

        String key = dealKey(sessionId, resolver);
        Draw draw = deals.get(key);
        if (draw == null || draw.sequenceNumber() != req.sequenceNumber) {
            throw new ExpiredDealException("Aucune donne ouverte pour ce sequenceNumber.");
        }
        if (!deals.remove(key, draw)) {
            throw new ExpiredDealException("Donne déjà jouée.");
        }
        if (draw.commitment() != commitments.current()) {
            log.info("Donne {} seq={} abandonnée : seed retiré (epoch {})",
                    resolver.name(), draw.sequenceNumber(), draw.commitment().getEpoch());
            throw new ExpiredDealException("Le seed a changé depuis la donne. Relancez une partie.");
        }
        return settle(sessionId, resolver, mise, draw, params);
    }

    private <P> BetResponse settle(String sessionId, GameResolver<P> resolver, BigDecimal mise, Draw draw, P params) {
        BetOutcome outcome = resolver.resolve(mise, draw.draws(), params);
        BigDecimal solde = wallet.appliquer(sessionId, mise, outcome.payout().subtract(mise));

        log.debug("{} session={} seq={} epoch={} mise={} payout={} won={}",
                resolver.name(), sessionId, draw.sequenceNumber(), draw.commitment().getEpoch(),
                mise, outcome.payout(), outcome.won());
        return BetResponse.builder()
                .game(resolver.name())
                .outcome(outcome.detail())
                .won(outcome.won())
                .push(outcome.push())
                .betAmount(mise)
                .payout(outcome.payout())
                .playerSeed(draw.playerSeed())
                .sequenceNumber(draw.sequenceNumber())
                .commitHash(draw.commitment().getCommitHash())
                .epoch(draw.commitment().getEpoch())
                .solde(solde)
                .build();
    }

    /**
     * Snapshots the live commitment and binds the draws of one bet to it. Without a
     * caller-supplied sequence number a block of {@code block} numbers is reserved; a
     * supplied one must start at or after the counter, so a number already drawn in this
     * epoch is never drawn again.
     */
    public Draw open(int block, String playerSeed, Long sequenceNumber) {
        if (sequenceNumber != null && sequenceNumber < 0) {
            throw new InvalidParametersException("sequenceNumber doit être >= 0");
        }
        String seed = playerSeed == null || playerSeed.isBlank() ? defaultPlayerSeed : playerSeed;
        Commitment commitment = commitments.current();
        long seq;
        if (sequenceNumber == null) {
            seq = nonces.reserve(commitment, block);
        } else {
            seq = sequenceNumber;
            if (!nonces.claim(commitment, seq, block)) {
                throw new InvalidParametersException("sequenceNumber " + seq + " déjà utilisé, prochain libre : "
                        + commitment.nextSequence());
            }
        }
        return new Draw(commitment, seed, seq, randomStream.cursor(commitment, seed, seq));
    }

    private static String dealKey(String sessionId, GameResolver<?> resolver) {
        return sessionId + ":" + resolver.name();
    }

    private static BigDecimal normalize(BigDecimal amount) {
        return amount == null ? null : amount.setScale(2, RoundingMode.FLOOR);
    }

    public record Draw(Commitment commitment, String playerSeed, long sequenceNumber, FairDraws draws) {}
}
