package org.hexabets.service.fair;

import lombok.RequiredArgsConstructor;
import org.hexabets.model.Commitment;
import org.springframework.stereotype.Component;

/**
 * Sequence numbers per commitment epoch. The counter lives in the {@link Commitment},
 * so a rotation starts the next epoch at zero without any reset call.
 */
@Component
@RequiredArgsConstructor
public class NonceAllocator {

    private final CommitmentManager commitments;

    public long next() {
        return commitments.current().allocate(1);
    }

    public long reserve(Commitment commitment, int count) {
        if (count < 1) throw new IllegalArgumentException("count must be >= 1");
        return commitment.allocate(count);
    }

    /** Bloc fourni par le client, jamais en deçà du compteur ; false si déjà entamé. */
    public boolean claim(Commitment commitment, long firstSequence, int count) {
        if (count < 1) throw new IllegalArgumentException("count must be >= 1");
        return commitment.claim(firstSequence, count);
    }
}
