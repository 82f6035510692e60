package com.verifymyprovider.api.verification;

import com.verifymyprovider.api.config.VerificationPolicy;
import com.verifymyprovider.api.error.DuplicateSubmissionException;
import com.verifymyprovider.core.domain.VoteLog;
import com.verifymyprovider.core.domain.VoteLog.VoteDirection;
import com.verifymyprovider.core.repository.VerificationLogRepository;
import com.verifymyprovider.core.repository.VoteLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Sybil protection for submissions and votes.
 *
 * One identity (source IP or submitter) gets one live submission per provider/plan pair
 * within the sybil window, and one vote per verification. The vote rule is also a
 * unique key in the schema; this check only produces the friendlier error first.
 */
@Component
public class VerificationSubmissionGuard {

    private static final Logger log = LoggerFactory.getLogger(VerificationSubmissionGuard.class);

    private final VerificationPolicy policy;
    private final VerificationLogRepository verificationLogRepository;
    private final VoteLogRepository voteLogRepository;

    public VerificationSubmissionGuard(VerificationPolicy policy,
                                       VerificationLogRepository verificationLogRepository,
                                       VoteLogRepository voteLogRepository) {
        this.policy = policy;
        this.verificationLogRepository = verificationLogRepository;
        this.voteLogRepository = voteLogRepository;
    }

    /**
     * @throws DuplicateSubmissionException if the IP or submitter already verified this pair recently
     */
    public void checkSubmission(String npi, String planId, String sourceIp, String submittedBy, Instant now) {
        Instant since = now.minus(policy.sybilWindow());

        if (sourceIp != null && !sourceIp.isBlank()
                && verificationLogRepository.existsRecentBySourceIp(npi, planId, sourceIp, since, now)) {
            log.warn("Rejected repeat submission for {}/{} from the same IP", npi, planId);
            throw new DuplicateSubmissionException(
                    "Already submitted a verification for provider " + npi + " and plan " + planId
                            + " within the last " + policy.sybilWindow().toDays() + " days");
        }
        if (submittedBy != null && !submittedBy.isBlank()
                && verificationLogRepository.existsRecentBySubmittedBy(npi, planId, submittedBy, since, now)) {
            log.warn("Rejected repeat submission for {}/{} from the same submitter", npi, planId);
            throw new DuplicateSubmissionException(
                    "Already submitted a verification for provider " + npi + " and plan " + planId
                            + " within the last " + policy.sybilWindow().toDays() + " days");
        }
    }

    /**
     * Decides whether a vote is new or flips an earlier one.
     *
     * @throws DuplicateSubmissionException if the identity already voted the same way
     */
    public VoteDecision checkVote(UUID verificationId, String sourceIp, VoteDirection direction) {
        Optional<VoteLog> existing = voteLogRepository.findByVerificationAndSourceIp(verificationId, sourceIp);
        if (existing.isEmpty()) {
            return VoteDecision.newVote();
        }
        if (existing.get().getDirection() == direction) {
            throw new DuplicateSubmissionException("Already voted " + direction + " on verification " + verificationId);
        }
        return VoteDecision.change(existing.get());
    }

    /**
     * @param existing the vote being flipped, null for a first vote
     */
    public record VoteDecision(VoteLog existing) {

        static VoteDecision newVote() {
            return new VoteDecision(null);
        }

        static VoteDecision change(VoteLog existing) {
            return new VoteDecision(existing);
        }

        public boolean isChange() {
            return existing != null;
        }
    }
}
