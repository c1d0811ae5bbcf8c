package org.javai.experiment.assign;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.experiment.Outcome;
import org.javai.experiment.boundary.Boundary;
import org.javai.experiment.model.Assignment;
import org.javai.experiment.model.DeviceInfo;
import org.javai.experiment.model.Experiment;
import org.javai.experiment.model.SessionInfo;
import org.javai.experiment.model.TestStatus;
import org.javai.experiment.model.UserProfile;
import org.javai.experiment.model.Variant;
import org.javai.experiment.store.ExperimentStore;

/**
 * Maps a (test, user) pair to a variant, deterministically and at most once.
 *
 * <p>An empty result means "not in the test": the test is not running, the user is outside
 * the audience, or the user fell outside the rollout share. Store trouble is a failed outcome.
 *
 * <p>The existing-assignment check and the create are collapsed into one atomic
 * {@link ExperimentStore#putAssignmentIfAbsent} call; when two first-time requests race, both
 * answer with the variant of whichever write won.
 */
public class AssignmentEngine {

    private static final Logger LOG = LogManager.getLogger(AssignmentEngine.class);

    private final ExperimentStore store;
    private final Boundary boundary;
    private final AudienceMatcher audienceMatcher;
    private final BucketHasher hasher;
    private final Clock clock;

    public AssignmentEngine(ExperimentStore store, Boundary boundary, Clock clock) {
        this(store, boundary, new AudienceMatcher(), new BucketHasher(), clock);
    }

    public AssignmentEngine(ExperimentStore store, Boundary boundary, AudienceMatcher audienceMatcher,
                            BucketHasher hasher, Clock clock) {
        this.store = store;
        this.boundary = boundary;
        this.audienceMatcher = audienceMatcher;
        this.hasher = hasher;
        this.clock = clock;
    }

    /**
     * @param experiment the latest stored snapshot of the test; bandit weights are read from it
     * @return the assigned variant id, or empty when the user is not in the test
     */
    public Outcome<Optional<String>> assign(Experiment experiment, String userId, UserProfile profile,
                                            SessionInfo session, DeviceInfo device) {
        if (experiment.status() != TestStatus.RUNNING) {
            return Outcome.ok(Optional.empty());
        }
        String testId = experiment.testId();
        Map<String, String> tags = Map.of("testId", testId);

        Outcome<Optional<Assignment>> existing = boundary.call("ExperimentStore.findAssignment", tags,
                () -> store.findAssignment(testId, userId));
        if (existing.isFail() || existing.getOrThrow().isPresent()) {
            return existing.map(found -> found.map(Assignment::variantId));
        }

        UserProfile effectiveProfile = profile != null ? profile : UserProfile.of(userId);
        if (!audienceMatcher.matches(experiment.audience(), effectiveProfile, session, device)) {
            LOG.debug("User {} is outside the audience of test {}", userId, testId);
            return Outcome.ok(Optional.empty());
        }
        if (!inRollout(experiment, userId)) {
            LOG.debug("User {} is outside the rollout of test {}", userId, testId);
            return Outcome.ok(Optional.empty());
        }

        Variant chosen = choose(experiment, userId);
        Assignment candidate = new Assignment(testId, userId, chosen.variantId(), clock.instant(),
                effectiveProfile,
                session != null ? session : SessionInfo.anonymous(),
                device != null ? device : DeviceInfo.unknown());

        return boundary.call("ExperimentStore.putAssignmentIfAbsent", tags,
                        () -> store.putAssignmentIfAbsent(candidate))
                .map(winner -> Optional.of(winner.variantId()));
    }

    /**
     * The variant the bucket of this user selects under the experiment's current weights.
     * Pure: reads no store state.
     */
    public Variant choose(Experiment experiment, String userId) {
        List<Variant> variants = experiment.variants();
        double[] weights = experiment.allocation().weightsInOrder(variants);
        int index = BucketHasher.pick(weights, hasher.bucket(experiment.testId(), userId));
        return variants.get(index);
    }

    private boolean inRollout(Experiment experiment, String userId) {
        double rollout = experiment.allocation().rolloutPercentage();
        if (rollout >= 100.0) {
            return true;
        }
        return hasher.rolloutBucket(experiment.testId(), userId) * 100.0 < rollout;
    }
}
