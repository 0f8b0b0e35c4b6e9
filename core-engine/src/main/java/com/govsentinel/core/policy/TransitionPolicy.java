package com.govsentinel.core.policy;

import com.govsentinel.core.model.EntityRecord;
import com.govsentinel.core.model.TransitionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Pure decision function mapping (previous status, current status) to a
 * {@link TransitionOutcome} for one source family.
 *
 * <h3>Rules, in order</h3>
 * <ol>
 * <li>never seen: {@code NOTIFY_INITIAL} if the current status is active,
 * otherwise {@code NO_OP} (the entity is tracked silently)</li>
 * <li>status unchanged: {@code NO_OP}</li>
 * <li>current status terminal: {@code NOTIFY_TERMINAL}</li>
 * <li>active to update status: {@code NOTIFY_UPDATE}</li>
 * <li>anything else: {@code NO_OP}; the caller still persists the new
 * status</li>
 * </ol>
 *
 * <p>
 * "Never seen" covers both a missing record and a record whose initial
 * notification never went out; see
 * {@link #previousStatusFor(EntityRecord)}.
 * </p>
 *
 * @since 1.0.0
 */
public class TransitionPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(TransitionPolicy.class);

    private final StatusTable table;

    /**
     * @param table validated status table
     * @throws IllegalStateException if the table is invalid
     */
    public TransitionPolicy(StatusTable table) {
        this.table = Objects.requireNonNull(table, "StatusTable must not be null");
        table.validate();
    }

    /**
     * Classify an entity status transition.
     *
     * @param previous previous status, or {@code null} if never seen
     * @param current  current status; must not be {@code null}
     * @return the outcome
     */
    public TransitionOutcome classify(String previous, String current) {
        Objects.requireNonNull(current, "current status must not be null");

        TransitionOutcome outcome;
        if (previous == null) {
            outcome = table.isActive(current) ? TransitionOutcome.NOTIFY_INITIAL : TransitionOutcome.NO_OP;
        } else if (sameStatus(previous, current)) {
            outcome = TransitionOutcome.NO_OP;
        } else if (table.isTerminal(current)) {
            outcome = TransitionOutcome.NOTIFY_TERMINAL;
        } else if (table.isActive(previous) && table.isUpdate(current)) {
            outcome = TransitionOutcome.NOTIFY_UPDATE;
        } else {
            outcome = TransitionOutcome.NO_OP;
        }

        LOG.debug("Policy [{}]: {} -> {} => {}", table.getFamily(), previous, current, outcome);
        return outcome;
    }

    /**
     * Classify against a stored record.
     *
     * <p>
     * Same as {@link #classify(String, String)} on
     * {@link #previousStatusFor(EntityRecord)}, except that a notified record
     * already holding the current terminal status yields
     * {@code NOTIFY_TERMINAL} again: records are removed once the terminal
     * notification succeeds, so one still present means that send failed.
     * </p>
     *
     * @param record  stored record, may be {@code null}
     * @param current current status
     * @return the outcome
     */
    public TransitionOutcome classifyRecord(EntityRecord record, String current) {
        String previous = previousStatusFor(record);
        if (previous != null && table.isTerminal(current) && sameStatus(previous, current)) {
            LOG.debug("Policy [{}]: retrying terminal notification at '{}'", table.getFamily(), current);
            return TransitionOutcome.NOTIFY_TERMINAL;
        }
        return classify(previous, current);
    }

    /**
     * Classify the result of resolving a configured watch target.
     *
     * @param resolved      whether the target exists upstream
     * @param alreadyWarned whether an admin alert was already sent for it
     * @return {@code NOTIFY_ADMIN} for an unresolved, not yet warned target;
     *         {@code NO_OP} otherwise
     */
    public TransitionOutcome classifyScopeProbe(boolean resolved, boolean alreadyWarned) {
        return !resolved && !alreadyWarned ? TransitionOutcome.NOTIFY_ADMIN : TransitionOutcome.NO_OP;
    }

    /**
     * The status to feed into {@link #classify} for a stored record.
     *
     * <p>
     * A record whose initial notification never went out is treated as never
     * seen, so the initial notification is retried on the next pass.
     * </p>
     *
     * @param record stored record, may be {@code null}
     * @return previous status, or {@code null}
     */
    public static String previousStatusFor(EntityRecord record) {
        return record != null && record.isNotified() ? record.getStatus() : null;
    }

    public static boolean sameStatus(String a, String b) {
        return StatusTable.normalize(a).equals(StatusTable.normalize(b));
    }

    public boolean isTerminal(String status) {
        return table.isTerminal(status);
    }

    public String getFamily() {
        return table.getFamily();
    }
}
