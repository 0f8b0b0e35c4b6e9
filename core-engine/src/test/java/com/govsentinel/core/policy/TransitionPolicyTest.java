package com.govsentinel.core.policy;

import com.govsentinel.core.model.EntityRecord;
import com.govsentinel.core.model.TransitionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Transition table tests for {@link TransitionPolicy}.
 */
class TransitionPolicyTest {

    private final TransitionPolicy tally = new TransitionPolicy(new StatusTable("tally",
            List.of("active"), List.of("extended"), List.of("executed", "defeated", "canceled")));

    private final TransitionPolicy cosmos = new TransitionPolicy(new StatusTable("cosmos",
            List.of("PROPOSAL_STATUS_VOTING_PERIOD"), List.of(),
            List.of("PROPOSAL_STATUS_PASSED", "PROPOSAL_STATUS_REJECTED")));

    @ParameterizedTest(name = "{0} -> {1} => {2}")
    @CsvSource({
            ", active, NOTIFY_INITIAL",
            ", extended, NO_OP",
            ", executed, NO_OP",
            ", pending, NO_OP",
            "active, active, NO_OP",
            "active, extended, NOTIFY_UPDATE",
            "active, executed, NOTIFY_TERMINAL",
            "active, pending, NO_OP",
            "extended, extended, NO_OP",
            "extended, active, NO_OP",
            "extended, defeated, NOTIFY_TERMINAL",
            "pending, active, NO_OP",
            "pending, extended, NO_OP",
            "pending, canceled, NOTIFY_TERMINAL",
            "executed, executed, NO_OP",
            "executed, active, NO_OP",
            "ACTIVE, Extended, NOTIFY_UPDATE",
            "Active, ACTIVE, NO_OP"
    })
    @DisplayName("Should classify every transition of the status table")
    void shouldClassifyTransitionTable(String previous, String current, TransitionOutcome expected) {
        assertThat(tally.classify(previous, current)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should match upper-case chain statuses")
    void shouldMatchChainStatuses() {
        assertThat(cosmos.classify(null, "PROPOSAL_STATUS_VOTING_PERIOD"))
                .isEqualTo(TransitionOutcome.NOTIFY_INITIAL);
        assertThat(cosmos.classify("PROPOSAL_STATUS_VOTING_PERIOD", "PROPOSAL_STATUS_PASSED"))
                .isEqualTo(TransitionOutcome.NOTIFY_TERMINAL);
    }

    @Test
    @DisplayName("Should treat a record whose initial send failed as never seen")
    void shouldRetryUnnotifiedRecord() {
        EntityRecord failedInitial = EntityRecord.unnotified("active");

        assertThat(tally.classifyRecord(failedInitial, "active")).isEqualTo(TransitionOutcome.NOTIFY_INITIAL);
        assertThat(tally.classifyRecord(null, "active")).isEqualTo(TransitionOutcome.NOTIFY_INITIAL);
    }

    @Test
    @DisplayName("Should keep a silently tracked record silent when it ends")
    void shouldKeepSilentRecordSilent() {
        EntityRecord silent = EntityRecord.unnotified("pending");

        assertThat(tally.classifyRecord(silent, "executed")).isEqualTo(TransitionOutcome.NO_OP);
    }

    @Test
    @DisplayName("Should retry a terminal notification for a notified record still at that status")
    void shouldRetryPendingTerminal() {
        EntityRecord pendingTerminal = new EntityRecord("executed", "T1", true);

        assertThat(tally.classifyRecord(pendingTerminal, "executed")).isEqualTo(TransitionOutcome.NOTIFY_TERMINAL);
    }

    @Test
    @DisplayName("Should not repeat an initial notification for a notified record")
    void shouldNotRepeatInitial() {
        EntityRecord notified = new EntityRecord("active", "T1", true);

        assertThat(tally.classifyRecord(notified, "active")).isEqualTo(TransitionOutcome.NO_OP);
    }

    @ParameterizedTest(name = "resolved={0}, warned={1} => {2}")
    @CsvSource({
            "false, false, NOTIFY_ADMIN",
            "false, true, NO_OP",
            "true, false, NO_OP",
            "true, true, NO_OP"
    })
    @DisplayName("Should raise an admin alert only for an unresolved, unwarned scope")
    void shouldClassifyScopeProbe(boolean resolved, boolean warned, TransitionOutcome expected) {
        assertThat(tally.classifyScopeProbe(resolved, warned)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should reject a table listing a status in two sets")
    void shouldRejectOverlappingSets() {
        StatusTable overlapping = new StatusTable("broken", List.of("active"), List.of(), List.of("ACTIVE"));

        assertThatThrownBy(() -> new TransitionPolicy(overlapping))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("more than one set");
    }

    @Test
    @DisplayName("Should reject a table without active or terminal statuses")
    void shouldRejectIncompleteTable() {
        StatusTable incomplete = new StatusTable("broken", List.of(), List.of(), List.of());

        assertThatThrownBy(() -> new TransitionPolicy(incomplete))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'active'")
                .hasMessageContaining("'terminal'");
    }
}
