package com.govsentinel.core.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.config.ConfigurationException;
import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.fakes.RecordingNotifier;
import com.govsentinel.core.model.DispatchResult;
import com.govsentinel.core.model.EntityKey;
import com.govsentinel.core.model.EntityRecord;
import com.govsentinel.core.model.Notification;
import com.govsentinel.core.model.SendResult;
import com.govsentinel.core.model.TransitionOutcome;
import com.govsentinel.core.model.WatchedEntity;
import com.govsentinel.core.ratelimit.TimeLimiter;
import com.govsentinel.core.store.AdminAlertRegistry;
import com.govsentinel.core.store.JsonFileEntityStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertDispatcher}.
 */
class AlertDispatcherTest {

    private static final ScopeDefinition AAVE =
            new ScopeDefinition("aave.eth", "Aave", "https://snapshot.org/#/aave.eth", "app");
    private static final EntityKey KEY = EntityKey.of("aave.eth", "0xabc");

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TimeLimiter timeLimiter = new TimeLimiter("test-send");
    private JsonFileEntityStore store;
    private AdminAlertRegistry adminAlerts;
    private RecordingNotifier notifier;
    private AlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        store = new JsonFileEntityStore(dir.resolve("snapshot_state.json"), mapper);
        adminAlerts = new AdminAlertRegistry(dir.resolve("snapshot_admin_alerts.json"), mapper);
        notifier = new RecordingNotifier();
        dispatcher = dispatcherWith(notifier, ChannelRouter.single("C-APP"), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        timeLimiter.close();
    }

    // ------------------------------------------------------------------
    // Initial
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should store the anchor and mark notified after a successful initial send")
    void shouldRecordSuccessfulInitial() {
        DispatchResult result = dispatcher.dispatch(AAVE, entity("active"), null, TransitionOutcome.NOTIFY_INITIAL);

        assertThat(result.isSent()).isTrue();
        assertThat(store.get(KEY)).contains(new EntityRecord("active", "T1", true));
        Notification sent = notifier.last();
        assertThat(sent.getAnchorHint()).isEmpty();
        assertThat(sent.getChannel()).contains("C-APP");
        assertThat(sent.getTitle()).isEqualTo("Aave Proposal Active");
    }

    @Test
    @DisplayName("Should store an unnotified record after a failed initial send")
    void shouldRecordFailedInitial() {
        notifier.failNext(1);

        DispatchResult result = dispatcher.dispatch(AAVE, entity("active"), null, TransitionOutcome.NOTIFY_INITIAL);

        assertThat(result.isSent()).isFalse();
        assertThat(store.get(KEY)).contains(EntityRecord.unnotified("active"));
    }

    @Test
    @DisplayName("Should treat a throwing notifier as a failed send")
    void shouldTreatExceptionAsFailure() {
        notifier.throwOnSend(new IllegalStateException("connection reset"));

        DispatchResult result = dispatcher.dispatch(AAVE, entity("active"), null, TransitionOutcome.NOTIFY_INITIAL);

        assertThat(result.isSent()).isFalse();
        assertThat(store.get(KEY).map(EntityRecord::isNotified)).contains(false);
    }

    @Test
    @DisplayName("Should treat a send that overruns its timeout as failed")
    void shouldTreatTimeoutAsFailure() {
        Notifier slow = n -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return SendResult.delivered("late");
        };
        AlertDispatcher impatient = dispatcherWith(slow, ChannelRouter.single("C-APP"), Duration.ofMillis(50));

        DispatchResult result = impatient.dispatch(AAVE, entity("active"), null, TransitionOutcome.NOTIFY_INITIAL);

        assertThat(result.isSent()).isFalse();
        assertThat(store.get(KEY)).contains(EntityRecord.unnotified("active"));
    }

    // ------------------------------------------------------------------
    // Follow-ups
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should reply in thread and keep the anchor after an update")
    void shouldThreadUpdate() {
        EntityRecord record = store.upsert(KEY, "active", "T1", true);

        DispatchResult result = dispatcher.dispatch(AAVE, entity("extended"), record, TransitionOutcome.NOTIFY_UPDATE);

        assertThat(result.isSent()).isTrue();
        assertThat(notifier.last().getAnchorHint()).contains("T1");
        assertThat(notifier.last().getTitle()).isEqualTo("Aave Proposal Update");
        assertThat(store.get(KEY)).contains(new EntityRecord("extended", "T1", true));
    }

    @Test
    @DisplayName("Should remove the record after a successful terminal send")
    void shouldRemoveAfterTerminal() {
        EntityRecord record = store.upsert(KEY, "active", "T1", true);

        DispatchResult result = dispatcher.dispatch(AAVE, entity("closed"), record, TransitionOutcome.NOTIFY_TERMINAL);

        assertThat(result.isSent()).isTrue();
        assertThat(result.getRecord()).isEmpty();
        assertThat(store.get(KEY)).isEmpty();
        assertThat(notifier.last().getAnchorHint()).contains("T1");
        assertThat(notifier.last().getActionText()).contains("View Results");
    }

    @Test
    @DisplayName("Should keep anchor and notified flag when a follow-up fails")
    void shouldPreserveThreadOnFailedFollowUp() {
        EntityRecord record = store.upsert(KEY, "active", "T1", true);
        notifier.failNext(1);

        DispatchResult result = dispatcher.dispatch(AAVE, entity("closed"), record, TransitionOutcome.NOTIFY_TERMINAL);

        assertThat(result.isSent()).isFalse();
        assertThat(store.get(KEY)).contains(new EntityRecord("closed", "T1", true));
    }

    @Test
    @DisplayName("Should send standalone with a warning when the anchor is missing")
    void shouldWarnWhenAnchorMissing() {
        EntityRecord record = store.upsert(KEY, "active", null, true);

        dispatcher.dispatch(AAVE, entity("closed"), record, TransitionOutcome.NOTIFY_TERMINAL);

        Notification sent = notifier.last();
        assertThat(sent.getAnchorHint()).isEmpty();
        assertThat(sent.getBody()).startsWith(AlertDispatcher.MISSING_CONTEXT_PREFIX).endsWith("Raise the supply cap");
    }

    // ------------------------------------------------------------------
    // NoOp
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should persist a status delta without sending")
    void shouldTrackStatusDeltaSilently() {
        EntityRecord record = store.upsert(KEY, "active", "T1", true);

        DispatchResult result = dispatcher.dispatch(AAVE, entity("pending"), record, TransitionOutcome.NO_OP);

        assertThat(result.isSent()).isFalse();
        assertThat(notifier.attempts()).isEmpty();
        assertThat(store.get(KEY)).contains(new EntityRecord("pending", "T1", true));
    }

    @Test
    @DisplayName("Should start tracking a first sighting in a non-active status")
    void shouldTrackFirstSightingSilently() {
        dispatcher.dispatch(AAVE, entity("pending"), null, TransitionOutcome.NO_OP);

        assertThat(store.get(KEY)).contains(EntityRecord.unnotified("pending"));
        assertThat(notifier.attempts()).isEmpty();
    }

    @Test
    @DisplayName("Should reject admin outcomes on the entity path")
    void shouldRejectAdminOutcome() {
        assertThatThrownBy(() -> dispatcher.dispatch(AAVE, entity("active"), null, TransitionOutcome.NOTIFY_ADMIN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Admin and routing
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should send an admin alert once per identifier")
    void shouldSendAdminAlertOnce() {
        assertThat(dispatcher.dispatchAdmin(AAVE)).isTrue();
        assertThat(dispatcher.dispatchAdmin(AAVE)).isFalse();

        assertThat(notifier.delivered()).hasSize(1);
        assertThat(notifier.last().getKind()).isEqualTo(TransitionOutcome.NOTIFY_ADMIN);
        assertThat(adminAlerts.isWarned("aave.eth")).isTrue();
    }

    @Test
    @DisplayName("Should not mark a scope warned when the admin alert fails")
    void shouldRetryFailedAdminAlert() {
        notifier.failNext(1);

        assertThat(dispatcher.dispatchAdmin(AAVE)).isFalse();
        assertThat(adminAlerts.isWarned("aave.eth")).isFalse();
        assertThat(dispatcher.dispatchAdmin(AAVE)).isTrue();
    }

    @Test
    @DisplayName("Should route every message to the test channel in test mode")
    void shouldRouteToTestChannel() {
        ChannelRouter testRouter = new ChannelRouter(Map.of("app", "C-APP", "net", "C-NET"), true, "C-TEST");
        AlertDispatcher testDispatcher = dispatcherWith(notifier, testRouter, Duration.ofSeconds(5));

        testDispatcher.dispatch(AAVE, entity("active"), null, TransitionOutcome.NOTIFY_INITIAL);

        assertThat(notifier.last().getChannel()).contains("C-TEST");
    }

    @Test
    @DisplayName("Should fail routing verification for a label without a channel")
    void shouldFailUnroutableScope() {
        ChannelRouter appOnly = new ChannelRouter(Map.of("app", "C-APP"), false, null);
        AlertDispatcher appDispatcher = dispatcherWith(notifier, appOnly, Duration.ofSeconds(5));
        ScopeDefinition net = new ScopeDefinition("cosmoshub", "Cosmos Hub", null, "net");

        assertThatThrownBy(() -> appDispatcher.verifyRouting(List.of(AAVE, net)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'net'");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertDispatcher dispatcherWith(Notifier n, ChannelRouter router, Duration sendTimeout) {
        return AlertDispatcher.builder()
                .source("snapshot")
                .store(store)
                .adminAlerts(adminAlerts)
                .notifier(n)
                .router(router)
                .timeLimiter(timeLimiter)
                .sendTimeout(sendTimeout)
                .build();
    }

    private static WatchedEntity entity(String status) {
        return WatchedEntity.builder()
                .id("0xabc")
                .status(status)
                .title("Raise the supply cap")
                .build();
    }
}
