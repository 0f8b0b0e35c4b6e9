package com.govsentinel.core.orchestrator;

/**
 * Counters for one reconciliation pass.
 *
 * @since 1.0.0
 */
public final class PassReport {

    private int entitiesSeen;
    private int notificationsSent;
    private int sendFailures;
    private int entityErrors;
    private int scopesFailed;
    private int scopesInvalid;
    private int rechecked;
    private boolean interrupted;

    void entitySeen() {
        entitiesSeen++;
    }

    void notificationSent() {
        notificationsSent++;
    }

    void sendFailed() {
        sendFailures++;
    }

    void entityError() {
        entityErrors++;
    }

    void scopeFailed() {
        scopesFailed++;
    }

    void scopeInvalid() {
        scopesInvalid++;
    }

    void recheckedEntity() {
        rechecked++;
    }

    void markInterrupted() {
        interrupted = true;
    }

    public int getEntitiesSeen() {
        return entitiesSeen;
    }

    public int getNotificationsSent() {
        return notificationsSent;
    }

    public int getSendFailures() {
        return sendFailures;
    }

    public int getEntityErrors() {
        return entityErrors;
    }

    public int getScopesFailed() {
        return scopesFailed;
    }

    public int getScopesInvalid() {
        return scopesInvalid;
    }

    public int getRechecked() {
        return rechecked;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    @Override
    public String toString() {
        return "PassReport{" +
                "entitiesSeen=" + entitiesSeen +
                ", notificationsSent=" + notificationsSent +
                ", sendFailures=" + sendFailures +
                ", entityErrors=" + entityErrors +
                ", scopesFailed=" + scopesFailed +
                ", scopesInvalid=" + scopesInvalid +
                ", rechecked=" + rechecked +
                '}';
    }
}
