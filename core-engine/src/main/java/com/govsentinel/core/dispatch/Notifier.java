package com.govsentinel.core.dispatch;

import com.govsentinel.core.model.Notification;
import com.govsentinel.core.model.SendResult;

/**
 * Outbound message transport.
 *
 * <p>
 * When {@link Notification#getAnchorHint()} is present the message is posted
 * as a threaded follow-up to that anchor. Implementations report transport
 * failures as {@link SendResult#failed()}; they may also throw, which the
 * dispatcher treats the same way.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Notifier {

    SendResult send(Notification notification);
}
