/**
 * Notification composition and delivery.
 *
 * <p>
 * {@link com.govsentinel.core.dispatch.AlertDispatcher} is the only writer of
 * notification outcomes to the entity store.
 * </p>
 *
 * @since 1.0.0
 */
package com.govsentinel.core.dispatch;
