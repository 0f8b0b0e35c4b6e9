/**
 * Domain model classes for Gov Sentinel.
 *
 * <ul>
 * <li>{@link com.govsentinel.core.model.WatchedEntity}: entity as fetched on
 * the current pass</li>
 * <li>{@link com.govsentinel.core.model.EntityRecord}: persisted last-known
 * state</li>
 * <li>{@link com.govsentinel.core.model.TransitionOutcome}: classification of
 * a status change</li>
 * <li>{@link com.govsentinel.core.model.Notification}: payload handed to the
 * notifier</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.govsentinel.core.model;
