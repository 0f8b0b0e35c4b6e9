/**
 * Runnable monitor service: environment configuration, the Slack notifier,
 * upstream fetchers, per-source supervision and the health endpoint.
 */
package com.govsentinel.service;
