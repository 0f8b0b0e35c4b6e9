/**
 * Status-transition classification.
 *
 * <p>
 * A {@link com.govsentinel.core.policy.TransitionPolicy} is a pure function
 * over a {@link com.govsentinel.core.policy.StatusTable}; tables are loaded
 * from YAML and resolved by family through
 * {@link com.govsentinel.core.policy.TransitionPolicyFactory}.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To watch a new platform, add its status table to {@code policies.yml}.
 * </p>
 *
 * @since 1.0.0
 */
package com.govsentinel.core.policy;
