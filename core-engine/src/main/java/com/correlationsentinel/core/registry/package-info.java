/**
 * Rule CRUD with copy-on-write publication of immutable
 * {@link com.correlationsentinel.core.registry.RuleSnapshot}s, plus per-rule
 * health tracking.
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.registry;
