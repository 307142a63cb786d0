/**
 * Rule and engine configuration.
 *
 * <p>
 * Rules are defined in YAML (native format, or Sigma via
 * {@link com.correlationsentinel.core.config.SigmaRuleParser}) and loaded by
 * {@link com.correlationsentinel.core.config.RulesLoader} into a
 * {@link com.correlationsentinel.core.config.RulesConfig}.
 * {@link com.correlationsentinel.core.config.RuleCompiler} turns each
 * definition into an executable rule and reports every problem at once.
 * Engine tuning lives in {@link com.correlationsentinel.core.config.EngineConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.config;
