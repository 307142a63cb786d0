package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.config.RuleDefinition;

import java.util.List;

/**
 * Persistence hook for rule definitions: read once at start, written once at
 * shutdown.
 *
 * @since 1.0.0
 */
public interface RuleStore {

    /**
     * @return every stored definition
     * @throws RuntimeException if the store cannot be read; fatal at engine start
     */
    List<RuleDefinition> load();

    /**
     * @param definitions the registry's current definitions
     */
    void save(List<RuleDefinition> definitions);
}
