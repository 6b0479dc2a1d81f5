package com.nchat.connectors.registry;

import com.nchat.connectors.core.Connector;

/**
 * Creates a fresh provider adapter for each installation.
 */
@FunctionalInterface
public interface ConnectorFactory {

    Connector create();
}
