package net.spookly.dimensions.orchestrator;

/**
 * A listen server to create during the current reload pass.
 *
 * @param listenPort    port to bind
 * @param topologyIndex position of the entry in the new configuration's server list
 */
record ReloadTicket(int listenPort, int topologyIndex) {
}
