/**
 * Core domain snapshots and capability interfaces.
 *
 * <p>Contains the types the planner exchanges with its callers:
 * <ul>
 *   <li>GraphDataAccess - Knowledge-graph capability, with a declared-absent variant</li>
 *   <li>VectorSearch - Similarity search used for topic expansion</li>
 *   <li>EntitySnapshot - Read-only entity features</li>
 *   <li>ExecutionResult - Results reported back by the executor</li>
 * </ul>
 *
 * <p>Nothing in this package depends on Spring.
 *
 * @since 1.0.0
 */
package com.purchasingpower.retrievalplanner.core;
