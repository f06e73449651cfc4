/**
 * Execution side of the engine: per-organization runtimes with tier limits, containers, the
 * isolation tiers, the dispatcher that drains the queue, and the completion waiter.
 *
 * <p>Queue items are executed at least once. A worker that dies between claim and completion
 * leaves the item {@code executing}; nothing in this package reclaims it.
 */
package io.agentflow.runtime;
