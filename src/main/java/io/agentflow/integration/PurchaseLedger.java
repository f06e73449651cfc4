package io.agentflow.integration;

/**
 * Marketplace entitlement lookup.
 */
public interface PurchaseLedger {
    boolean hasActivePurchase(String userId, String agentId);
}
