package io.agentflow.integration;

import io.agentflow.model.SubscriptionTier;

/**
 * Maps owners to organizations and organizations to their subscription tier.
 */
public interface TenantDirectory {
    String organizationOf(String ownerId);

    SubscriptionTier subscriptionTier(String organizationId);
}
