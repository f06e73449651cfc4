package io.agentflow.integration;

import io.agentflow.model.SubscriptionTier;
import io.agentflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owner-to-organization mapping held in memory. An owner without a mapping is its own
 * single-member organization; an organization without a tier gets {@link SubscriptionTier#UNKNOWN}.
 */
public final class StaticTenantDirectory implements TenantDirectory {
    private final Map<String, String> organizationByOwner = new ConcurrentHashMap<>();
    private final Map<String, SubscriptionTier> tierByOrganization = new ConcurrentHashMap<>();

    /**
     * Loads {@code agents/tenants.json}: {@code {"members":{"user":"org"},"tiers":{"org":"pro"}}}.
     */
    public static StaticTenantDirectory fromFile(Path file) {
        StaticTenantDirectory directory = new StaticTenantDirectory();
        if (file == null || !Files.exists(file)) {
            return directory;
        }
        try {
            TenantsFile parsed = Jsons.mapper().readValue(file.toFile(), TenantsFile.class);
            if (parsed != null && parsed.members() != null) {
                parsed.members().forEach(directory::assign);
            }
            if (parsed != null && parsed.tiers() != null) {
                parsed.tiers().forEach((org, tier) -> directory.setTier(org, SubscriptionTier.fromString(tier)));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to load tenants: " + file, e);
        }
        return directory;
    }

    public StaticTenantDirectory assign(String ownerId, String organizationId) {
        organizationByOwner.put(ownerId, organizationId);
        return this;
    }

    public StaticTenantDirectory setTier(String organizationId, SubscriptionTier tier) {
        tierByOrganization.put(organizationId, tier);
        return this;
    }

    @Override
    public String organizationOf(String ownerId) {
        return organizationByOwner.getOrDefault(ownerId, ownerId);
    }

    @Override
    public SubscriptionTier subscriptionTier(String organizationId) {
        return tierByOrganization.getOrDefault(organizationId, SubscriptionTier.UNKNOWN);
    }

    public record TenantsFile(Map<String, String> members, Map<String, String> tiers) {
    }
}
