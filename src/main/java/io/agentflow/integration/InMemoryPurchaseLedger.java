package io.agentflow.integration;

import io.agentflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryPurchaseLedger implements PurchaseLedger {
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    /**
     * Loads {@code agents/purchases.json}: {@code {"purchases":[{"userId":"..","agentId":".."}]}}.
     */
    public static InMemoryPurchaseLedger fromFile(Path file) {
        InMemoryPurchaseLedger ledger = new InMemoryPurchaseLedger();
        if (file == null || !Files.exists(file)) {
            return ledger;
        }
        try {
            PurchasesFile parsed = Jsons.mapper().readValue(file.toFile(), PurchasesFile.class);
            if (parsed != null && parsed.purchases() != null) {
                for (Purchase p : parsed.purchases()) {
                    if (p != null && p.userId() != null && p.agentId() != null && (p.active() == null || p.active())) {
                        ledger.grant(p.userId(), p.agentId());
                    }
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to load purchases: " + file, e);
        }
        return ledger;
    }

    public void grant(String userId, String agentId) {
        active.add(key(userId, agentId));
    }

    public void revoke(String userId, String agentId) {
        active.remove(key(userId, agentId));
    }

    @Override
    public boolean hasActivePurchase(String userId, String agentId) {
        return active.contains(key(userId, agentId));
    }

    private static String key(String userId, String agentId) {
        return userId + "\u0000" + agentId;
    }

    public record PurchasesFile(List<Purchase> purchases) {
    }

    public record Purchase(String userId, String agentId, Boolean active) {
    }
}
