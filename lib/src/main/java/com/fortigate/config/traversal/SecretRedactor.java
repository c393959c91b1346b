package com.fortigate.config.traversal;

import com.fortigate.config.tree.ConfigItem;
import com.fortigate.config.tree.SetNode;
import java.util.Objects;
import java.util.Set;

/**
 * Replaces the ciphertext of encrypted values ({@code set password ENC <ciphertext>}) with a
 * mask. Restricted to the given keys when a key set is supplied. Running it again over an
 * already redacted tree changes nothing.
 */
public final class SecretRedactor implements ConfigVisitor<Void> {
    public static final String DEFAULT_MASK = "*";

    private final String mask;
    private final Set<String> keys;
    private int redacted;

    /** Redacts every encrypted value. */
    public SecretRedactor() {
        this(DEFAULT_MASK, Set.of());
    }

    public SecretRedactor(String mask, Set<String> keys) {
        this.mask = Objects.requireNonNull(mask, "mask");
        this.keys = Set.copyOf(keys);
    }

    @Override
    public VisitResult visit(boolean enter, ConfigItem item, TraversalContext context, Void userData) {
        if (!enter || !(item.getNode() instanceof SetNode set)) {
            return VisitResult.CONTINUE;
        }
        if (!set.isEncrypted() || (!keys.isEmpty() && !keys.contains(item.getKey()))) {
            return VisitResult.CONTINUE;
        }
        for (int i = 1; i < set.size(); i++) {
            if (!mask.equals(set.getValue(i))) {
                set.setValue(i, mask);
                redacted++;
            }
        }
        return VisitResult.CONTINUE;
    }

    /** Number of tokens replaced so far. */
    public int getRedactedCount() {
        return redacted;
    }
}
