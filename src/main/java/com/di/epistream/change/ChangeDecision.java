package com.di.epistream.change;

/**
 * @param previousHash hash currently stored for the key, null for {@link ChangeType#NEW}
 */
public record ChangeDecision(ChangeType type, String newHash, String previousHash) {

    public boolean requiresWrite() {
        return type != ChangeType.UNCHANGED;
    }
}
