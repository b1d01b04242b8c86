package com.tempora.versioning.identity;

/**
 * Outcome of {@link HubRegistry#ensure} together with the identity as stored.
 *
 * @param outcome whether this call created the identity
 * @param identity the stored identity (the winner's row when another writer got there first)
 */
public record EnsureResult(EnsureOutcome outcome, Identity identity) {

    public static EnsureResult created(Identity identity) {
        return new EnsureResult(EnsureOutcome.CREATED, identity);
    }

    public static EnsureResult alreadyExists(Identity identity) {
        return new EnsureResult(EnsureOutcome.ALREADY_EXISTS, identity);
    }

    public boolean created() {
        return outcome == EnsureOutcome.CREATED;
    }
}
