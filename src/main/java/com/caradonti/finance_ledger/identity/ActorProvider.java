package com.caradonti.finance_ledger.identity;

/**
 * Source of the acting user. Authentication itself happens upstream.
 */
public interface ActorProvider {

    Actor currentActor();
}
