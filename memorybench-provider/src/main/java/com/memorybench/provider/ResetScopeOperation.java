package com.memorybench.provider;

/** Optional {@code reset_scope} operation: removes every memory in a scope. */
public interface ResetScopeOperation extends ProviderAdapter {

    boolean resetScope(ScopeContext scope) throws Exception;
}
