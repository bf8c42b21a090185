package com.memorybench.provider;

import com.memorybench.capability.ProviderCapabilities;

/** Optional {@code get_capabilities} operation. The result should agree with the manifest. */
public interface GetCapabilitiesOperation extends ProviderAdapter {

    ProviderCapabilities getCapabilities() throws Exception;
}
