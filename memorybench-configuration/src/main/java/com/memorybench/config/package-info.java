/**
 * Environment-driven settings for provider discovery: {@link com.memorybench.config.MemoryBenchConfig}.
 */
package com.memorybench.config;
