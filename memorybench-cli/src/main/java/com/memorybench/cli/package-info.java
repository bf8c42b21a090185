/**
 * picocli entry point: {@code memorybench list providers [--json] [--base-dir DIR]}.
 */
package com.memorybench.cli;
