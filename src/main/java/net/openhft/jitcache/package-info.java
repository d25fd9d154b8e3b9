/**
 * Provides a cache for ahead-of-time compiled functions.
 * The compiled code is specialized for the static shapes of its arguments and the values of its
 * compile-time constants, so {@link net.openhft.jitcache.CompilationCache} keys each compilation on a
 * {@link net.openhft.jitcache.Signature} of those inputs and compiles every signature at most once.
 *
 * <p>The compiler itself sits behind {@link net.openhft.jitcache.FunctionCompiler}, and the runtime
 * supplies argument types, shapes and values through {@link net.openhft.jitcache.ArgumentContext}.</p>
 */
package net.openhft.jitcache;
