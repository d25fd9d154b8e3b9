/*
 * Copyright 2014 Higher Frequency Trading
 *
 *       https://chronicle.software
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.openhft.jitcache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static net.openhft.jitcache.JitUtils.DEBUGGING;
import static net.openhft.jitcache.JitUtils.millisSince;

/**
 * Caches the output of a {@link FunctionCompiler}, one entry per {@link Signature}.
 * <p>
 * Since the compiled code is specialized for static shapes and constant values, each new combination of
 * argument shapes and constants is compiled once and reused by every later call with the same
 * combination. Failed compilations are cached too and are never retried.
 * <p>
 * The map of entries is guarded by its own lock, held only to look up or insert an entry. Each entry has
 * its own lock, held while it is compiled, so that concurrent callers of the same signature wait for one
 * compilation while callers of other signatures proceed in parallel.
 * <p>
 * There is no eviction: the cache grows for as long as it is in use.
 */
public class CompilationCache {
    private static final Logger LOG = LoggerFactory.getLogger(CompilationCache.class);

    @NotNull
    private final FunctionCompiler compiler;
    @NotNull
    private final CompileOptions options;

    // guarded by itself; insertion ordered for debugString()
    private final Map<Signature, Entry> cache = new LinkedHashMap<>();

    private final AtomicLong compileCount = new AtomicLong();
    private final AtomicLong cumulativeCompileMillis = new AtomicLong();

    /**
     * Delegates to {@link #CompilationCache(FunctionCompiler, CompileOptions)} with {@link CompileOptions#DEFAULT}.
     */
    public CompilationCache(@NotNull FunctionCompiler compiler) {
        this(compiler, CompileOptions.DEFAULT);
    }

    /**
     * @param compiler the compiler to memoize
     * @param options  passed to the compiler with every request
     */
    public CompilationCache(@NotNull FunctionCompiler compiler, @NotNull CompileOptions options) {
        this.compiler = compiler;
        this.options = options;
    }

    /**
     * Delegates to {@link #compile(FunctionDescriptor, int, List, ArgumentContext, boolean)} without building an
     * executable.
     */
    @NotNull
    public CompilationResult compile(@NotNull FunctionDescriptor function,
                                     int numConstantArgs,
                                     @NotNull List<OptionalTensor> variableArgs,
                                     @NotNull ArgumentContext ctx) throws CompilationException {
        return compile(function, numConstantArgs, variableArgs, ctx, false).result();
    }

    /**
     * Gets a previously compiled function, or compiles it for the argument types, shapes and constant values
     * of this call.
     *
     * @param function        the function to compile
     * @param numConstantArgs how many leading inputs of {@code ctx} are compile-time constants
     * @param variableArgs    snapshot of the current values of the resource variable arguments; uninitialized
     *                        variables are absent
     * @param ctx             the inputs of the call
     * @param buildExecutable whether to also build, or reuse, an executable for the result
     * @return the cached result, with an executable if requested and the computation has non-constant outputs
     * @throws CompilationException if the signature cannot be built, the function failed to compile for this
     *                              signature (now or on an earlier call), or the requested executable failed to build
     */
    @NotNull
    public CompiledFunction compile(@NotNull FunctionDescriptor function,
                                    int numConstantArgs,
                                    @NotNull List<OptionalTensor> variableArgs,
                                    @NotNull ArgumentContext ctx,
                                    boolean buildExecutable) throws CompilationException {
        Signature signature = SignatureBuilder.buildSignature(function, numConstantArgs, variableArgs, ctx);
        if (DEBUGGING)
            LOG.info("Signature: {}", signature.debugString());
        else
            LOG.debug("Signature: {}", signature.debugString());

        Entry entry;
        synchronized (cache) {
            entry = cache.get(signature);
            if (entry == null) {
                cache.put(signature, entry = new Entry(signature));
                LOG.debug("Compilation cache miss, {} signatures cached", cache.size());
            }
        }

        synchronized (entry) {
            if (!entry.compiled)
                compileEntry(entry, function, numConstantArgs, variableArgs, ctx);
            entry.compilationStatus.throwIfError();

            Executable executable = null;
            if (buildExecutable) {
                if (!entry.executableBuilt)
                    buildExecutable(entry);
                entry.executableStatus.throwIfError();
                executable = entry.executable;
            }
            return new CompiledFunction(entry.signature, entry.compilationResult, executable);
        }
    }

    // called holding the entry's lock
    private void compileEntry(Entry entry,
                              FunctionDescriptor function,
                              int numConstantArgs,
                              List<OptionalTensor> variableArgs,
                              ArgumentContext ctx) {
        entry.compiled = true;
        entry.compilationStatus = CompilationStatus.internal("Compilation of " + entry.signature + " did not complete", null);
        long start = System.nanoTime();
        try {
            List<Argument> args = SignatureBuilder.buildArguments(numConstantArgs, variableArgs, ctx);
            CompilationResult result = compiler.compileFunction(new CompilationRequest(function, entry.signature, args, options));
            if (result == null)
                throw new IllegalStateException(compiler.getClass().getName() + " returned no result");
            entry.compilationResult = result;
            entry.compilationStatus = CompilationStatus.OK;
        } catch (CompilationException e) {
            entry.compilationStatus = e.status();
        } catch (RuntimeException e) {
            entry.compilationStatus = CompilationStatus.internal("Compiler failed for " + entry.signature + ": " + e, e);
        }

        long millis = millisSince(start);
        long count = compileCount.incrementAndGet();
        long total = cumulativeCompileMillis.addAndGet(millis);
        if (entry.compilationStatus.isOk())
            LOG.info("Compiled {} in {} ms, {} compilations taking {} ms in total", entry.signature.name(), millis, count, total);
        else
            LOG.warn("Compilation of {} failed, {}", entry.signature.debugString(), entry.compilationStatus, entry.compilationStatus.cause());
    }

    // called holding the entry's lock, after a successful compilation
    private void buildExecutable(Entry entry) {
        entry.executableBuilt = true;
        CompilationResult result = entry.compilationResult;
        if (!result.isBuildable()) {
            LOG.debug("No executable needed for {}, all outputs are constant", entry.signature.name());
            entry.executableStatus = CompilationStatus.OK;
            return;
        }
        entry.executableStatus = CompilationStatus.internal("Building the executable for " + entry.signature + " did not complete", null);
        try {
            entry.executable = compiler.buildExecutable(result);
            entry.executableStatus = CompilationStatus.OK;
        } catch (CompilationException e) {
            entry.executableStatus = e.status();
        } catch (RuntimeException e) {
            entry.executableStatus = CompilationStatus.internal("Building the executable for " + entry.signature + " failed: " + e, e);
        }
        if (!entry.executableStatus.isOk())
            LOG.warn("Building the executable for {} failed, {}", entry.signature.debugString(), entry.executableStatus, entry.executableStatus.cause());
    }

    @NotNull
    public FunctionCompiler compiler() {
        return compiler;
    }

    @NotNull
    public CompileOptions options() {
        return options;
    }

    /**
     * @return the number of signatures cached, including those which failed to compile
     */
    public int size() {
        synchronized (cache) {
            return cache.size();
        }
    }

    /**
     * @return how many times the compiler has been invoked
     */
    public long compileCount() {
        return compileCount.get();
    }

    /**
     * Lists every cached signature, in the order they were first requested. For diagnostics only.
     */
    @NotNull
    public String debugString() {
        List<Signature> signatures;
        synchronized (cache) {
            signatures = new ArrayList<>(cache.keySet());
        }
        StringBuilder sb = new StringBuilder("JIT compilation cache with ")
                .append(signatures.size()).append(" signatures");
        for (Signature signature : signatures)
            sb.append("\n  ").append(signature.debugString());
        return sb.toString();
    }

    @Override
    public String toString() {
        return "CompilationCache{compiler=" + compiler + ", options=" + options + ", size=" + size() + '}';
    }

    /**
     * The value for one signature. All fields other than the signature are guarded by the entry itself.
     */
    private static final class Entry {
        @NotNull
        final Signature signature;

        // Has compilation been attempted?
        boolean compiled;
        CompilationStatus compilationStatus;
        CompilationResult compilationResult;

        // Has an executable been requested since a successful compilation?
        boolean executableBuilt;
        CompilationStatus executableStatus;
        @Nullable
        Executable executable;

        Entry(@NotNull Signature signature) {
            this.signature = signature;
        }
    }
}
