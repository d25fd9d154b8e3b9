package net.openhft.jitcache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class CompilationCacheConcurrencyTest {
    private static final int THREADS = 8;
    private static final List<OptionalTensor> NO_VARIABLES = Collections.emptyList();

    private FakeFunctionCompiler compiler;
    private CompilationCache cache;
    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        compiler = new FakeFunctionCompiler();
        cache = new CompilationCache(compiler);
        executor = Executors.newFixedThreadPool(THREADS + 1);
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }

    private Future<CompiledFunction> submit(String function, long... dims) {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder()
                .addUnavailable(DataType.FLOAT32, TensorShape.of(dims))
                .build();
        return executor.submit(() -> cache.compile(new FunctionDescriptor(function), 0, NO_VARIABLES, ctx, true));
    }

    @Test
    public void concurrentCallersShareOneCompilation() throws Exception {
        CountDownLatch gate = compiler.gate("f");
        List<Future<CompiledFunction>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++)
            futures.add(submit("f", 2, 2));

        assertTrue(compiler.awaitCompilesStarted(1, 5000));
        // give the other callers time to pile up on the entry
        Thread.sleep(100);
        for (Future<CompiledFunction> future : futures)
            assertFalse(future.isDone(), "No caller may return before the compilation finishes");
        gate.countDown();

        CompiledFunction first = futures.get(0).get(10, TimeUnit.SECONDS);
        for (Future<CompiledFunction> future : futures) {
            CompiledFunction compiled = future.get(10, TimeUnit.SECONDS);
            assertSame(first.result(), compiled.result());
            assertSame(first.executable(), compiled.executable());
        }
        assertEquals(1, compiler.compileCalls.get());
        assertEquals(1, compiler.buildCalls.get());
        assertEquals(1, cache.size());
    }

    @Test
    public void concurrentCallersShareOneFailure() throws Exception {
        CompilationStatus failure = CompilationStatus.invalidArgument("shape [2,2] not supported");
        compiler.compileFailure = failure;
        CountDownLatch gate = compiler.gate("f");
        List<Future<CompiledFunction>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++)
            futures.add(submit("f", 2, 2));

        assertTrue(compiler.awaitCompilesStarted(1, 5000));
        gate.countDown();

        for (Future<CompiledFunction> future : futures) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            CompilationException cause = assertInstanceOf(CompilationException.class, e.getCause());
            assertSame(failure, cause.status());
        }
        assertEquals(1, compiler.compileCalls.get());
    }

    @Test
    public void slowCompilationDoesNotBlockOtherSignatures() throws Exception {
        CountDownLatch gate = compiler.gate("slow");
        Future<CompiledFunction> slow = submit("slow", 2, 2);
        assertTrue(compiler.awaitCompilesStarted(1, 5000));

        // same function, other shape, and another function, both while "slow" is still compiling
        CompiledFunction fast = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> submit("fast", 2, 2).get());
        CompiledFunction otherShape = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> submit("fast", 3, 3).get());
        assertNotNull(fast.result());
        assertNotNull(otherShape.result());
        assertFalse(slow.isDone());
        assertTrue(cache.debugString().contains("slow[],float32[2,2]"));

        gate.countDown();
        assertNotNull(slow.get(10, TimeUnit.SECONDS).result());
        assertEquals(3, compiler.compileCalls.get());
    }

    @Test
    public void waitingCallerBlocksUntilResultIsReady() throws Exception {
        CountDownLatch gate = compiler.gate("f");
        Future<CompiledFunction> winner = submit("f", 4);
        assertTrue(compiler.awaitCompilesStarted(1, 5000));
        Future<CompiledFunction> waiter = submit("f", 4);

        assertThrows(TimeoutException.class, () -> waiter.get(200, TimeUnit.MILLISECONDS));

        gate.countDown();
        assertSame(winner.get(10, TimeUnit.SECONDS).result(), waiter.get(10, TimeUnit.SECONDS).result());
        assertEquals(1, compiler.compileCalls.get());
    }
}
