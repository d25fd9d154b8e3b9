package net.openhft.jitcache;

import junit.framework.TestCase;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static net.openhft.jitcache.SignatureBuilder.buildArguments;
import static net.openhft.jitcache.SignatureBuilder.buildSignature;

public class SignatureBuilderTest extends TestCase {
    private static final FunctionDescriptor F = new FunctionDescriptor("f");
    private static final List<OptionalTensor> NO_VARIABLES = Collections.emptyList();

    public void testConstantsThenParameters() throws CompilationException {
        SimpleArgumentContext ctx = SimpleArgumentContext.of(
                Tensor.scalar(5),
                Tensor.ofFloats(TensorShape.of(2, 2), 1f, 2f, 3f, 4f),
                Tensor.ofLongs(TensorShape.of(3), 1L, 2L, 3L));

        Signature sig = buildSignature(F, 1, NO_VARIABLES, ctx);

        assertEquals("f[]", sig.name());
        assertEquals(Collections.singletonList(Tensor.scalar(5)), sig.argValues());
        assertEquals(Arrays.asList(TensorType.of(DataType.FLOAT32, 2, 2), TensorType.of(DataType.INT64, 3)), sig.argTypes());
    }

    public void testSameShapesGiveEqualSignatures() throws CompilationException {
        Signature a = buildSignature(F, 0, NO_VARIABLES, SimpleArgumentContext.of(Tensor.ofFloats(TensorShape.of(2), 1f, 2f)));
        Signature b = buildSignature(F, 0, NO_VARIABLES, SimpleArgumentContext.of(Tensor.ofFloats(TensorShape.of(2), 8f, 9f)));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    public void testParameterTypeComesFromContextNotValue() throws CompilationException {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder()
                .addUnavailable(DataType.FLOAT32, TensorShape.of(4, 4))
                .build();
        Signature sig = buildSignature(F, 0, NO_VARIABLES, ctx);
        assertEquals(Collections.singletonList(TensorType.of(DataType.FLOAT32, 4, 4)), sig.argTypes());
    }

    public void testConstantValueDiscriminates() throws CompilationException {
        Signature a = buildSignature(F, 1, NO_VARIABLES, SimpleArgumentContext.of(Tensor.scalar(1)));
        Signature b = buildSignature(F, 1, NO_VARIABLES, SimpleArgumentContext.of(Tensor.scalar(2)));
        assertFalse(a.equals(b));
    }

    public void testShapeDiscriminates() throws CompilationException {
        Signature a = buildSignature(F, 0, NO_VARIABLES, SimpleArgumentContext.of(Tensor.ofFloats(TensorShape.of(2), 1f, 2f)));
        Signature b = buildSignature(F, 0, NO_VARIABLES, SimpleArgumentContext.of(Tensor.ofFloats(TensorShape.of(1, 2), 1f, 2f)));
        assertFalse(a.equals(b));
    }

    public void testArgumentOrderDiscriminates() throws CompilationException {
        Tensor f = Tensor.scalar(1f);
        Tensor i = Tensor.scalar(1);
        assertFalse(buildSignature(F, 0, NO_VARIABLES, SimpleArgumentContext.of(f, i))
                .equals(buildSignature(F, 0, NO_VARIABLES, SimpleArgumentContext.of(i, f))));
    }

    public void testAttributesDiscriminate() throws CompilationException {
        SimpleArgumentContext ctx = SimpleArgumentContext.of(Tensor.scalar(1f));
        Signature a = buildSignature(new FunctionDescriptor("f", Collections.singletonMap("T", "float")), 0, NO_VARIABLES, ctx);
        Signature b = buildSignature(new FunctionDescriptor("f", Collections.singletonMap("T", "int")), 0, NO_VARIABLES, ctx);
        assertFalse(a.equals(b));
        assertEquals("f[T=float]", a.name());
    }

    public void testAttributeSeparatorsDiscriminate() throws CompilationException {
        SimpleArgumentContext ctx = SimpleArgumentContext.of(Tensor.scalar(1f));
        Map<String, String> twoAttributes = new TreeMap<>();
        twoAttributes.put("a", "1");
        twoAttributes.put("b", "2");
        FunctionDescriptor two = new FunctionDescriptor("f", twoAttributes);
        FunctionDescriptor one = new FunctionDescriptor("f", Collections.singletonMap("a", "1,b=2"));
        FunctionDescriptor bracketed = new FunctionDescriptor("f[a=1,b=2]");

        Signature a = buildSignature(two, 0, NO_VARIABLES, ctx);
        Signature b = buildSignature(one, 0, NO_VARIABLES, ctx);
        Signature c = buildSignature(bracketed, 0, NO_VARIABLES, ctx);

        assertFalse(a.equals(b));
        assertFalse(a.equals(c));
        assertFalse(b.equals(c));
        assertEquals("f[a=1,b=2]", a.name());
        assertEquals("f[a=1\\,b\\=2]", b.name());
        assertEquals("f\\[a\\=1\\,b\\=2\\][]", c.name());
    }

    public void testConstantValueMustMatchDeclaredType() {
        final Tensor value = Tensor.scalar(1f);
        ArgumentContext ctx = new ArgumentContext() {
            @Override
            public int numInputs() {
                return 1;
            }

            @NotNull
            @Override
            public DataType inputType(int index) {
                return DataType.INT32;
            }

            @NotNull
            @Override
            public TensorShape inputShape(int index) {
                return TensorShape.scalar();
            }

            @Override
            public Tensor input(int index) {
                return value;
            }
        };
        try {
            buildSignature(F, 1, NO_VARIABLES, ctx);
            fail("An int32 input holding a float32 value should be rejected");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.INVALID_ARGUMENT, e.code());
            assertTrue(e.getMessage().contains("declared as int32[]"));
        }
    }

    public void testConstantValueMustMatchDeclaredShape() {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder()
                .addUnavailable(DataType.INT32, TensorShape.of(2))
                .build();
        final Tensor value = Tensor.ofInts(TensorShape.of(3), 1, 2, 3);
        ArgumentContext mismatched = new ArgumentContext() {
            @Override
            public int numInputs() {
                return ctx.numInputs();
            }

            @NotNull
            @Override
            public DataType inputType(int index) {
                return ctx.inputType(index);
            }

            @NotNull
            @Override
            public TensorShape inputShape(int index) {
                return ctx.inputShape(index);
            }

            @Override
            public Tensor input(int index) {
                return value;
            }
        };
        try {
            buildSignature(F, 1, NO_VARIABLES, mismatched);
            fail("An int32[2] input holding an int32[3] value should be rejected");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.INVALID_ARGUMENT, e.code());
        }
    }

    public void testVariablesUseTheirCurrentValue() throws CompilationException {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder()
                .add(Tensor.scalar(1f))
                .addResource()
                .build();
        OptionalTensor variable = OptionalTensor.of(Tensor.ofInts(TensorShape.of(3), 1, 2, 3));

        Signature sig = buildSignature(F, 0, Collections.singletonList(variable), ctx);

        assertEquals(Arrays.asList(TensorType.of(DataType.FLOAT32), TensorType.of(DataType.INT32, 3)), sig.argTypes());
        assertTrue(sig.argValues().isEmpty());
    }

    public void testUninitializedVariableDiscriminates() throws CompilationException {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder().addResource().build();
        Signature absent = buildSignature(F, 0, Collections.singletonList(OptionalTensor.absent()), ctx);
        Signature present = buildSignature(F, 0, Collections.singletonList(OptionalTensor.of(Tensor.scalar(0f))), ctx);

        assertFalse(absent.equals(present));
        assertEquals(Collections.singletonList(TensorType.UNINITIALIZED), absent.argTypes());
    }

    public void testUnavailableConstantFails() {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder()
                .addUnavailable(DataType.INT32, TensorShape.scalar())
                .build();
        try {
            buildSignature(F, 1, NO_VARIABLES, ctx);
            fail("Should have failed for a constant without a value");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.FAILED_PRECONDITION, e.code());
            assertTrue(e.getMessage().contains("not yet initialized"));
        }
    }

    public void testResourceConstantIsUnsupported() {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder().addResource().build();
        try {
            buildSignature(F, 1, NO_VARIABLES, ctx);
            fail("A resource cannot be a compile-time constant");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.UNIMPLEMENTED, e.code());
        }
    }

    public void testResourceParameterIsUnsupported() {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder().addResource().build();
        try {
            buildSignature(F, 0, NO_VARIABLES, ctx);
            fail("A resource must be passed as a variable");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.UNIMPLEMENTED, e.code());
        }
    }

    public void testVariableMustBeResource() {
        SimpleArgumentContext ctx = SimpleArgumentContext.of(Tensor.scalar(1f));
        try {
            buildSignature(F, 0, Collections.singletonList(OptionalTensor.absent()), ctx);
            fail("Variable input is not a resource");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.INVALID_ARGUMENT, e.code());
        }
    }

    public void testTooManyArguments() {
        SimpleArgumentContext ctx = SimpleArgumentContext.of(Tensor.scalar(1f));
        try {
            buildSignature(F, 2, NO_VARIABLES, ctx);
            fail("Two constants cannot fit in one input");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.INVALID_ARGUMENT, e.code());
        }
        try {
            buildSignature(F, -1, NO_VARIABLES, ctx);
            fail("Negative constant count");
        } catch (CompilationException e) {
            assertEquals(CompilationStatus.Code.INVALID_ARGUMENT, e.code());
        }
    }

    public void testBuildArguments() throws CompilationException {
        SimpleArgumentContext ctx = SimpleArgumentContext.builder()
                .add(Tensor.scalar(2))
                .add(Tensor.ofFloats(TensorShape.of(2), 1f, 2f))
                .addResource()
                .addResource()
                .build();
        List<Argument> args = buildArguments(1,
                Arrays.asList(OptionalTensor.of(Tensor.scalar(0f)), OptionalTensor.absent()), ctx);

        assertEquals(4, args.size());
        assertEquals(Argument.Kind.CONSTANT, args.get(0).kind());
        assertEquals(Tensor.scalar(2), args.get(0).constantValue());
        assertEquals(Argument.Kind.PARAMETER, args.get(1).kind());
        assertEquals(TensorType.of(DataType.FLOAT32, 2), args.get(1).type());
        assertNull(args.get(1).constantValue());
        assertEquals(Argument.Kind.VARIABLE, args.get(2).kind());
        assertTrue(args.get(2).isInitialized());
        assertEquals(TensorType.of(DataType.FLOAT32), args.get(2).type());
        assertEquals(Argument.Kind.VARIABLE, args.get(3).kind());
        assertFalse(args.get(3).isInitialized());
    }
}
