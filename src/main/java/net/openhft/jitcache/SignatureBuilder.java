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

import java.util.ArrayList;
import java.util.List;

/**
 * Derives {@link Signature}s and compiler {@link Argument}s from the inputs of a call.
 * <p>
 * The inputs of {@code ctx} are expected in the order
 * <ol>
 *   <li>{@code numConstantArgs} compile-time constants, whose values must be available</li>
 *   <li>ordinary parameters, of which only the type and shape matter</li>
 *   <li>one {@link DataType#RESOURCE} handle per entry of {@code variableArgs}</li>
 * </ol>
 */
public enum SignatureBuilder {
    ; // none

    /**
     * Builds the cache key for a call.
     *
     * @param function        the function to compile
     * @param numConstantArgs how many leading inputs are compile-time constants
     * @param variableArgs    snapshot of the resource variables, absent if uninitialized
     * @param ctx             the inputs of the call
     * @return the signature
     * @throws CompilationException if the inputs do not match the counts, a constant is not available or its
     *                              value does not match its declared type and shape, or an input is of a kind
     *                              which cannot be compiled
     */
    @NotNull
    public static Signature buildSignature(@NotNull FunctionDescriptor function,
                                           int numConstantArgs,
                                           @NotNull List<OptionalTensor> variableArgs,
                                           @NotNull ArgumentContext ctx) throws CompilationException {
        int firstVariable = checkArity(numConstantArgs, variableArgs, ctx);

        List<Tensor> argValues = new ArrayList<>(numConstantArgs);
        List<TensorType> argTypes = new ArrayList<>(ctx.numInputs() - numConstantArgs);
        int input = 0;
        for (; input < numConstantArgs; input++)
            argValues.add(constantValue(ctx, input));
        for (; input < firstVariable; input++)
            argTypes.add(parameterType(ctx, input));
        for (OptionalTensor variable : variableArgs) {
            checkResource(ctx, input++);
            argTypes.add(variable.isPresent() ? TensorType.of(variable.value()) : TensorType.UNINITIALIZED);
        }
        return new Signature(function.canonicalName(), argTypes, argValues);
    }

    /**
     * Builds the arguments handed to the compiler, one per input of {@code ctx}.
     *
     * @throws CompilationException for the same reasons as {@link #buildSignature}
     */
    @NotNull
    public static List<Argument> buildArguments(int numConstantArgs,
                                                @NotNull List<OptionalTensor> variableArgs,
                                                @NotNull ArgumentContext ctx) throws CompilationException {
        int firstVariable = checkArity(numConstantArgs, variableArgs, ctx);

        List<Argument> args = new ArrayList<>(ctx.numInputs());
        int input = 0;
        for (; input < numConstantArgs; input++)
            args.add(Argument.constant(constantValue(ctx, input)));
        for (; input < firstVariable; input++)
            args.add(Argument.parameter(parameterType(ctx, input)));
        for (OptionalTensor variable : variableArgs) {
            checkResource(ctx, input++);
            args.add(Argument.variable(variable));
        }
        return args;
    }

    /**
     * @return the index of the first variable input
     */
    private static int checkArity(int numConstantArgs, List<OptionalTensor> variableArgs, ArgumentContext ctx) throws CompilationException {
        int numInputs = ctx.numInputs();
        if (numConstantArgs < 0)
            throw new CompilationException(CompilationStatus.invalidArgument(
                    "Number of constant arguments cannot be negative, was " + numConstantArgs));
        if (numConstantArgs + variableArgs.size() > numInputs)
            throw new CompilationException(CompilationStatus.invalidArgument(
                    numConstantArgs + " constant and " + variableArgs.size() + " variable arguments do not fit in "
                            + numInputs + " inputs"));
        return numInputs - variableArgs.size();
    }

    private static Tensor constantValue(ArgumentContext ctx, int input) throws CompilationException {
        DataType type = ctx.inputType(input);
        if (!type.hasValues())
            throw new CompilationException(CompilationStatus.unimplemented(
                    "Unsupported argument kind " + type + " for compile-time constant argument " + input));
        Tensor value = ctx.input(input);
        if (value == null)
            throw new CompilationException(CompilationStatus.failedPrecondition(
                    "Compile-time constant argument " + input + " not yet initialized"));
        TensorShape shape = ctx.inputShape(input);
        if (value.type() != type || !value.shape().equals(shape))
            throw new CompilationException(CompilationStatus.invalidArgument(
                    "Compile-time constant argument " + input + " is declared as " + type + shape
                            + " but its value is " + value.type() + value.shape()));
        return value;
    }

    private static TensorType parameterType(ArgumentContext ctx, int input) throws CompilationException {
        DataType type = ctx.inputType(input);
        if (!type.hasValues())
            throw new CompilationException(CompilationStatus.unimplemented(
                    "Unsupported argument kind " + type + " for argument " + input));
        return new TensorType(type, ctx.inputShape(input));
    }

    private static void checkResource(ArgumentContext ctx, int input) throws CompilationException {
        DataType type = ctx.inputType(input);
        if (type != DataType.RESOURCE)
            throw new CompilationException(CompilationStatus.invalidArgument(
                    "Expected a resource handle for variable argument " + input + " but got " + type));
    }
}
