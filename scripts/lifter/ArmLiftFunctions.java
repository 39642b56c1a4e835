/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

import arm.FunctionLifter;
import arm.LiftedFunction;

import domain.DecodedFunction;

import util.FunctionAstSerializer;
import util.LiftInputReader;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;

import java.nio.file.Files;
import java.nio.file.Path;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ArmLiftFunctions {
    private static final Logger LOG = LoggerFactory.getLogger(ArmLiftFunctions.class);

    private final String[] scriptArgs;
    private final FunctionLifter lifter;

    public ArmLiftFunctions(String[] scriptArgs) {
        this(scriptArgs, new FunctionLifter());
    }

    /* For test setup purposes, the lifter can be replaced. */
    protected ArmLiftFunctions(String[] scriptArgs, FunctionLifter lifter) {
        this.scriptArgs = scriptArgs == null ? new String[0] : scriptArgs.clone();
        this.lifter = lifter;
    }

    String[] getScriptArgs() {
        return scriptArgs;
    }

    List<DecodedFunction> readFunctions(Path input) throws Exception {
        try (Reader reader = Files.newBufferedReader(input)) {
            return new LiftInputReader().read(reader);
        }
    }

    // A function whose lift fails is logged and left out of the output.
    List<LiftedFunction> liftFunctions(List<DecodedFunction> functions) {
        List<LiftedFunction> lifted = new ArrayList<>();
        for (DecodedFunction function : functions) {
            try {
                lifted.add(lifter.lift(function));
            } catch (RuntimeException e) {
                LOG.error("Failed to lift function {} at {}: {}",
                    function.getName(), function.getEntryAddress(), e.getMessage());
            }
        }
        return lifted;
    }

    void serializeToFile(BufferedWriter writer, String inputName, List<DecodedFunction> functions)
            throws Exception {
        if (writer == null) {
            throw new IllegalArgumentException("Invalid file writer");
        }

        if (functions == null || functions.isEmpty()) {
            throw new IllegalArgumentException("Empty function list");
        }

        try (var serializer = new FunctionAstSerializer(writer, inputName)) {
            serializer.serialize(liftFunctions(functions));
        }
    }

    // The output file is only created once the functions have been lifted.
    void serializeToPath(Path output, String inputName, List<DecodedFunction> functions)
            throws Exception {
        if (functions == null || functions.isEmpty()) {
            throw new IllegalArgumentException("Empty function list");
        }

        List<LiftedFunction> lifted = liftFunctions(functions);
        try (var serializer = new FunctionAstSerializer(Files.newBufferedWriter(output), inputName)) {
            serializer.serialize(lifted);
        }
    }

    void liftSingleFunction() throws Exception {
        if (getScriptArgs().length < 4) {
            throw new IllegalArgumentException(
                "Insufficient arguments. Expected: <function_name> <input_file> <output_file> as argument");
        }
        String functionName = getScriptArgs()[1];
        Path input = Path.of(getScriptArgs()[2]);
        List<DecodedFunction> functions = readFunctions(input).stream()
            .filter(f -> f.getName().equals(functionName))
            .collect(Collectors.toList());
        serializeToPath(Path.of(getScriptArgs()[3]), input.getFileName().toString(), functions);
    }

    void liftAllFunctions() throws Exception {
        if (getScriptArgs().length < 3) {
            throw new IllegalArgumentException(
                "Insufficient arguments. Expected: <input_file> <output_file> as argument");
        }
        Path input = Path.of(getScriptArgs()[1]);
        serializeToPath(Path.of(getScriptArgs()[2]), input.getFileName().toString(), readFunctions(input));
    }

    void runHeadless() throws Exception {
        if (getScriptArgs().length < 1) {
            throw new IllegalArgumentException("mode is not specified for headless execution");
        }

        // Execution mode
        String mode = getScriptArgs()[0];
        LOG.info("Running in mode: {}", mode);
        switch (mode.toLowerCase()) {
            case "single":
                liftSingleFunction();
                break;
            case "all":
                liftAllFunctions();
                break;
            default:
                throw new IllegalArgumentException("Invalid mode: " + mode);
        }
    }

    // Script entry point
    public void run() throws Exception {
        try {
            runHeadless();
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace(new PrintWriter(new OutputStreamWriter(System.err), true));
            throw e;
        }
    }

    public static void main(String[] args) throws Exception {
        new ArmLiftFunctions(args).run();
    }
}
