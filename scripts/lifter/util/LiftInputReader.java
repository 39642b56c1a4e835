/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import domain.ArmOperand;
import domain.ArmRegister;
import domain.CallTarget;
import domain.DecodedFunction;
import domain.DecodedInstruction;
import domain.DefUses;
import domain.FactBundle;
import domain.IndexMode;
import domain.InstructionRecord;
import domain.OperandTable;
import domain.ReachingDefinition;
import domain.XExpr;
import domain.XVariable;

import java.io.Reader;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the decoded functions handed to the ArmLiftFunctions script.
 *
 * <pre>
 * { "functions": [ {
 *     "name": "main", "address": "0x1000",
 *     "operands": [ { "index": 1, "kind": "register", "register": "R0" }, ... ],
 *     "instructions": [ {
 *         "address": "0x1000", "bytes": "0010a0e3",
 *         "tags": [ "MOV", "NONE" ], "args": [ 0, 1, 2 ],
 *         "facts": { "vars": [ ... ], "xprs": [ ... ], "rdefs": [ ... ], ... } } ] } ] }
 * </pre>
 *
 * An instruction without a "facts" object gets an invalid fact bundle.
 */
public class LiftInputReader {
    private static final Logger LOG = LoggerFactory.getLogger(LiftInputReader.class);

    public List<DecodedFunction> read(Reader reader) {
        JsonElement root = JsonParser.parseReader(reader);
        if (!root.isJsonObject() || !root.getAsJsonObject().has("functions")) {
            throw new IllegalArgumentException("Input does not contain a functions array");
        }

        List<DecodedFunction> functions = new ArrayList<>();
        for (JsonElement element : root.getAsJsonObject().getAsJsonArray("functions")) {
            functions.add(readFunction(element.getAsJsonObject()));
        }
        LOG.info("Read {} functions", functions.size());
        return functions;
    }

    public DecodedFunction readFunction(JsonObject object) {
        String name = requireString(object, "name");
        String address = requireString(object, "address");

        OperandTable operands = new OperandTable();
        if (object.has("operands")) {
            for (JsonElement element : object.getAsJsonArray("operands")) {
                JsonObject operand = element.getAsJsonObject();
                operands.put(operand.get("index").getAsInt(), readOperand(operand));
            }
        }

        List<DecodedInstruction> instructions = new ArrayList<>();
        if (object.has("instructions")) {
            for (JsonElement element : object.getAsJsonArray("instructions")) {
                instructions.add(readInstruction(element.getAsJsonObject()));
            }
        }
        return new DecodedFunction(name, address, operands, instructions);
    }

    public ArmOperand readOperand(JsonObject object) {
        String kind = requireString(object, "kind");
        switch (kind) {
            case "register":
                return ArmOperand.register(ArmRegister.fromName(requireString(object, "register")));
            case "indirect-register": {
                ArmRegister register = ArmRegister.fromName(requireString(object, "register"));
                long offset = object.has("offset") ? object.get("offset").getAsLong() : 0;
                IndexMode mode = object.has("mode")
                    ? IndexMode.valueOf(object.get("mode").getAsString().toUpperCase(Locale.ROOT).replace('-', '_'))
                    : IndexMode.OFFSET;
                int size = object.has("size") ? object.get("size").getAsInt() : ArmOperand.WORD_SIZE;
                return ArmOperand.indirectRegister(register, offset, mode, size);
            }
            case "register-list": {
                List<ArmRegister> registers = new ArrayList<>();
                for (JsonElement register : object.getAsJsonArray("registers")) {
                    registers.add(ArmRegister.fromName(register.getAsString()));
                }
                return ArmOperand.registerList(registers);
            }
            case "immediate":
                return ArmOperand.immediate(object.get("value").getAsLong());
            case "absolute":
                return ArmOperand.absolute(
                    DecodedInstruction.parseAddress(requireString(object, "address")));
            default:
                throw new IllegalArgumentException("Unknown operand kind: " + kind);
        }
    }

    public DecodedInstruction readInstruction(JsonObject object) {
        List<String> tags = new ArrayList<>();
        for (JsonElement tag : object.getAsJsonArray("tags")) {
            tags.add(tag.getAsString());
        }
        List<Integer> args = new ArrayList<>();
        if (object.has("args")) {
            for (JsonElement arg : object.getAsJsonArray("args")) {
                args.add(arg.getAsInt());
            }
        }

        FactBundle facts = object.has("facts")
            ? readFacts(object.getAsJsonObject("facts"))
            : FactBundle.invalid();

        return new DecodedInstruction(
            requireString(object, "address"),
            object.has("bytes") ? object.get("bytes").getAsString() : "",
            new InstructionRecord(tags, args),
            facts);
    }

    public FactBundle readFacts(JsonObject object) {
        FactBundle.Builder builder = FactBundle.builder();
        if (object.has("valid")) {
            builder.valid(object.get("valid").getAsBoolean());
        }
        if (object.has("tags")) {
            List<String> tags = new ArrayList<>();
            for (JsonElement tag : object.getAsJsonArray("tags")) {
                tags.add(tag.getAsString());
            }
            builder.tags(tags);
        }
        if (object.has("vars")) {
            List<XVariable> vars = new ArrayList<>();
            for (JsonElement var : object.getAsJsonArray("vars")) {
                vars.add(readVariable(var));
            }
            builder.vars(vars);
        }
        if (object.has("xprs")) {
            List<XExpr> xprs = new ArrayList<>();
            for (JsonElement xpr : object.getAsJsonArray("xprs")) {
                xprs.add(readExpr(xpr));
            }
            builder.xprs(xprs);
        }
        if (object.has("rdefs")) {
            List<ReachingDefinition> rdefs = new ArrayList<>();
            for (JsonElement rdef : object.getAsJsonArray("rdefs")) {
                rdefs.add(rdef.isJsonNull() ? null : readReachingDefinition(rdef.getAsJsonObject()));
            }
            builder.reachingDefinitions(rdefs);
        }
        if (object.has("defuses")) {
            builder.defUses(readDefUses(object.getAsJsonArray("defuses")));
        }
        if (object.has("defuses-high")) {
            builder.defUsesHigh(readDefUses(object.getAsJsonArray("defuses-high")));
        }
        if (object.has("branch-conditions")) {
            builder.branchConditions(object.get("branch-conditions").getAsBoolean());
        }
        if (object.has("call-target")) {
            JsonObject target = object.getAsJsonObject("call-target");
            Long address = target.has("address")
                ? DecodedInstruction.parseAddress(target.get("address").getAsString())
                : null;
            Integer argc = object.has("argument-count") ? object.get("argument-count").getAsInt() : null;
            builder.callTarget(new CallTarget(requireString(target, "name"), address), argc);
        }
        if (object.has("return")) {
            JsonArray ret = object.getAsJsonArray("return");
            builder.returnXpr(readExpr(ret.get(0)), readExpr(ret.get(ret.size() - 1)));
        }
        if (object.has("condition")) {
            builder.instructionCondition(readExpr(object.get("condition")));
        }
        return builder.build();
    }

    // A variable is either a bare name or {"name": ..., "address": ...} for a global.
    public XVariable readVariable(JsonElement element) {
        if (element.isJsonPrimitive()) {
            return new XVariable(element.getAsString());
        }
        JsonObject object = element.getAsJsonObject();
        Long address = object.has("address")
            ? DecodedInstruction.parseAddress(object.get("address").getAsString())
            : null;
        return new XVariable(requireString(object, "name"), address);
    }

    // {"const": n} | {"var": v} | {"op": o, "args": [e1, e2]}
    public XExpr readExpr(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        if (object.has("const")) {
            return XExpr.constant(new BigInteger(object.get("const").getAsString()));
        }
        if (object.has("var")) {
            return XExpr.variable(readVariable(object.get("var")));
        }
        if (object.has("op")) {
            JsonArray args = object.getAsJsonArray("args");
            XExpr[] operands = new XExpr[args.size()];
            for (int i = 0; i < args.size(); i++) {
                operands[i] = readExpr(args.get(i));
            }
            return XExpr.op(object.get("op").getAsString(), operands);
        }
        throw new IllegalArgumentException("Unrecognized expression: " + object);
    }

    private ReachingDefinition readReachingDefinition(JsonObject object) {
        return new ReachingDefinition(requireString(object, "variable"), readStrings(object, "addresses"));
    }

    private List<DefUses> readDefUses(JsonArray array) {
        List<DefUses> result = new ArrayList<>();
        for (JsonElement element : array) {
            if (element.isJsonNull()) {
                result.add(null);
                continue;
            }
            JsonObject object = element.getAsJsonObject();
            result.add(new DefUses(requireString(object, "variable"), readStrings(object, "uses")));
        }
        return result;
    }

    private static List<String> readStrings(JsonObject object, String key) {
        List<String> result = new ArrayList<>();
        if (object.has(key)) {
            for (JsonElement element : object.getAsJsonArray(key)) {
                result.add(element.getAsString());
            }
        }
        return result;
    }

    private static String requireString(JsonObject object, String key) {
        if (!object.has(key) || object.get(key).isJsonNull()) {
            throw new IllegalArgumentException("Missing \"" + key + "\" in " + object);
        }
        return object.get(key).getAsString();
    }
}
