/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import arm.LiftedFunction;

import ast.AstCompInfo;
import ast.AstInstruction;
import ast.AstProvenance;
import ast.AstVarInfo;
import ast.InstructionSpan;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.stream.JsonWriter;

import domain.DefUses;
import domain.ReachingDefinition;

import java.io.BufferedWriter;

import java.util.List;
import java.util.Map;

// The FunctionAstSerializer is a utility class of the ArmLiftFunctions script.
public class FunctionAstSerializer extends JsonWriter {
    private static final Gson GSON = new Gson();

    private final String inputName;

    public FunctionAstSerializer(BufferedWriter writer, String inputName) {
        super(writer);

        this.inputName = inputName;
    }

    public JsonWriter serialize(List<LiftedFunction> functions) throws Exception {
        beginObject();
        name("input").value(inputName);
        name("functions").beginArray();
        for (LiftedFunction function : functions) {
            serializeFunction(function);
        }
        endArray();
        endObject();

        flush();
        return this;
    }

    private void serializeFunction(LiftedFunction function) throws Exception {
        AstSerializer serializer = new AstSerializer();

        int highLevel = serializer.index(function.getHighLevelBody());
        int lowLevel = serializer.index(function.getLowLevelBody());
        for (AstInstruction instr : function.getHighLevelInstructions()) {
            serializer.index(instr);
        }
        for (AstInstruction instr : function.getLowLevelInstructions()) {
            serializer.index(instr);
        }

        beginObject();
        name("name").value(function.getName());
        name("address").value(function.getEntryAddress());
        name("high-level").value(highLevel);
        name("low-level").value(lowLevel);

        name("instructions");
        serializeIdMap(serializer.getInstructionIndices());
        name("expressions");
        serializeIdMap(serializer.getExpressionIndices());
        name("lvals");
        serializeIdMap(serializer.getLvalIndices());

        name("symbols").beginObject();
        for (Map.Entry<String, AstVarInfo> entry : function.getAstree().getSymbolTable().entrySet()) {
            name(entry.getKey()).value(serializer.index(entry.getValue()));
        }
        endObject();

        name("compinfos").beginObject();
        for (Map.Entry<Integer, AstCompInfo> entry : function.getAstree().getCompInfos().entrySet()) {
            name(entry.getKey().toString()).value(serializer.index(entry.getValue()));
        }
        endObject();

        serializeProvenance(function.getProvenance());

        name("spans").beginObject();
        for (Map.Entry<Integer, InstructionSpan> entry : function.getAstree().getSpanMap().entrySet()) {
            name(entry.getKey().toString()).beginObject();
            name("address").value(entry.getValue().getAddress());
            name("bytes").value(entry.getValue().getBytes());
            endObject();
        }
        endObject();

        name("annotations").beginObject();
        for (Map.Entry<String, String> entry : function.getAnnotations().entrySet()) {
            name(entry.getKey()).value(entry.getValue());
        }
        endObject();

        name("nodes").beginArray();
        for (JsonObject record : serializer.records()) {
            serializeJsonObject(record);
        }
        endArray();

        endObject();
    }

    private void serializeProvenance(AstProvenance provenance) throws Exception {
        name("provenance").beginObject();

        name("instruction-mapping");
        serializeIdMap(provenance.getInstructionMappings());
        name("expression-mapping");
        serializeIdMap(provenance.getExpressionMappings());
        name("lval-mapping");
        serializeIdMap(provenance.getLvalMappings());

        name("reaching-definitions").beginObject();
        for (Map.Entry<Integer, List<ReachingDefinition>> entry
                : provenance.getAllReachingDefinitions().entrySet()) {
            name(entry.getKey().toString()).beginArray();
            for (ReachingDefinition rdef : entry.getValue()) {
                beginObject();
                name("variable").value(rdef.getVariable());
                name("addresses");
                serializeStrings(rdef.getDefinitionAddresses());
                endObject();
            }
            endArray();
        }
        endObject();

        name("lval-defuses");
        serializeDefUses(provenance.getAllLvalDefUses());
        name("lval-defuses-high");
        serializeDefUses(provenance.getAllLvalDefUsesHigh());

        name("instruction-addresses");
        serializeAddressMap(provenance.getAllInstructionAddresses());
        name("condition-addresses");
        serializeAddressMap(provenance.getAllConditionAddresses());

        endObject();
    }

    private void serializeIdMap(Map<Integer, Integer> map) throws Exception {
        beginObject();
        for (Map.Entry<Integer, Integer> entry : map.entrySet()) {
            name(entry.getKey().toString()).value(entry.getValue());
        }
        endObject();
    }

    private void serializeDefUses(Map<Integer, DefUses> map) throws Exception {
        beginObject();
        for (Map.Entry<Integer, DefUses> entry : map.entrySet()) {
            name(entry.getKey().toString()).beginObject();
            name("variable").value(entry.getValue().getVariable());
            name("uses");
            serializeStrings(entry.getValue().getUseAddresses());
            endObject();
        }
        endObject();
    }

    private void serializeAddressMap(Map<Integer, List<String>> map) throws Exception {
        beginObject();
        for (Map.Entry<Integer, List<String>> entry : map.entrySet()) {
            name(entry.getKey().toString());
            serializeStrings(entry.getValue());
        }
        endObject();
    }

    private void serializeStrings(List<String> values) throws Exception {
        beginArray();
        for (String value : values) {
            value(value);
        }
        endArray();
    }

    private void serializeJsonObject(JsonObject object) throws Exception {
        GSON.toJson(object, this);
    }
}
