package com.forgelang.compiler.contract;

import com.forgelang.compiler.lexer.Lexer;
import com.forgelang.compiler.parser.Parser;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * ExportManifest 单元测试
 */
class ExportManifestTest {

    private static final String CONTRACT = "#[contract]\n"
            + "mod counter {\n"
            + "    pub struct Counter { value: i32 }\n"
            + "    struct Step { by: i32 }\n"
            + "    impl Counter {\n"
            + "        pub fn new() -> Self { Self { value: 0 } }\n"
            + "        pub fn increment(&mut self, n: i32) { self.value += n; }\n"
            + "        pub fn helper(x: i32, s: Step) -> Option<Self> { None }\n"
            + "    }\n"
            + "    impl Reset for Counter { pub fn reset(&mut self) {} }\n"
            + "}\n";

    private ExpansionResult expand(String source) {
        return new ContractExpander().expand(new Parser(new Lexer(source, "test.fg"), "test.fg").parse());
    }

    @Test
    @DisplayName("单个合约描述为对象")
    void testDescribeContract() {
        ExpansionResult result = expand(CONTRACT);
        JsonObject manifest = ExportManifest.describe(result.getContracts().get(0));

        assertThat(manifest.get("module").getAsString()).isEqualTo("counter");
        assertThat(manifest.get("stateType").getAsString()).isEqualTo("Counter");

        JsonArray exports = manifest.getAsJsonArray("exports");
        assertThat(exports.size()).isEqualTo(3);

        JsonObject increment = exports.get(0).getAsJsonObject();
        assertThat(increment.get("symbol").getAsString()).isEqualTo("increment");
        assertThat(increment.get("dispatch").getAsString()).isEqualTo("state");
        assertThat(increment.get("capability").isJsonNull()).isTrue();
        assertThat(increment.get("returnType").isJsonNull()).isTrue();
        JsonObject argument = increment.getAsJsonArray("arguments").get(0).getAsJsonObject();
        assertThat(argument.get("name").getAsString()).isEqualTo("n");
        assertThat(argument.get("type").getAsString()).isEqualTo("i32");

        JsonObject helper = exports.get(1).getAsJsonObject();
        assertThat(helper.get("dispatch").getAsString()).isEqualTo("static");
        assertThat(helper.getAsJsonArray("arguments").get(1).getAsJsonObject().get("type").getAsString())
                .isEqualTo("counter::Step");
        assertThat(helper.get("returnType").getAsString()).isEqualTo("Option<counter::Counter>");

        JsonObject reset = exports.get(2).getAsJsonObject();
        assertThat(reset.get("dispatch").getAsString()).isEqualTo("capability");
        assertThat(reset.get("capability").getAsString()).isEqualTo("Reset");
    }

    @Test
    @DisplayName("序列化输出保留 null 字段且不转义 HTML 字符")
    void testToJson() {
        String json = ExportManifest.toJson(expand(CONTRACT));

        assertThat(json).contains("\"capability\": null");
        assertThat(json).contains("Option<counter::Counter>");
        JsonElement parsed = JsonParser.parseString(json);
        assertThat(parsed.isJsonObject()).isTrue();
    }

    @Test
    @DisplayName("多个合约描述为数组")
    void testMultipleContracts() {
        String source = CONTRACT + "#[contract]\nmod other { pub struct O; impl O { fn new() -> Self { O } } }";
        JsonElement parsed = JsonParser.parseString(ExportManifest.toJson(expand(source)));

        assertThat(parsed.isJsonArray()).isTrue();
        JsonArray array = parsed.getAsJsonArray();
        assertThat(array.size()).isEqualTo(2);
        assertThat(array.get(1).getAsJsonObject().get("module").getAsString()).isEqualTo("other");
        assertThat(array.get(1).getAsJsonObject().getAsJsonArray("exports").size()).isZero();
    }

    @Test
    @DisplayName("失败的展开不能生成清单")
    void testFailedExpansion() {
        ExpansionResult failed = expand("#[contract]\nmod m { struct Hidden; }");
        assertThatThrownBy(() -> ExportManifest.toJson(failed)).isInstanceOf(IllegalStateException.class);
    }
}
